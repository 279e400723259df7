package io.github.tributary.saga;

/*-
 * #%L
 * tributary
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.tributary.core.Command;
import io.github.tributary.core.Event;
import io.github.tributary.core.QuerySnapshot;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.command.ErrorCodes;
import io.github.tributary.core.command.Rejection;
import io.github.tributary.core.dispatch.Dispatcher;
import io.github.tributary.core.engine.AggregateEngine;
import io.github.tributary.saga.event.SagaCompensatedEvent;
import io.github.tributary.saga.event.SagaCompensationStartedEvent;
import io.github.tributary.saga.event.SagaCompletedEvent;
import io.github.tributary.saga.event.SagaEvent;
import io.github.tributary.saga.event.SagaFailedEvent;
import io.github.tributary.saga.event.SagaStartedEvent;
import io.github.tributary.saga.event.SagaStepAwaitingVerificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static io.github.tributary.saga.SagaCommands.*;

/**
 * Runs sagas of one definition.
 *
 * <p>Every transition is first recorded in the saga's stream through the {@link AggregateEngine} of the saga
 * aggregate, and only then acted upon. The flow of a saga:</p>
 * <ol>
 *     <li>record start with hash of the definition's steps</li>
 *     <li>for every step in order: record its start, execute it, and if it defines verification, record the deadline
 *     and poll the verification until it holds or the deadline passes. Record completion of the step</li>
 *     <li>when all steps complete, record completion of the saga</li>
 *     <li>when a step fails or its verification times out, record the failure and compensate completed steps, most
 *     recently completed first. Failed compensation is recorded, and the next one proceeds</li>
 *     <li>when no completed steps are left, record the saga as rolled back, or as failed when any compensation
 *     failed</li>
 * </ol>
 *
 * @param <D> type of data the saga operates on. It is not persisted, and must be provided again to
 *           {@link #resume(String, Object)}
 */
public class SagaEngine<D> {
    private static final Logger logger = LoggerFactory.getLogger(SagaEngine.class);

    private static final List<Class<? extends SagaEvent>> PHASE_CHANGES = Arrays.asList(SagaStartedEvent.class,
            SagaStepAwaitingVerificationEvent.class, SagaCompensationStartedEvent.class, SagaCompletedEvent.class,
            SagaCompensatedEvent.class, SagaFailedEvent.class);

    private final SagaDefinition<D> definition;
    private final AggregateEngine<SagaState> sagas;
    private final SagaConfiguration configuration;
    private final Clock clock;

    public SagaEngine(SagaDefinition<D> definition, AggregateEngine<SagaState> sagas, SagaConfiguration configuration) {
        this.definition = Objects.requireNonNull(definition, "Definition must be specified");
        this.sagas = Objects.requireNonNull(sagas, "Saga aggregate engine must be specified");
        this.configuration = Objects.requireNonNull(configuration, "Configuration must be specified");
        this.clock = configuration.getClock();
    }

    public SagaDefinition<D> getDefinition() {
        return definition;
    }

    public CompletableFuture<SagaState> start(String sagaId, D data) {
        return start(sagaId, null, data);
    }

    /**
     * Start new saga.
     * @param sagaId id of the saga, unique within the saga type
     * @param correlationId optional id correlating the saga with its trigger
     * @param data the data steps operate on
     * @return future completing with terminal state of the saga. Completes exceptionally with
     *     {@link CompensationFailedException} when the saga ends {@link SagaPhase#FAILED}, and with {@link SagaException}
     *     when the saga could not be started, e. g. because saga with same id already exists.
     */
    public CompletableFuture<SagaState> start(String sagaId, String correlationId, D data) {
        StreamKey key = sagas.getDefinition().streamKey(sagaId);
        logger.info("Starting saga {} of {} steps", key, definition.getStepCount());
        Start start = new Start(sagaId, definition.getStepHash(), definition.getStepCount(),
                Optional.ofNullable(correlationId), clock.instant());
        return record(key, start).thenCompose(state -> advance(key, state, data)).toCompletableFuture();
    }

    /**
     * Continue a saga from its recorded phase. A step, that was started but whose outcome was not recorded, is
     * executed again. Saga that already finished is returned as is.
     * @param sagaId id of the saga
     * @param data the data steps operate on
     * @return future completing as in {@link #start(String, String, Object)}
     */
    public CompletableFuture<SagaState> resume(String sagaId, D data) {
        StreamKey key = sagas.getDefinition().streamKey(sagaId);
        return sagas.read(key).thenCompose(snapshot -> {
            SagaState state = snapshot.getState();
            if (state == null) {
                return failed(new SagaException(ErrorCodes.NOT_FOUND, "Saga " + key + " was not started"));
            }
            logger.info("Resuming saga {} in phase {}", key, state.getPhase());
            return advance(key, state, data);
        });
    }

    public CompletableFuture<QuerySnapshot<SagaState>> status(String sagaId) {
        return sagas.read(sagas.getDefinition().streamKey(sagaId));
    }

    private CompletionStage<SagaState> advance(StreamKey key, SagaState state, D data) {
        switch (state.getPhase()) {
            case RUNNING:
                if (state.nextStep() >= definition.getStepCount()) {
                    return record(key, new CompleteSaga(clock.instant())).thenCompose(s -> advance(key, s, data));
                }
                return executeStep(key, state, state.nextStep(), data);
            case AWAITING_VERIFICATION:
                return verifyStep(key, state, state.getCurrentStep(), data);
            case COMPENSATING:
                return compensateStep(key, state, data);
            case COMPLETED:
                logger.info("Saga {} completed{}", key, state.isRolledBack() ? " by rolling back" : "");
                return CompletableFuture.completedFuture(state);
            case FAILED:
                logger.error("Saga {} failed and needs manual remediation. Failed compensations: {}", key,
                        state.getCompensationFailures());
                return failed(new CompensationFailedException(state));
            default:
                return failed(new SagaException(SagaErrorCodes.INVALID_TRANSITION,
                        "Saga " + key + " cannot advance from phase " + state.getPhase()));
        }
    }

    private CompletionStage<SagaState> executeStep(StreamKey key, SagaState state, int index, D data) {
        if (!definition.hasStep(index)) {
            return record(key, new FailStep(index, "#" + index, SagaErrorCodes.STEP_NOT_FOUND,
                    "Saga " + definition.getName() + " has no step " + index))
                    .thenCompose(s -> advance(key, s, data));
        }
        SagaStep<D> step = definition.getStep(index);
        SagaContext<D> context = context(state, index, data);
        return record(key, new BeginStep(index, step.getName(), definition.getStepHash())).thenCompose(started -> {
            if (started.getPhase() != SagaPhase.RUNNING) {
                logger.warn("Saga {} was started by different definition than {}", key, definition.getName());
                return advance(key, started, data);
            }
            logger.debug("Saga {} executing step {}", key, step.getName());
            return invoke(step, () -> step.execute(context)).thenCompose(result -> {
                if (!result.isSucceeded()) {
                    logger.warn("Saga {} step {} failed: {}", key, step.getName(), result);
                    return record(key, new FailStep(index, step.getName(), result.getErrorCode(),
                            result.getErrorMessage()));
                }
                Optional<StepVerification<D>> verification = step.verification();
                if (verification.isPresent()) {
                    Instant deadline = clock.instant().plus(verification.get().getTimeout());
                    return record(key, new AwaitVerification(index, step.getName(), deadline));
                }
                return record(key, new CompleteStep(index, step.getName()));
            }).thenCompose(s -> advance(key, s, data));
        });
    }

    private CompletionStage<SagaState> verifyStep(StreamKey key, SagaState state, int index, D data) {
        SagaStep<D> step = definition.getStep(index);
        Optional<StepVerification<D>> verification = step.verification();
        if (!verification.isPresent()) {
            return record(key, new CompleteStep(index, step.getName())).thenCompose(s -> advance(key, s, data));
        }
        Instant deadline = state.getVerificationDeadline().orElseGet(clock::instant);
        return new VerificationPoll(step, verification.get(), context(state, index, data), deadline).start()
                .thenCompose(satisfied -> {
                    if (satisfied) {
                        return record(key, new CompleteStep(index, step.getName()));
                    }
                    logger.warn("Saga {} step {} was not verified until {}", key, step.getName(), deadline);
                    return record(key, new FailStep(index, step.getName(), SagaErrorCodes.STEP_TIMEOUT,
                            "Step " + step.getName() + " was not verified until " + deadline));
                })
                .thenCompose(s -> advance(key, s, data));
    }

    private CompletionStage<SagaState> compensateStep(StreamKey key, SagaState state, D data) {
        int index = state.stepToCompensate();
        if (index == SagaState.NO_STEP) {
            return record(key, new FinishCompensation(clock.instant())).thenCompose(s -> advance(key, s, data));
        }
        if (!definition.hasStep(index)) {
            return record(key, new RecordCompensationFailure(index, "#" + index, SagaErrorCodes.STEP_NOT_FOUND,
                    "Saga " + definition.getName() + " has no step " + index))
                    .thenCompose(s -> advance(key, s, data));
        }
        SagaStep<D> step = definition.getStep(index);
        if (!step.isCompensatable()) {
            logger.debug("Saga {} step {} needs no compensation", key, step.getName());
            return record(key, new CompensateStep(index, step.getName())).thenCompose(s -> advance(key, s, data));
        }
        logger.debug("Saga {} compensating step {}", key, step.getName());
        return invoke(step, () -> step.compensate(context(state, index, data))).thenCompose(result -> {
            if (result.isSucceeded()) {
                return record(key, new CompensateStep(index, step.getName()));
            }
            logger.error("Saga {} could not compensate step {}: {}", key, step.getName(), result);
            return record(key, new RecordCompensationFailure(index, step.getName(), result.getErrorCode(),
                    result.getErrorMessage()));
        }).thenCompose(s -> advance(key, s, data));
    }

    private SagaContext<D> context(SagaState state, int index, D data) {
        return new SagaContext<>(state.getSagaId(), state.getCorrelationId(), data, index);
    }

    /**
     * Run step action, turning exceptions into failed result. An action outliving the step's deadline fails with
     * {@link SagaErrorCodes#STEP_TIMEOUT}, its late outcome is ignored.
     */
    private CompletionStage<StepResult> invoke(SagaStep<D> step, Supplier<CompletionStage<StepResult>> action) {
        CompletionStage<StepResult> stage;
        try {
            stage = Objects.requireNonNull(action.get(), "Step returned null");
        } catch (RuntimeException e) {
            stage = failed(e);
        }
        CompletableFuture<StepResult> outcome = new CompletableFuture<>();
        Optional<Duration> timeout = step.timeout().isPresent() ? step.timeout() : configuration.getStepTimeout();
        ScheduledFuture<?> expiry = timeout.isPresent()
                ? configuration.getSchedulerService().schedule(() -> {
                    if (outcome.complete(StepResult.failed(SagaErrorCodes.STEP_TIMEOUT,
                            "Step " + step.getName() + " did not finish within " + timeout.get()))) {
                        logger.warn("Step {} did not finish within {}", step.getName(), timeout.get());
                    }
                }, timeout.get().toMillis(), TimeUnit.MILLISECONDS)
                : null;
        stage.whenComplete((result, t) -> {
            if (expiry != null) {
                expiry.cancel(false);
            }
            if (t == null) {
                outcome.complete(result);
                return;
            }
            Throwable cause = Dispatcher.unwrapCompletionException(t);
            logger.warn("Step {} threw exception", step.getName(), cause);
            outcome.complete(StepResult.failed(SagaErrorCodes.STEP_EXCEPTION, String.valueOf(cause)));
        });
        return outcome;
    }

    /**
     * Record a transition in saga's stream.
     * @return the state after transition
     */
    private CompletionStage<SagaState> record(StreamKey key, Command command) {
        return sagas.execute(key, command).thenApply(result -> {
            if (result.isAccepted()) {
                SagaState state = result.getSnapshot().getState();
                if (result.getEvents().stream().anyMatch(SagaEngine::changesPhase)) {
                    logger.info("Saga {} entered phase {}", key, state.getPhase());
                }
                return state;
            }
            Rejection rejection = result.asRejection();
            throw new SagaException(rejection.getCode(), "Saga " + key + " refused " + command + ": "
                    + rejection.getMessage());
        });
    }

    private static boolean changesPhase(Event event) {
        return PHASE_CHANGES.stream().anyMatch(type -> type.isInstance(event));
    }

    private static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    /**
     * Polls verification of a step on the scheduler, until it holds or deadline passes. Failing checks are logged and
     * polled again. The deadline also ends a check that is still pending, its late answer is ignored.
     */
    private class VerificationPoll implements Runnable {
        private final SagaStep<D> step;
        private final StepVerification<D> verification;
        private final SagaContext<D> context;
        private final Instant deadline;
        private final CompletableFuture<Boolean> result = new CompletableFuture<>();

        VerificationPoll(SagaStep<D> step, StepVerification<D> verification, SagaContext<D> context,
                Instant deadline) {
            this.step = step;
            this.verification = verification;
            this.context = context;
            this.deadline = deadline;
        }

        CompletableFuture<Boolean> start() {
            long remaining = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
            ScheduledFuture<?> expiry = configuration.getSchedulerService().schedule(this::expire, remaining,
                    TimeUnit.MILLISECONDS);
            result.whenComplete((satisfied, t) -> expiry.cancel(false));
            run();
            return result;
        }

        private void expire() {
            if (result.complete(false)) {
                logger.debug("Verification of step {} in {} reached deadline {}", step.getName(), context, deadline);
            }
        }

        @Override
        public void run() {
            if (result.isDone()) {
                return;
            }
            CompletionStage<Boolean> check;
            try {
                check = verification.getCheck().isSatisfied(context);
            } catch (RuntimeException e) {
                check = failed(e);
            }
            check.whenComplete((satisfied, t) -> {
                if (result.isDone()) {
                    logger.debug("Verification of step {} in {} answered after deadline", step.getName(), context);
                    return;
                }
                if (t != null) {
                    logger.warn("Verification of step {} in {} failed", step.getName(), context,
                            Dispatcher.unwrapCompletionException(t));
                }
                if (Boolean.TRUE.equals(satisfied)) {
                    result.complete(true);
                } else if (!clock.instant().isBefore(deadline)) {
                    result.complete(false);
                } else {
                    long interval = verification.getInterval().orElse(configuration.getPollInterval()).toMillis();
                    configuration.getSchedulerService().schedule(this, interval, TimeUnit.MILLISECONDS);
                }
            });
        }
    }
}
