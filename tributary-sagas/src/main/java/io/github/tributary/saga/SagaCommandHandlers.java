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

import io.github.tributary.core.command.Decision;
import io.github.tributary.core.command.Rejection;
import io.github.tributary.core.command.RootCommandHandler;
import io.github.tributary.saga.event.*;

import java.util.EnumSet;
import java.util.Set;

import static io.github.tributary.saga.SagaCommands.*;

/**
 * Enforces the saga state machine. Any command, that is not valid in current phase, is rejected with
 * {@link SagaErrorCodes#INVALID_TRANSITION}.
 */
public final class SagaCommandHandlers {
    private static final Set<SagaPhase> EXECUTING = EnumSet.of(SagaPhase.RUNNING, SagaPhase.AWAITING_VERIFICATION);

    private SagaCommandHandlers() {
    }

    public static RootCommandHandler<SagaState> commandHandler() {
        return RootCommandHandler.<SagaState>builder("saga")
                .on(Start.class, (c, s) -> s != null
                        ? Decision.reject(Rejection.alreadyExists("Saga " + s.getSagaId() + " was already started"))
                        : Decision.accept(SagaStartedEvent.of(c.sagaId, c.stepHash, c.stepCount, c.correlationId,
                                c.startedAt)))
                .on(BeginStep.class, SagaCommandHandlers::beginStep)
                .on(AwaitVerification.class, (c, s) -> isPhase(s, SagaPhase.RUNNING) && s.getCurrentStep() == c.stepIndex
                        ? Decision.accept(SagaStepAwaitingVerificationEvent.of(c.stepIndex, c.stepName, c.deadline))
                        : invalid(s, c))
                .on(CompleteStep.class, SagaCommandHandlers::completeStep)
                .on(FailStep.class, (c, s) -> isExecuting(s)
                        ? Decision.accept(SagaStepFailedEvent.of(c.stepIndex, c.stepName, c.errorCode, c.errorMessage),
                                SagaCompensationStartedEvent.of(c.errorCode))
                        : invalid(s, c))
                .on(CompensateStep.class, (c, s) -> isCompensating(s, c.stepIndex)
                        ? Decision.accept(SagaStepCompensatedEvent.of(c.stepIndex, c.stepName))
                        : invalid(s, c))
                .on(RecordCompensationFailure.class, (c, s) -> isCompensating(s, c.stepIndex)
                        ? Decision.accept(SagaCompensationFailedEvent.of(c.stepIndex, c.stepName, c.errorCode,
                                c.errorMessage))
                        : invalid(s, c))
                .on(CompleteSaga.class, (c, s) -> isPhase(s, SagaPhase.RUNNING) && s.nextStep() == s.getStepCount()
                        ? Decision.accept(SagaCompletedEvent.of(c.completedAt))
                        : invalid(s, c))
                .on(FinishCompensation.class, SagaCommandHandlers::finishCompensation)
                .build();
    }

    private static Decision beginStep(BeginStep command, SagaState state) {
        if (!isPhase(state, SagaPhase.RUNNING)) {
            return invalid(state, command);
        }
        if (!command.stepHash.equals(state.getStepHash())) {
            String message = "Saga " + state.getSagaId() + " was started with steps " + state.getStepHash()
                    + ", but is executed by steps " + command.stepHash;
            return Decision.accept(SagaStepFailedEvent.of(command.stepIndex, command.stepName,
                    SagaErrorCodes.STEP_HASH_MISMATCH, message),
                    SagaCompensationStartedEvent.of(SagaErrorCodes.STEP_HASH_MISMATCH));
        }
        if (command.stepIndex != state.nextStep() || command.stepIndex >= state.getStepCount()) {
            return invalid(state, command);
        }
        return Decision.accept(SagaStepStartedEvent.of(command.stepIndex, command.stepName));
    }

    private static Decision completeStep(CompleteStep command, SagaState state) {
        if (state != null && state.getCompletedSteps().contains(command.stepIndex)) {
            // repeated completion
            return Decision.none();
        }
        if (!isExecuting(state) || state.getCurrentStep() != command.stepIndex) {
            return invalid(state, command);
        }
        return Decision.accept(SagaStepCompletedEvent.of(command.stepIndex, command.stepName));
    }

    private static Decision finishCompensation(FinishCompensation command, SagaState state) {
        if (!isPhase(state, SagaPhase.COMPENSATING) || !state.getCompletedSteps().isEmpty()) {
            return invalid(state, command);
        }
        if (state.getCompensationFailures().isEmpty()) {
            return Decision.accept(SagaCompensatedEvent.of(command.completedAt));
        }
        return Decision.accept(SagaFailedEvent.of(SagaErrorCodes.COMPENSATION_FAILED,
                state.getCompensationFailures().size() + " step(s) could not be compensated: "
                        + state.getCompensationFailures(), command.completedAt));
    }

    private static boolean isPhase(SagaState state, SagaPhase phase) {
        return SagaState.phaseOf(state) == phase;
    }

    private static boolean isExecuting(SagaState state) {
        return EXECUTING.contains(SagaState.phaseOf(state));
    }

    /**
     * Compensation must proceed from the most recently completed step.
     */
    private static boolean isCompensating(SagaState state, int stepIndex) {
        return isPhase(state, SagaPhase.COMPENSATING) && state.stepToCompensate() == stepIndex;
    }

    private static Decision invalid(SagaState state, Object command) {
        return Decision.reject(SagaErrorCodes.INVALID_TRANSITION,
                command + " is not valid in phase " + SagaState.phaseOf(state));
    }
}
