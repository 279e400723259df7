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
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.dispatch.Dispatcher;
import io.github.tributary.core.engine.AggregateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Step issuing a command to an aggregate. Accepted command is success, rejection or conflict fails the step with
 * the code of the rejection.
 * <pre>
 *     CommandStep.&lt;Transfer, AccountState&gt;builder("withdraw", accounts)
 *         .target(ctx -&gt; accounts.getDefinition().streamKey(ctx.getData().getFrom()))
 *         .command(ctx -&gt; new Withdraw(ctx.getData().getAmount()))
 *         .compensation(ctx -&gt; new Deposit(ctx.getData().getAmount()))
 *         .build();
 * </pre>
 *
 * @param <D> type of saga data
 * @param <S> state of target aggregate
 */
public final class CommandStep<D, S> implements SagaStep<D> {
    private static final Logger logger = LoggerFactory.getLogger(CommandStep.class);

    private final String name;
    private final AggregateEngine<S> engine;
    private final Function<SagaContext<D>, StreamKey> target;
    private final Function<SagaContext<D>, ? extends Command> command;
    private final Function<SagaContext<D>, ? extends Command> compensation;
    private final StepVerification<D> verification;

    private CommandStep(Builder<D, S> builder) {
        this.name = builder.name;
        this.engine = builder.engine;
        this.target = Objects.requireNonNull(builder.target, "Target must be specified");
        this.command = Objects.requireNonNull(builder.command, "Command must be specified");
        this.compensation = builder.compensation;
        this.verification = builder.verification;
    }

    public static <D, S> Builder<D, S> builder(String name, AggregateEngine<S> engine) {
        return new Builder<>(name, engine);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletionStage<StepResult> execute(SagaContext<D> context) {
        return issue(context, command);
    }

    @Override
    public Optional<StepVerification<D>> verification() {
        return Optional.ofNullable(verification);
    }

    @Override
    public boolean isCompensatable() {
        return compensation != null;
    }

    @Override
    public CompletionStage<StepResult> compensate(SagaContext<D> context) {
        if (compensation == null) {
            return CompletableFuture.completedFuture(StepResult.succeeded());
        }
        return issue(context, compensation);
    }

    private CompletionStage<StepResult> issue(SagaContext<D> context,
            Function<SagaContext<D>, ? extends Command> factory) {
        try {
            StreamKey key = target.apply(context);
            Command cmd = factory.apply(context);
            return engine.execute(key, cmd).handle((result, t) -> {
                if (t != null) {
                    Throwable cause = Dispatcher.unwrapCompletionException(t);
                    logger.warn("Step {} of {} failed issuing {} to {}", name, context, cmd, key, cause);
                    return StepResult.failed(SagaErrorCodes.STEP_EXCEPTION, String.valueOf(cause));
                }
                return result.isAccepted() ? StepResult.succeeded() : StepResult.failed(result.asRejection());
            });
        } catch (RuntimeException e) {
            logger.warn("Step {} of {} could not issue its command", name, context, e);
            return CompletableFuture.completedFuture(
                    StepResult.failed(SagaErrorCodes.STEP_EXCEPTION, String.valueOf(e)));
        }
    }

    @Override
    public String toString() {
        return "CommandStep[" + name + " on " + engine.getDefinition().getName() + "]";
    }

    public static class Builder<D, S> {
        private final String name;
        private final AggregateEngine<S> engine;
        private Function<SagaContext<D>, StreamKey> target;
        private Function<SagaContext<D>, ? extends Command> command;
        private Function<SagaContext<D>, ? extends Command> compensation;
        private StepVerification<D> verification;

        private Builder(String name, AggregateEngine<S> engine) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
            this.engine = Objects.requireNonNull(engine, "Engine must be specified");
        }

        public Builder<D, S> target(Function<SagaContext<D>, StreamKey> target) {
            this.target = target;
            return this;
        }

        public Builder<D, S> command(Function<SagaContext<D>, ? extends Command> command) {
            this.command = command;
            return this;
        }

        /**
         * Command undoing the effect of the step's command, issued to the same stream.
         */
        public Builder<D, S> compensation(Function<SagaContext<D>, ? extends Command> compensation) {
            this.compensation = compensation;
            return this;
        }

        public Builder<D, S> verification(StepVerification<D> verification) {
            this.verification = verification;
            return this;
        }

        public CommandStep<D, S> build() {
            return new CommandStep<>(this);
        }
    }
}
