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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Single step of a saga.
 *
 * <p>Steps execute at least once: a saga resumed after its step was started, but before the outcome was recorded,
 * executes the step again. Commands issued by steps should therefore be idempotent, or guarded by expected
 * version.</p>
 *
 * <p>Failures are reported as {@linkplain StepResult#failed(String, String) failed results}. Exceptions thrown, or
 * exceptional completion of returned stage, fail the step with {@link SagaErrorCodes#STEP_EXCEPTION}.</p>
 *
 * @param <D> type of saga data
 */
public interface SagaStep<D> {
    /**
     * Name of the step, unique within the saga.
     */
    String getName();

    CompletionStage<StepResult> execute(SagaContext<D> context);

    /**
     * Verification the engine waits for after successful execution.
     */
    default Optional<StepVerification<D>> verification() {
        return Optional.empty();
    }

    /**
     * Deadline of single execution or compensation. Empty uses {@link SagaConfiguration#getStepTimeout()}.
     */
    default Optional<Duration> timeout() {
        return Optional.empty();
    }

    /**
     * Whether the step can be undone. A step that cannot is treated as compensated.
     */
    default boolean isCompensatable() {
        return false;
    }

    /**
     * Undo effect of successful execution.
     */
    default CompletionStage<StepResult> compensate(SagaContext<D> context) {
        return CompletableFuture.completedFuture(StepResult.succeeded());
    }
}
