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

import org.immutables.value.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent state of a saga, derived from its event stream.
 */
@Value.Immutable
public abstract class SagaState {
    /**
     * Marker of {@link #getCurrentStep()} when no step is in progress.
     */
    public static final int NO_STEP = -1;

    public abstract String getSagaId();

    public abstract SagaPhase getPhase();

    /**
     * Hash of step names of the definition, that started the saga.
     * @see SagaDefinition#getStepHash()
     */
    public abstract String getStepHash();

    public abstract Optional<String> getCorrelationId();

    public abstract int getStepCount();

    public abstract Instant getStartedAt();

    /**
     * Index of step that was started, but did not complete or fail yet.
     * @return step index or {@link #NO_STEP}
     */
    public abstract int getCurrentStep();

    /**
     * Indices of completed steps, that were not compensated yet, in order of completion.
     */
    public abstract List<Integer> getCompletedSteps();

    public abstract Optional<Integer> getFailedStep();

    public abstract Optional<String> getFailureCode();

    public abstract Optional<String> getFailureMessage();

    public abstract List<CompensationFailure> getCompensationFailures();

    /**
     * Whether a saga that is {@link SagaPhase#COMPLETED} got there by compensating all of its completed steps.
     */
    public abstract boolean isRolledBack();

    public abstract Optional<Instant> getVerificationDeadline();

    /**
     * Index of the step to execute next.
     */
    public int nextStep() {
        return getCompletedSteps().size();
    }

    /**
     * Index of the step to compensate next.
     * @return step index or {@link #NO_STEP} when all completed steps were compensated
     */
    public int stepToCompensate() {
        List<Integer> completed = getCompletedSteps();
        return completed.isEmpty() ? NO_STEP : completed.get(completed.size() - 1);
    }

    public static SagaPhase phaseOf(SagaState state) {
        return state == null ? SagaPhase.NOT_STARTED : state.getPhase();
    }
}
