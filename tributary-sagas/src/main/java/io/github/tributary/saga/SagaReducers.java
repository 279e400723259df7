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

import io.github.tributary.core.reduce.RootReducer;
import io.github.tributary.saga.event.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds saga events into {@link SagaState}. Completed steps are only ever added while the saga runs, and only
 * removed, from the end, while it compensates.
 */
public final class SagaReducers {
    private SagaReducers() {
    }

    public static RootReducer<SagaState> reducer() {
        return RootReducer.<SagaState>builder("saga")
                .on(SagaStartedEvent.class, (s, e) -> ImmutableSagaState.builder()
                        .sagaId(e.getSagaId())
                        .phase(SagaPhase.RUNNING)
                        .stepHash(e.getStepHash())
                        .correlationId(e.getCorrelationId())
                        .stepCount(e.getStepCount())
                        .startedAt(e.getStartedAt())
                        .currentStep(SagaState.NO_STEP)
                        .rolledBack(false)
                        .build())
                .on(SagaStepStartedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.RUNNING)
                        .currentStep(e.getStepIndex())
                        .verificationDeadline(Optional.empty())
                        .build())
                .on(SagaStepAwaitingVerificationEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.AWAITING_VERIFICATION)
                        .verificationDeadline(Optional.of(e.getDeadline()))
                        .build())
                .on(SagaStepCompletedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.RUNNING)
                        .currentStep(SagaState.NO_STEP)
                        .completedSteps(append(s.getCompletedSteps(), e.getStepIndex()))
                        .verificationDeadline(Optional.empty())
                        .build())
                .on(SagaStepFailedEvent.class, (s, e) -> change(s)
                        .currentStep(SagaState.NO_STEP)
                        .failedStep(Optional.of(e.getStepIndex()))
                        .failureCode(Optional.of(e.getErrorCode()))
                        .failureMessage(Optional.of(e.getErrorMessage()))
                        .verificationDeadline(Optional.empty())
                        .build())
                .on(SagaCompensationStartedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.COMPENSATING)
                        .build())
                .on(SagaStepCompensatedEvent.class, (s, e) -> change(s)
                        .completedSteps(dropLast(s.getCompletedSteps()))
                        .build())
                .on(SagaCompensationFailedEvent.class, (s, e) -> change(s)
                        .completedSteps(dropLast(s.getCompletedSteps()))
                        .compensationFailures(append(s.getCompensationFailures(), new CompensationFailure(
                                e.getStepIndex(), e.getStepName(), e.getErrorCode(), e.getErrorMessage())))
                        .build())
                .on(SagaCompletedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.COMPLETED)
                        .build())
                .on(SagaCompensatedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.COMPLETED)
                        .rolledBack(true)
                        .build())
                .on(SagaFailedEvent.class, (s, e) -> change(s)
                        .phase(SagaPhase.FAILED)
                        .build())
                .build();
    }

    private static ImmutableSagaState.Builder change(SagaState state) {
        return ImmutableSagaState.builder().from(state);
    }

    private static <T> List<T> append(List<T> list, T element) {
        List<T> result = new ArrayList<>(list);
        result.add(element);
        return result;
    }

    private static <T> List<T> dropLast(List<T> list) {
        return list.isEmpty() ? list : list.subList(0, list.size() - 1);
    }
}
