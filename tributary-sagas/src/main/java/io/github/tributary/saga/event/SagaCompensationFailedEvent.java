package io.github.tributary.saga.event;

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

/**
 * Compensation of a step could not be applied. The step is not compensated again, the sweep continues with previous
 * step.
 */
@Value.Immutable
public interface SagaCompensationFailedEvent extends SagaStepEvent {
    String getErrorCode();

    String getErrorMessage();

    static SagaCompensationFailedEvent of(int stepIndex, String stepName, String errorCode, String errorMessage) {
        return ImmutableSagaCompensationFailedEvent.builder()
                .stepIndex(stepIndex)
                .stepName(stepName)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}
