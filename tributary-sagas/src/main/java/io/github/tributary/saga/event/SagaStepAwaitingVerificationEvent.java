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

import java.time.Instant;

/**
 * Command of the step succeeded, and its effect will be verified until the deadline.
 */
@Value.Immutable
public interface SagaStepAwaitingVerificationEvent extends SagaStepEvent {
    Instant getDeadline();

    static SagaStepAwaitingVerificationEvent of(int stepIndex, String stepName, Instant deadline) {
        return ImmutableSagaStepAwaitingVerificationEvent.builder()
                .stepIndex(stepIndex)
                .stepName(stepName)
                .deadline(deadline)
                .build();
    }
}
