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

@Value.Immutable
public interface SagaFailedEvent extends SagaEvent {
    String getErrorCode();

    String getErrorMessage();

    Instant getFailedAt();

    static SagaFailedEvent of(String errorCode, String errorMessage, Instant failedAt) {
        return ImmutableSagaFailedEvent.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .failedAt(failedAt)
                .build();
    }
}
