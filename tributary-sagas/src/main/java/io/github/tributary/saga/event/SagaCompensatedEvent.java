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
 * All completed steps were compensated, the saga is rolled back.
 */
@Value.Immutable
public interface SagaCompensatedEvent extends SagaEvent {
    Instant getCompletedAt();

    static SagaCompensatedEvent of(Instant completedAt) {
        return ImmutableSagaCompensatedEvent.builder().completedAt(completedAt).build();
    }
}
