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
 * Saga stops executing steps, and starts compensating the completed ones.
 */
@Value.Immutable
public interface SagaCompensationStartedEvent extends SagaEvent {
    String getReason();

    static SagaCompensationStartedEvent of(String reason) {
        return ImmutableSagaCompensationStartedEvent.builder().reason(reason).build();
    }
}
