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

import io.github.tributary.core.engine.AggregateDefinition;

/**
 * Sagas are aggregates. Streams of a saga type are keyed {@code module|sagaName|sagaId}.
 */
public final class SagaAggregate {
    private SagaAggregate() {
    }

    public static AggregateDefinition<SagaState> definition(String module, String sagaName) {
        return new AggregateDefinition<>(module, sagaName, SagaReducers.reducer(), SagaCommandHandlers.commandHandler());
    }
}
