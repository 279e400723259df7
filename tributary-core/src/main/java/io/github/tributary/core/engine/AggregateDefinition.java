package io.github.tributary.core.engine;

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

import io.github.tributary.core.Event;
import io.github.tributary.core.EventType;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.command.RootCommandHandler;
import io.github.tributary.core.reduce.RootReducer;

import java.util.Objects;

/**
 * Everything that defines an aggregate type: where its streams live, how its state is reduced and how its commands
 * are validated.
 *
 * @param <S> type of state
 */
public final class AggregateDefinition<S> {
    private final String module;
    private final String category;
    private final RootReducer<S> reducer;
    private final RootCommandHandler<S> commandHandler;

    public AggregateDefinition(String module, String category, RootReducer<S> reducer,
            RootCommandHandler<S> commandHandler) {
        this.module = Objects.requireNonNull(module, "Module must be specified");
        this.category = Objects.requireNonNull(category, "Category must be specified");
        this.reducer = Objects.requireNonNull(reducer, "Reducer must be specified");
        this.commandHandler = Objects.requireNonNull(commandHandler, "Command handler must be specified");
    }

    public String getModule() {
        return module;
    }

    public String getCategory() {
        return category;
    }

    public String getName() {
        return module + "." + category;
    }

    public RootReducer<S> getReducer() {
        return reducer;
    }

    public RootCommandHandler<S> getCommandHandler() {
        return commandHandler;
    }

    public StreamKey streamKey(String id) {
        return StreamKey.of(module, category, id);
    }

    public boolean owns(StreamKey key) {
        return key.belongsTo(module, category);
    }

    public EventType eventType(Event event) {
        return EventType.of(module, category, event.getType(), event.getSchemaVersion());
    }
}
