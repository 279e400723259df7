package io.github.tributary.core.command;

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

import io.github.tributary.core.Command;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes commands to their handlers by command class. The registry is built once, commands without handler are
 * rejected with {@link ErrorCodes#COMMAND_HANDLER_NOT_FOUND}.
 *
 * @param <S> type of state
 */
public final class RootCommandHandler<S> {
    private final String name;
    private final Map<Class<?>, CommandHandler<S, Command>> handlers;
    private final ConcurrentMap<Class<?>, CommandHandler<S, Command>> resolved = new ConcurrentHashMap<>();

    private RootCommandHandler(String name, Map<Class<?>, CommandHandler<S, Command>> handlers) {
        this.name = name;
        this.handlers = handlers;
    }

    public static <S> Builder<S> builder(String name) {
        return new Builder<>(name);
    }

    public Decision handle(Command command, S state) {
        Objects.requireNonNull(command, "Command must be specified");
        CommandHandler<S, Command> handler = resolve(command.getClass());
        if (handler == null) {
            return Decision.reject(ErrorCodes.COMMAND_HANDLER_NOT_FOUND,
                    "No handler for command " + command.getClass().getSimpleName() + " in " + name);
        }
        return handler.handle(command, state);
    }

    public boolean handles(Class<? extends Command> commandClass) {
        return resolve(commandClass) != null;
    }

    private CommandHandler<S, Command> resolve(Class<?> commandClass) {
        CommandHandler<S, Command> handler = resolved.get(commandClass);
        if (handler == null) {
            handler = handlers.get(commandClass);
            if (handler == null) {
                for (Map.Entry<Class<?>, CommandHandler<S, Command>> entry : handlers.entrySet()) {
                    if (entry.getKey().isAssignableFrom(commandClass)) {
                        handler = entry.getValue();
                        break;
                    }
                }
            }
            if (handler != null) {
                resolved.putIfAbsent(commandClass, handler);
            }
        }
        return handler;
    }

    public static class Builder<S> {
        private final String name;
        private final Map<Class<?>, CommandHandler<S, Command>> handlers = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
        }

        public <C extends Command> Builder<S> on(Class<C> commandClass, CommandHandler<S, C> handler) {
            Objects.requireNonNull(commandClass, "Command class must be specified");
            Objects.requireNonNull(handler, "Handler must be specified");
            CommandHandler<S, Command> checked = (command, state) -> handler.handle(commandClass.cast(command), state);
            if (handlers.putIfAbsent(commandClass, checked) != null) {
                throw new IllegalStateException("Handler for " + commandClass.getName() + " already registered in " + name);
            }
            return this;
        }

        public RootCommandHandler<S> build() {
            return new RootCommandHandler<>(name, new LinkedHashMap<>(handlers));
        }
    }
}
