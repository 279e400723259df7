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

/**
 * Validates a command against current state of an aggregate.
 *
 * <p>Handler must not mutate the state, and must be deterministic - no reading of wall clock or random numbers.
 * Timestamps the events need should be part of the command. Refusals are returned as {@link Decision#reject(Rejection)},
 * not thrown.</p>
 *
 * @param <S> type of state
 * @param <C> type of command
 */
@FunctionalInterface
public interface CommandHandler<S, C extends Command> {
    Decision handle(C command, S state);
}
