package io.github.tributary.core.reduce;

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

/**
 * Pure state transition over a single event. Must be deterministic and free of side effects, and must not mutate
 * the state it receives, but return new instance instead.
 *
 * @param <S> type of state
 * @param <E> type of event
 */
@FunctionalInterface
public interface Reducer<S, E extends Event> {
    /**
     * Apply event to state.
     * @param state current state, {@code null} when aggregate's zero state is null
     * @param event event to apply
     * @return new state
     */
    S reduce(S state, E event);
}
