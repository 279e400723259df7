package io.github.tributary.immutables;

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

/**
 * Base for events generated by Immutables. Type name is derived from the abstract value type, stripping prefix
 * {@code Immutable} of generated class and suffix {@code Event}.
 */
public interface ImmutableEvent extends Event {
    @Override
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }
}
