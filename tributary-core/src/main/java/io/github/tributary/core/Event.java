package io.github.tributary.core;

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

/**
 * Immutable fact about business domain that became true.
 *
 * <p>Every aggregate type defines its own set of events. Events carry only domain payload, the stream they belong to
 * and their position is assigned at append time and available from {@link RecordedEvent}.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific
 * serialization kinds, e. g. Jackson annotations.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package {@link io.github.tributary.immutables}.
 */
public interface Event {
    /**
     * Name of the event type, unique within its aggregate category. Class name stripped of suffix {@code Event} by default.
     * @return type name
     * @see EventType#defaultTypeName(Class)
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /**
     * Version of the event schema. Incompatible changes to the event need to increment the version.
     * @return schema version, 1 by default
     */
    default int getSchemaVersion() {
        return 1;
    }
}
