package io.github.tributary.core.projection;

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
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;

import java.util.List;

/**
 * Notified by {@link io.github.tributary.core.engine.AggregateEngine} after events were durably appended and the
 * engine's own state cache was updated.
 */
@FunctionalInterface
public interface AppendListener {
    /**
     * @param key the stream
     * @param previous version before the append
     * @param current version after the append
     * @param events appended events, in order
     */
    void onAppended(StreamKey key, StreamPosition previous, StreamPosition current, List<? extends Event> events);
}
