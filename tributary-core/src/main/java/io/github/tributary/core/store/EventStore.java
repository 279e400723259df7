package io.github.tributary.core.store;

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
import java.util.concurrent.CompletionStage;

/**
 * Append-only storage of events, ordered per stream.
 *
 * <p>Event store guarantees the consistency of the stream across processes by conditional append: events are only
 * appended when the stream is at expected version. This is the single point of concurrency control for aggregates.</p>
 */
public interface EventStore {

    /**
     * Append events to a stream. Events are assigned positions {@code expectedVersion + 1} to
     * {@code expectedVersion + events.size()}, without gaps.
     *
     * @param key the stream
     * @param expectedVersion version the stream is expected to be at
     * @param events events to append, in order
     * @return stage completing with new version of the stream, or exceptionally with {@link EventStoreException}.
     *    When the stream is not at expected version, the fault is {@link EventStoreException.Fault#OPTIMISTIC_LOCK}
     *    and {@link EventStoreException#getCurrentVersion()} carries actual version.
     */
    CompletionStage<StreamPosition> append(StreamKey key, StreamPosition expectedVersion, List<? extends Event> events);
}
