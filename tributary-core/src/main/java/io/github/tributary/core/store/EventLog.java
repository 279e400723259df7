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

import io.github.tributary.core.RecordedEvent;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Read side of the journal. Usually implemented by the same class as {@link EventStore}.
 */
public interface EventLog {
    /**
     * Events of a stream positioned after given version, in append order. Calling again with a later position resumes
     * the read.
     * @param key the stream
     * @param afterVersion exclusive lower bound, {@link StreamPosition#EMPTY} for the whole stream
     * @return single use cursor over the events
     */
    StoredEvents readEvents(StreamKey key, StreamPosition afterVersion);

    /**
     * Position of the last event of a stream, without reading any events. Projections compare it with the version
     * of their cached state.
     * @return last position or {@link StreamPosition#EMPTY} for a stream that has no events
     */
    StreamPosition currentPosition(StreamKey key);

    /**
     * Cursor over events found by {@link #readEvents(StreamKey, StreamPosition)}. Implementations may stream the
     * events from their storage, therefore a cursor is consumed once, by either {@code foreach} or {@code reduce}.
     */
    interface StoredEvents extends AutoCloseable {
        void foreach(Consumer<? super RecordedEvent> consumer);

        /**
         * Fold the events into a value.
         * @param initial value before first event
         * @param reducer folding function, may call {@link #stop()}
         * @param <R> type of the value
         * @return value after last visited event
         */
        <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent, R> reducer);

        /**
         * Ends the iteration once the current callback returns.
         */
        void stop();

        /**
         * Releases the underlying resources. Never throws.
         */
        @Override
        void close();
    }
}
