package io.github.tributary.core.store.inmemory;

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
import io.github.tributary.core.RecordedEvent;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.store.EventLog;
import io.github.tributary.core.store.EventStore;
import io.github.tributary.core.store.EventStoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Keeps streams in memory. Every stream is a synchronized list, appends to single stream are atomic, and streams do
 * not share any lock.
 */
public class InMemoryEventStore implements EventStore, EventLog {
    private final ConcurrentMap<StreamKey, List<RecordedEvent>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletionStage<StreamPosition> append(StreamKey key, StreamPosition expectedVersion,
            List<? extends Event> events) {
        CompletableFuture<StreamPosition> result = new CompletableFuture<>();
        try {
            result.complete(doAppend(key, expectedVersion, events));
        } catch (EventStoreException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    protected StreamPosition doAppend(StreamKey key, StreamPosition expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        if (events.isEmpty()) {
            throw EventStoreException.emptyAppend(key);
        }
        List<RecordedEvent> stream = stream(key);
        synchronized (stream) {
            StreamPosition current = lastPositionOf(stream);
            if (!current.equals(expectedVersion)) {
                throw EventStoreException.optimisticLock(key, expectedVersion, current);
            }
            Instant timestamp = clock.instant();
            StreamPosition position = current;
            for (Event event : events) {
                position = position.next();
                stream.add(new RecordedEvent(key, position, timestamp, event));
            }
            return position;
        }
    }

    @Override
    public StreamPosition currentPosition(StreamKey key) {
        List<RecordedEvent> stream = storage.get(key);
        if (stream == null) {
            return StreamPosition.EMPTY;
        }
        synchronized (stream) {
            return lastPositionOf(stream);
        }
    }

    private static StreamPosition lastPositionOf(List<RecordedEvent> stream) {
        return stream.isEmpty() ? StreamPosition.EMPTY : stream.get(stream.size() - 1).getPosition();
    }

    private List<RecordedEvent> stream(StreamKey key) {
        return storage.computeIfAbsent(key, (k) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public StoredEvents readEvents(StreamKey key, StreamPosition afterVersion) {
        return new StoredEvents() {
            final List<RecordedEvent> filteredEvents;
            boolean stop = false;

            {
                List<RecordedEvent> events = storage.getOrDefault(key, Collections.emptyList());
                //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
                synchronized (events) {
                    int from = (int) Math.min(afterVersion.getValue(), events.size());
                    filteredEvents = new ArrayList<>(events.subList(from, events.size()));
                }
            }

            @Override
            public void foreach(Consumer<? super RecordedEvent> consumer) {
                for (RecordedEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent, R> reducer) {
                R result = initial;
                for (RecordedEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
