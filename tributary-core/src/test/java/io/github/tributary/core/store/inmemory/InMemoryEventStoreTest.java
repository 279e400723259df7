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
import io.github.tributary.core.dispatch.Dispatcher;
import io.github.tributary.core.store.EventLog;
import io.github.tributary.core.store.EventStoreException;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.github.tributary.example.counter.CounterEvents.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class InMemoryEventStoreTest {
    private static final Instant NOW = Instant.parse("2018-03-01T10:15:30Z");
    private final InMemoryEventStore store = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    private final StreamKey key = StreamKey.of("samples", "counter", "c1");

    private StreamPosition append(StreamPosition expected, Event... events) throws Exception {
        return store.append(key, expected, Arrays.asList(events)).toCompletableFuture().get();
    }

    private List<RecordedEvent> read(StreamPosition after) {
        List<RecordedEvent> result = new ArrayList<>();
        try (EventLog.StoredEvents events = store.readEvents(key, after)) {
            events.foreach(result::add);
        }
        return result;
    }

    @Test
    public void positions_are_gapless_from_one() throws Exception {
        assertEquals(StreamPosition.EMPTY, store.currentPosition(key));
        assertEquals(StreamPosition.of(2), append(StreamPosition.EMPTY, new CounterIncrementedEvent(1),
                new CounterIncrementedEvent(2)));
        assertEquals(StreamPosition.of(3), append(StreamPosition.of(2), new CounterDecrementedEvent(1)));

        List<Long> positions = read(StreamPosition.EMPTY).stream().map(e -> e.getPosition().getValue())
                .collect(Collectors.toList());
        assertEquals(Arrays.asList(1L, 2L, 3L), positions);
        assertEquals(StreamPosition.of(3), store.currentPosition(key));
    }

    @Test
    public void events_are_read_after_given_position() throws Exception {
        append(StreamPosition.EMPTY, new CounterIncrementedEvent(1), new CounterIncrementedEvent(2),
                new CounterIncrementedEvent(3));
        List<RecordedEvent> tail = read(StreamPosition.of(1));
        assertEquals(2, tail.size());
        assertEquals(new CounterIncrementedEvent(2), tail.get(0).getPayload());
        assertEquals(NOW, tail.get(0).getTimestamp());
        assertEquals(key, tail.get(0).getStreamKey());
        assertThat(read(StreamPosition.of(3)), empty());
        assertThat(read(StreamPosition.of(10)), empty());
    }

    @Test
    public void conflict_reports_actual_version() throws Exception {
        append(StreamPosition.EMPTY, new CounterIncrementedEvent(1), new CounterIncrementedEvent(2));
        try {
            append(StreamPosition.of(1), new CounterIncrementedEvent(3));
            fail("Append at stale version should fail");
        } catch (ExecutionException e) {
            EventStoreException cause = (EventStoreException) Dispatcher.unwrapCompletionException(e.getCause());
            assertTrue(cause.isOptimisticLock());
            assertEquals(StreamPosition.of(2), cause.getCurrentVersion());
        }
        assertEquals(2, read(StreamPosition.EMPTY).size());
    }

    @Test
    public void empty_append_is_refused() {
        CompletableFuture<StreamPosition> result = store.append(key, StreamPosition.EMPTY, Collections.emptyList())
                .toCompletableFuture();
        assertTrue(result.isCompletedExceptionally());
        assertEquals(StreamPosition.EMPTY, store.currentPosition(key));
    }

    @Test
    public void exactly_one_of_concurrent_appends_at_same_version_wins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                int amount = i + 1;
                attempts.add(pool.submit(() -> {
                    try {
                        append(StreamPosition.EMPTY, new CounterIncrementedEvent(amount));
                        return true;
                    } catch (ExecutionException e) {
                        return false;
                    }
                }));
            }
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(1, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(StreamPosition.of(1), store.currentPosition(key));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void streams_are_independent() throws Exception {
        append(StreamPosition.EMPTY, new CounterIncrementedEvent(1));
        StreamKey other = StreamKey.of("samples", "counter", "c2");
        assertEquals(StreamPosition.EMPTY, store.currentPosition(other));
        assertEquals(StreamPosition.of(1), store.append(other, StreamPosition.EMPTY,
                Collections.singletonList(new CounterIncrementedEvent(5))).toCompletableFuture().get());
    }

    @Test
    public void reading_can_be_stopped() throws Exception {
        append(StreamPosition.EMPTY, new CounterIncrementedEvent(1), new CounterIncrementedEvent(2),
                new CounterIncrementedEvent(3));
        List<RecordedEvent> seen = new ArrayList<>();
        try (EventLog.StoredEvents events = store.readEvents(key, StreamPosition.EMPTY)) {
            events.foreach(e -> {
                seen.add(e);
                if (e.getPosition().getValue() == 2) {
                    events.stop();
                }
            });
        }
        assertEquals(2, seen.size());
    }
}
