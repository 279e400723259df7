package io.github.tributary.core.engine;

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
import io.github.tributary.core.MockEventStore;
import io.github.tributary.core.QuerySnapshot;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.command.Decision;
import io.github.tributary.core.command.ErrorCodes;
import io.github.tributary.core.command.RootCommandHandler;
import io.github.tributary.core.projection.CacheSettings;
import io.github.tributary.core.reduce.SchemaMismatchException;
import io.github.tributary.core.store.EventStoreException;
import io.github.tributary.core.store.SnapshotPolicy;
import io.github.tributary.core.store.inmemory.InMemorySnapshotStore;
import io.github.tributary.example.counter.Counter;
import io.github.tributary.example.counter.CounterState;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.github.tributary.example.counter.CounterCommands.*;
import static io.github.tributary.example.counter.CounterEvents.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class AggregateEngineTest {
    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private MockEventStore store;
    private InMemorySnapshotStore snapshots;
    private AggregateEngineConfiguration configuration;
    private AggregateEngine<CounterState> engine;
    private final StreamKey key = Counter.definition().streamKey("c1");

    static class UnknownEvent implements Event {
    }

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(4);
        scheduler = Executors.newScheduledThreadPool(1);
        store = new MockEventStore();
        snapshots = new InMemorySnapshotStore();
        configuration = new AggregateEngineConfiguration(executor, scheduler);
        engine = AggregateEngine.create(Counter.definition(), store, snapshots, configuration);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(2, TimeUnit.SECONDS);
    }

    private AggregateEngine<CounterState> engineWithHandler(RootCommandHandler<CounterState> handler) {
        AggregateDefinition<CounterState> definition = new AggregateDefinition<>(Counter.MODULE, Counter.CATEGORY,
                Counter.reducer(), handler);
        return AggregateEngine.create(definition, store, snapshots, configuration);
    }

    @Test
    public void accepted_commands_advance_state_and_version() throws Exception {
        CommandResult<CounterState> first = await(engine.execute(key, new IncrementCounter(5)));
        assertTrue(first.isAccepted());
        assertEquals(StreamPosition.of(1), first.getCurrentVersion());
        assertEquals(5, first.getSnapshot().getState().getCount());

        CommandResult<CounterState> second = await(engine.execute(key, new IncrementCounter(1)));
        assertEquals(StreamPosition.of(2), second.getCurrentVersion());
        assertEquals(new CounterState(6, 2, 0, 0), second.getSnapshot().getState());
        assertEquals(Collections.singletonList(new CounterIncrementedEvent(1)), second.getEvents());

        QuerySnapshot<CounterState> read = await(engine.read(key));
        assertEquals(second.getSnapshot(), read);
        assertEquals(StreamPosition.of(2), engine.getCurrentVersion(key));
    }

    @Test
    public void rejected_command_appends_nothing() throws Exception {
        await(engine.execute(key, new IncrementCounter(2)));
        int attempts = store.getAppendAttempts();

        CommandResult<CounterState> result = await(engine.execute(key, new DecrementCounter(5)));

        assertTrue(result.isRejected());
        assertEquals(ErrorCodes.INVARIANT_VIOLATION, result.getRejection().getCode());
        assertEquals(StreamPosition.of(1), result.getCurrentVersion());
        assertEquals(attempts, store.getAppendAttempts());
        assertEquals(StreamPosition.of(1), store.currentPosition(key));
        assertEquals(2, await(engine.read(key)).getState().getCount());
    }

    @Test
    public void command_is_retried_on_fresh_state_after_conflict() throws Exception {
        store.interfere(1, new CounterIncrementedEvent(10));

        CommandResult<CounterState> result = await(engine.execute(key, new IncrementCounter(1)));

        assertTrue(result.isAccepted());
        assertEquals(StreamPosition.of(2), result.getCurrentVersion());
        assertEquals(11, result.getSnapshot().getState().getCount());
        assertEquals(2, store.getAppendAttempts());
    }

    @Test
    public void command_is_revalidated_after_conflict() throws Exception {
        await(engine.execute(key, new IncrementCounter(2)));
        store.interfere(1, new CounterDecrementedEvent(1));

        CommandResult<CounterState> result = await(engine.execute(key, new DecrementCounter(2)));

        assertTrue(result.isRejected());
        assertEquals(ErrorCodes.INVARIANT_VIOLATION, result.getRejection().getCode());
        assertEquals(StreamPosition.of(2), store.currentPosition(key));
    }

    @Test
    public void conflict_is_reported_when_retries_are_exhausted() throws Exception {
        store.interfere(10, new CounterIncrementedEvent(1));

        CommandResult<CounterState> result = await(engine.execute(key, new IncrementCounter(100)));

        assertTrue(result.isConflict());
        assertEquals(StreamPosition.of(3), result.getExpectedVersion());
        assertEquals(StreamPosition.of(4), result.getCurrentVersion());
        assertEquals(AggregateEngineConfiguration.DEFAULT_MAX_CONFLICT_RETRIES + 1, store.getAppendAttempts());
        assertEquals(ErrorCodes.CONCURRENCY_CONFLICT, result.asRejection().getCode());
        assertEquals(4, await(engine.read(key, StreamPosition.of(4))).getState().getCount());
    }

    @Test
    public void first_conflict_is_reported_without_retries() throws Exception {
        engine = AggregateEngine.create(Counter.definition(), store, snapshots,
                configuration.withMaxConflictRetries(0));
        store.interfere(1, new CounterIncrementedEvent(1));

        CommandResult<CounterState> result = await(engine.execute(key, new IncrementCounter(1)));

        assertTrue(result.isConflict());
        assertEquals(1, store.getAppendAttempts());
    }

    @Test
    public void other_store_failures_are_not_retried() throws Exception {
        store.throwExceptionOnce(EventStoreException.storeFailed(key, new IllegalStateException("disk full")));
        try {
            await(engine.execute(key, new IncrementCounter(1)));
            fail("Store failure should fail the command");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(EventStoreException.class));
        }
        assertEquals(1, store.getAppendAttempts());
        assertTrue(await(engine.execute(key, new IncrementCounter(1))).isAccepted());
    }

    @Test
    public void expected_version_must_match() throws Exception {
        await(engine.execute(key, new IncrementCounter(1)));

        CommandResult<CounterState> stale = await(engine.execute(key, new IncrementCounter(1), StreamPosition.EMPTY));
        assertTrue(stale.isConflict());
        assertEquals(StreamPosition.EMPTY, stale.getExpectedVersion());
        assertEquals(StreamPosition.of(1), stale.getCurrentVersion());
        assertEquals(1, store.getAppendAttempts());

        CommandResult<CounterState> current = await(engine.execute(key, new IncrementCounter(1),
                StreamPosition.of(1)));
        assertTrue(current.isAccepted());
        assertEquals(StreamPosition.of(2), current.getCurrentVersion());
    }

    @Test
    public void commands_for_same_stream_are_serialized() throws Exception {
        List<CompletableFuture<CommandResult<CounterState>>> results = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            results.add(engine.execute(key, new IncrementCounter(1)));
        }
        for (CompletableFuture<CommandResult<CounterState>> result : results) {
            assertTrue(await(result).isAccepted());
        }
        assertEquals(50, await(engine.read(key)).getState().getCount());
        assertEquals(50, store.getAppendAttempts());
    }

    @Test
    public void commands_for_different_streams_are_independent() throws Exception {
        StreamKey other = Counter.definition().streamKey("c2");
        await(engine.execute(key, new IncrementCounter(3)));
        await(engine.execute(other, new IncrementCounter(7)));
        assertEquals(3, await(engine.read(key)).getState().getCount());
        assertEquals(7, await(engine.read(other)).getState().getCount());
        assertEquals(StreamPosition.of(1), engine.getCurrentVersion(other));
    }

    @Test(expected = IllegalArgumentException.class)
    public void streams_of_other_category_are_refused() {
        engine.execute(StreamKey.of(Counter.MODULE, "timer", "t1"), new IncrementCounter(1));
    }

    @Test
    public void accepting_without_events_returns_current_snapshot() throws Exception {
        await(engine.execute(key, new IncrementCounter(4)));
        AggregateEngine<CounterState> idle = engineWithHandler(RootCommandHandler.<CounterState>builder("idle")
                .on(IncrementCounter.class, (c, s) -> Decision.none())
                .build());

        CommandResult<CounterState> result = await(idle.execute(key, new IncrementCounter(1)));

        assertTrue(result.isAccepted());
        assertThat(result.getEvents(), empty());
        assertEquals(4, result.getSnapshot().getState().getCount());
        assertEquals(StreamPosition.of(1), result.getCurrentVersion());
    }

    @Test
    public void cancellation_requested_during_decision_prevents_append() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AggregateEngine<CounterState> slow = engineWithHandler(RootCommandHandler.<CounterState>builder("slow")
                .on(IncrementCounter.class, (c, s) -> {
                    entered.countDown();
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Decision.accept(new CounterIncrementedEvent(1));
                })
                .build());

        CompletableFuture<CommandResult<CounterState>> result = slow.execute(key, new IncrementCounter(1));
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        assertFalse(result.cancel(true));
        release.countDown();

        try {
            await(result);
            fail("Command should have been cancelled");
        } catch (CancellationException e) {
            assertTrue(result.isCancelled());
        }
        assertEquals(0, store.getAppendAttempts());
        assertEquals(StreamPosition.EMPTY, store.currentPosition(key));
    }

    @Test
    public void timeout_during_decision_prevents_append() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AggregateEngine<CounterState> slow = engineWithHandler(RootCommandHandler.<CounterState>builder("slow")
                .on(IncrementCounter.class, (c, s) -> {
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Decision.accept(new CounterIncrementedEvent(1));
                })
                .build());

        CompletableFuture<CommandResult<CounterState>> result = slow.executeWithTimeout(key,
                new IncrementCounter(1), 50, TimeUnit.MILLISECONDS);
        Thread.sleep(200);
        release.countDown();

        try {
            await(result);
            fail("Command should have timed out");
        } catch (CancellationException e) {
            assertEquals(StreamPosition.EMPTY, store.currentPosition(key));
        }
    }

    @Test
    public void cancellation_after_append_keeps_the_result() throws Exception {
        CountDownLatch appendReceived = new CountDownLatch(1);
        CompletableFuture<Void> acknowledgement = new CompletableFuture<>();
        store.holdAcknowledgements(appendReceived, acknowledgement);

        CompletableFuture<CommandResult<CounterState>> result = engine.execute(key, new IncrementCounter(1));
        assertTrue(appendReceived.await(2, TimeUnit.SECONDS));
        assertFalse("Appending command cannot be cancelled", result.cancel(true));
        acknowledgement.complete(null);

        CommandResult<CounterState> outcome = await(result);
        assertTrue(outcome.isAccepted());
        assertFalse(result.isCancelled());
        assertEquals(StreamPosition.of(1), store.currentPosition(key));
        assertEquals(StreamPosition.of(1), engine.getCurrentVersion(key));
        assertEquals(1, await(engine.read(key)).getState().getCount());
    }

    @Test
    public void misreported_append_version_fails_command_and_drops_cached_state() throws Exception {
        await(engine.execute(key, new IncrementCounter(1)));
        store.misreportVersionOnce();

        try {
            await(engine.execute(key, new IncrementCounter(2)));
            fail("Inconsistent version should fail the command");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(EventStoreException.class));
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR,
                    ((EventStoreException) e.getCause()).getFault());
        }
        assertEquals(StreamPosition.EMPTY, engine.getCurrentVersion(key));

        QuerySnapshot<CounterState> reloaded = await(engine.read(key));
        assertEquals(StreamPosition.of(2), reloaded.getVersion());
        assertEquals(3, reloaded.getState().getCount());
    }

    @Test
    public void evicted_state_is_restored_from_the_log() throws Exception {
        AggregateEngine<CounterState> small = AggregateEngine.create(Counter.definition(), store, snapshots,
                configuration.withCacheSettings(CacheSettings.defaults().withMaximumSize(1)));
        List<StreamKey> keys = Arrays.asList(Counter.definition().streamKey("a"), Counter.definition().streamKey("b"),
                Counter.definition().streamKey("c"));
        for (StreamKey k : keys) {
            await(small.execute(k, new IncrementCounter(2)));
            await(small.execute(k, new IncrementCounter(3)));
        }

        assertThat(small.projection().getCachedCount(), lessThanOrEqualTo(1L));
        for (StreamKey k : keys) {
            CommandResult<CounterState> result = await(small.execute(k, new IncrementCounter(1)));
            assertEquals(StreamPosition.of(3), result.getCurrentVersion());
            assertEquals(6, result.getSnapshot().getState().getCount());
        }
    }

    @Test
    public void command_producing_unknown_event_fails() throws Exception {
        AggregateEngine<CounterState> broken = engineWithHandler(RootCommandHandler.<CounterState>builder("broken")
                .on(IncrementCounter.class, (c, s) -> Decision.accept(new UnknownEvent()))
                .build());
        try {
            await(broken.execute(key, new IncrementCounter(1)));
            fail("Unknown event should not be appended");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(SchemaMismatchException.class));
        }
        assertEquals(StreamPosition.EMPTY, store.currentPosition(key));
    }

    @Test
    public void stream_with_unknown_event_cannot_be_read() throws Exception {
        store.append(key, StreamPosition.EMPTY, Collections.singletonList(new UnknownEvent()))
                .toCompletableFuture().get();
        try {
            await(engine.read(key));
            fail("Unknown event should fail the read");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(SchemaMismatchException.class));
        }
        try {
            await(engine.execute(key, new IncrementCounter(1)));
            fail("Unknown event should fail the command");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(SchemaMismatchException.class));
        }
    }

    @Test
    public void listeners_are_notified_after_append() throws Exception {
        List<String> notifications = new CopyOnWriteArrayList<>();
        engine.addListener((k, previous, current, events) -> {
            throw new IllegalStateException("Listener failures do not fail commands");
        });
        engine.addListener((k, previous, current, events) ->
                notifications.add(k.getId() + ":" + previous.getValue() + "->" + current.getValue() + ":" + events.size()));

        await(engine.execute(key, new InitializeCounter(1)));
        await(engine.execute(key, new IncrementCounter(1)));
        await(engine.execute(key, new DecrementCounter(10)));

        assertEquals(Arrays.asList("c1:0->1:1", "c1:1->2:1"), notifications);
    }

    @Test
    public void snapshots_are_stored_according_to_policy() throws Exception {
        engine = AggregateEngine.create(Counter.definition(), store, snapshots,
                configuration.withSnapshotPolicy(SnapshotPolicy.retainEvery(2)));
        await(engine.execute(key, new IncrementCounter(1)));
        assertEquals(StreamPosition.EMPTY, snapshots.getSnapshottedVersion(key));
        await(engine.execute(key, new IncrementCounter(1)));
        assertEquals(StreamPosition.of(2), snapshots.getSnapshottedVersion(key));
        await(engine.execute(key, new IncrementCounter(1)));
        assertEquals(StreamPosition.of(2), snapshots.getSnapshottedVersion(key));
    }

    @Test
    public void recovery_starts_from_snapshot_and_replays_tail() throws Exception {
        store.append(key, StreamPosition.EMPTY, Arrays.asList(new CounterIncrementedEvent(1),
                new CounterIncrementedEvent(1), new CounterIncrementedEvent(1))).toCompletableFuture().get();
        // the snapshot claims different count than the log, so that we can tell it was used
        snapshots.store(key, StreamPosition.of(2), Counter.reducer().getHash(), () -> new CounterState(100, 2, 0, 0));

        QuerySnapshot<CounterState> recovered = await(engine.read(key));

        assertEquals(StreamPosition.of(3), recovered.getVersion());
        assertEquals(101, recovered.getState().getCount());
    }

    @Test
    public void snapshot_of_other_reducer_is_ignored() throws Exception {
        store.append(key, StreamPosition.EMPTY, Arrays.asList(new CounterIncrementedEvent(1),
                new CounterIncrementedEvent(1), new CounterIncrementedEvent(1))).toCompletableFuture().get();
        snapshots.store(key, StreamPosition.of(2), "0123", () -> new CounterState(100, 2, 0, 0));

        QuerySnapshot<CounterState> recovered = await(engine.read(key));

        assertEquals(3, recovered.getState().getCount());
    }

    @Test
    public void engine_notices_appends_of_other_writers() throws Exception {
        await(engine.execute(key, new IncrementCounter(1)));
        store.append(key, StreamPosition.of(1), Collections.singletonList(new CounterIncrementedEvent(5)))
                .toCompletableFuture().get();

        CommandResult<CounterState> result = await(engine.execute(key, new DecrementCounter(6)));

        assertTrue(result.isAccepted());
        assertEquals(StreamPosition.of(3), result.getCurrentVersion());
        assertEquals(0, result.getSnapshot().getState().getCount());
        assertEquals(3, store.getAppendAttempts());
    }

    @Test
    public void counter_increments_accumulate() throws Exception {
        await(engine.execute(key, new IncrementCounter(3)));
        CommandResult<CounterState> result = await(engine.execute(key, new IncrementCounter(3)));

        assertEquals(StreamPosition.of(2), result.getCurrentVersion());
        assertEquals(6, result.getSnapshot().getState().getCount());
        assertEquals(2, result.getSnapshot().getState().getIncrementCount());
    }

    @Test
    public void second_initialization_leaves_stream_untouched() throws Exception {
        CommandResult<CounterState> first = await(engine.execute(key, new InitializeCounter(5)));
        assertEquals(Collections.singletonList(new CounterInitializedEvent(5)), first.getEvents());
        assertEquals(StreamPosition.of(1), first.getCurrentVersion());

        CommandResult<CounterState> second = await(engine.execute(key, new InitializeCounter(5)));
        assertTrue(second.isRejected());
        assertEquals(ErrorCodes.ALREADY_EXISTS, second.getRejection().getCode());
        assertEquals(StreamPosition.of(1), store.currentPosition(key));
    }
}
