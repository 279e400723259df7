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

import io.github.tributary.core.Command;
import io.github.tributary.core.Event;
import io.github.tributary.core.QuerySnapshot;
import io.github.tributary.core.Request;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.command.Decision;
import io.github.tributary.core.dispatch.CancellationSignal;
import io.github.tributary.core.dispatch.Dispatcher;
import io.github.tributary.core.dispatch.SimpleDispatcherConfiguration;
import io.github.tributary.core.projection.AppendListener;
import io.github.tributary.core.projection.QueryProjection;
import io.github.tributary.core.store.EventLog;
import io.github.tributary.core.store.EventStore;
import io.github.tributary.core.store.EventStoreException;
import io.github.tributary.core.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Processes commands of one aggregate type.
 *
 * <p>Commands for the same stream are processed one at a time, in order of submission, by a {@link Dispatcher}.
 * Commands for different streams run in parallel. Processing of a command:</p>
 * <ol>
 *     <li>obtain current state from the projection cache, if it matches version of the log, or by replaying
 *     snapshot and the tail of the stream</li>
 *     <li>let the command handler decide</li>
 *     <li>return rejection without appending anything</li>
 *     <li>append the events, expecting the version the state was at</li>
 *     <li>on version conflict start over with fresh state, up to configured number of retries, then report
 *     conflict</li>
 *     <li>fold the events into state, replace the cached pair, store snapshot if policy says so, notify
 *     listeners and return new snapshot</li>
 * </ol>
 * <p>Correctness of concurrent writers depends solely on conditional append of {@link EventStore}. Cancellation of
 * returned future is honored until the append is attempted, once the events are appended the command completes.</p>
 *
 * @param <S> type of aggregate state
 */
public class AggregateEngine<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateEngine.class);

    private final AggregateDefinition<S> definition;
    private final EventStore eventStore;
    private final SnapshotStore<?> snapshotStore;
    private final AggregateEngineConfiguration configuration;
    private final QueryProjection<S> projection;
    private final Dispatcher dispatcher;
    private final List<AppendListener> listeners = new CopyOnWriteArrayList<>();

    public AggregateEngine(AggregateDefinition<S> definition, EventStore eventStore, EventLog eventLog,
            SnapshotStore<?> snapshotStore, AggregateEngineConfiguration configuration) {
        this.definition = Objects.requireNonNull(definition, "Definition must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        this.configuration = Objects.requireNonNull(configuration, "Configuration must be specified");
        this.projection = new QueryProjection<>(definition.getName(), definition.getReducer(), eventLog,
                snapshotStore, configuration.getExecutorService(), configuration.getCacheSettings());
        // no dispatcher retries, only version conflicts are retried and that happens in process()
        this.dispatcher = new Dispatcher(new SimpleDispatcherConfiguration(definition.getName(),
                configuration.getExecutorService(), configuration.getSchedulerService(), this::dispatch));
    }

    /**
     * Create engine over store that is both {@link EventStore} and {@link EventLog}.
     */
    public static <S, J extends EventStore & EventLog> AggregateEngine<S> create(AggregateDefinition<S> definition,
            J journal, SnapshotStore<?> snapshotStore, AggregateEngineConfiguration configuration) {
        return new AggregateEngine<>(definition, journal, journal, snapshotStore, configuration);
    }

    public AggregateDefinition<S> getDefinition() {
        return definition;
    }

    /**
     * Submit a command.
     * @param key target stream, must belong to this aggregate type
     * @param command the command
     * @return future of the outcome. Completes exceptionally with {@link EventStoreException} when the store fails
     *    for other reason than version conflict, with {@link io.github.tributary.core.reduce.SchemaMismatchException}
     *    when the stream contains, or the command produced, an event the reducer doesn't know, and with
     *    {@link CancellationException} when cancelled before append.
     */
    public CompletableFuture<CommandResult<S>> execute(StreamKey key, Command command) {
        return dispatcher.execute(checkKey(key), new CommandInvocation(key, command, null));
    }

    /**
     * Submit a command, that only applies when the stream is at expected version. When it isn't, the result is
     * {@link CommandResult.Kind#CONFLICT} immediately, without retry.
     * @param key target stream
     * @param command the command
     * @param expectedVersion version the caller based the command on
     * @return future of the outcome
     */
    public CompletableFuture<CommandResult<S>> execute(StreamKey key, Command command, StreamPosition expectedVersion) {
        Objects.requireNonNull(expectedVersion, "Expected version must be specified");
        return dispatcher.execute(checkKey(key), new CommandInvocation(key, command, expectedVersion));
    }

    /**
     * Submit a command with a deadline. When the deadline passes before the command is appended, the result is
     * cancelled.
     */
    public CompletableFuture<CommandResult<S>> executeWithTimeout(StreamKey key, Command command, long timeout,
            TimeUnit unit) {
        return dispatcher.executeWithTimeout(checkKey(key), new CommandInvocation(key, command, null),
                timeout, unit);
    }

    public CompletableFuture<QuerySnapshot<S>> read(StreamKey key) {
        return projection.read(checkKey(key));
    }

    public CompletableFuture<QuerySnapshot<S>> read(StreamKey key, StreamPosition minVersion) {
        return projection.read(checkKey(key), minVersion);
    }

    public StreamPosition getCurrentVersion(StreamKey key) {
        return projection.getCurrentVersion(key);
    }

    public QueryProjection<S> projection() {
        return projection;
    }

    public void addListener(AppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must be specified"));
    }

    private StreamKey checkKey(StreamKey key) {
        Objects.requireNonNull(key, "Stream key must be specified");
        if (!definition.owns(key)) {
            throw new IllegalArgumentException("Stream " + key + " does not belong to " + definition.getName());
        }
        return key;
    }

    // the dispatcher of this engine only ever receives CommandInvocation
    private <R extends Request<RS>, RS> void dispatch(StreamKey key, R request, CancellationSignal signal,
            BiConsumer<RS, Throwable> callback) {
        CommandInvocation invocation = (CommandInvocation) request;
        CompletionStage<CommandResult<S>> result;
        try {
            result = process(invocation, signal, 1);
        } catch (RuntimeException e) {
            result = failed(e);
        }
        result.whenComplete((r, t) -> callback.accept((RS) r, t));
    }

    private CompletionStage<CommandResult<S>> process(CommandInvocation invocation, CancellationSignal signal,
            int attempt) {
        StreamKey key = invocation.key;
        QuerySnapshot<S> current = projection.latest(key);
        if (invocation.expectedVersion != null && !invocation.expectedVersion.equals(current.getVersion())) {
            logger.debug("{} expected {} at {}, but it is at {}", invocation, key, invocation.expectedVersion,
                    current.getVersion());
            return completed(CommandResult.conflict(invocation.expectedVersion, current.getVersion()));
        }
        Decision decision = definition.getCommandHandler().handle(invocation.command, current.getState());
        if (decision.isRejected()) {
            logger.debug("{} rejected: {}", invocation, decision.getRejection());
            return completed(CommandResult.rejected(decision.getRejection(), current.getVersion()));
        }
        List<Event> events = decision.getEvents();
        if (events.isEmpty()) {
            return completed(CommandResult.accepted(current, Collections.emptyList()));
        }
        definition.getReducer().verifySupported(events);
        if (signal.isCancellationRequested()) {
            throw new CancellationException(invocation + " was cancelled before append");
        }
        return eventStore.append(key, current.getVersion(), events)
                .<CompletionStage<CommandResult<S>>>handle((newVersion, t) -> {
                    if (t == null) {
                        return newVersion.getValue() == current.getVersion().getValue() + events.size()
                                ? completed(committed(key, current, events, newVersion))
                                : misreported(key, current.getVersion(), events, newVersion);
                    }
                    Throwable cause = Dispatcher.unwrapCompletionException(t);
                    if (cause instanceof EventStoreException && ((EventStoreException) cause).isOptimisticLock()) {
                        return conflicted(invocation, signal, attempt, current, (EventStoreException) cause);
                    }
                    return failed(cause);
                })
                .thenCompose(Function.identity());
    }

    private CompletionStage<CommandResult<S>> conflicted(CommandInvocation invocation, CancellationSignal signal,
            int attempt, QuerySnapshot<S> current, EventStoreException conflict) {
        projection.invalidate(invocation.key);
        if (attempt <= configuration.getMaxConflictRetries()) {
            logger.debug("{} hit version conflict at {}, retrying with fresh state. Attempt {}", invocation,
                    current.getVersion(), attempt);
            return process(invocation, signal, attempt + 1);
        }
        logger.info("{} hit version conflict in all {} attempts, stream is at {}", invocation, attempt,
                conflict.getCurrentVersion());
        return completed(CommandResult.conflict(current.getVersion(), conflict.getCurrentVersion()));
    }

    /**
     * Store reported version, that cannot result from the append. The events are durable, but state they lead to
     * is unknown, so the cached state is dropped and next command reloads it from the log.
     */
    private CompletionStage<CommandResult<S>> misreported(StreamKey key, StreamPosition previous, List<Event> events,
            StreamPosition reported) {
        projection.invalidate(key);
        EventStoreException broken = EventStoreException.inconsistentVersion(key, previous, events.size(), reported);
        logger.error("Broken event store! {}", broken.getMessage());
        return failed(broken);
    }

    private CommandResult<S> committed(StreamKey key, QuerySnapshot<S> previous, List<Event> events,
            StreamPosition newVersion) {
        S newState = definition.getReducer().fold(previous.getState(), events);
        QuerySnapshot<S> snapshot = new QuerySnapshot<>(newState, newVersion);
        projection.replace(key, snapshot);
        if (configuration.getSnapshotPolicy().shouldSnapshot(previous.getVersion(), newVersion)) {
            snapshotStore.store(key, newVersion, definition.getReducer().getHash(), () -> newState);
        }
        for (AppendListener listener : listeners) {
            try {
                listener.onAppended(key, previous.getVersion(), newVersion, events);
            } catch (RuntimeException e) {
                logger.error("Append listener {} failed for {} at {}", listener, key, newVersion, e);
            }
        }
        return CommandResult.accepted(snapshot, events);
    }

    private static <T> CompletionStage<T> completed(T value) {
        return CompletableFuture.completedFuture(value);
    }

    private static <T> CompletionStage<T> failed(Throwable t) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    private final class CommandInvocation implements Request<CommandResult<S>> {
        private final StreamKey key;
        private final Command command;
        private final StreamPosition expectedVersion;

        CommandInvocation(StreamKey key, Command command, StreamPosition expectedVersion) {
            this.key = key;
            this.command = Objects.requireNonNull(command, "Command must be specified");
            this.expectedVersion = expectedVersion;
        }

        @Override
        public String toString() {
            return command.getClass().getSimpleName() + " on " + key;
        }
    }
}
