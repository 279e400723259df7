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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.tributary.core.Event;
import io.github.tributary.core.QuerySnapshot;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.reduce.RootReducer;
import io.github.tributary.core.store.EventLog;
import io.github.tributary.core.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Serves latest known state of streams along with its version.
 *
 * <p>Every stream has at most one cached {@link QuerySnapshot}. The pair is only ever replaced as a whole, and never
 * by an older version, so that readers cannot observe state and version that did not exist together. When the cache
 * is missing or behind the version the reader needs, the projection replays only the events past the cached version,
 * or restores the state from snapshot store and replays the tail.</p>
 *
 * <p>The cache is bounded by {@link CacheSettings}. A stream evicted from it is restored on next read, exactly like
 * a stream read for the first time.</p>
 *
 * <p>An aggregate engine keeps its own state in a projection. Other projections, with their own reducers, may
 * subscribe to an engine as {@link AppendListener}, and are invalidated on every append.</p>
 *
 * @param <P> type of projected state
 */
public class QueryProjection<P> implements AppendListener {
    private static final Logger logger = LoggerFactory.getLogger(QueryProjection.class);

    private final String name;
    private final RootReducer<P> reducer;
    private final EventLog eventLog;
    private final SnapshotStore<?> snapshotStore;
    private final Executor executor;
    private final Cache<StreamKey, QuerySnapshot<P>> entries;
    private final ConcurrentMap<StreamKey, QuerySnapshot<P>> cache;

    public QueryProjection(String name, RootReducer<P> reducer, EventLog eventLog, SnapshotStore<?> snapshotStore,
            Executor executor) {
        this(name, reducer, eventLog, snapshotStore, executor, CacheSettings.defaults());
    }

    public QueryProjection(String name, RootReducer<P> reducer, EventLog eventLog, SnapshotStore<?> snapshotStore,
            Executor executor, CacheSettings cacheSettings) {
        Objects.requireNonNull(cacheSettings, "Cache settings must be specified");
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.reducer = Objects.requireNonNull(reducer, "Reducer must be specified");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        this.entries = Caffeine.newBuilder()
                .maximumSize(cacheSettings.getMaximumSize())
                .expireAfterAccess(cacheSettings.getExpireAfterAccess())
                .executor(executor)
                .build();
        this.cache = entries.asMap();
    }

    public String getName() {
        return name;
    }

    /**
     * Read latest known state. Serves the cache if present, may therefore return stale state.
     * @param key the stream
     * @return cached snapshot, or snapshot loaded from the log
     */
    public CompletableFuture<QuerySnapshot<P>> read(StreamKey key) {
        QuerySnapshot<P> cached = cache.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return CompletableFuture.supplyAsync(() -> refresh(key), executor);
    }

    /**
     * Read state that reflects at least given version. Callers that need to read their own writes pass the version
     * they wrote.
     * @param key the stream
     * @param minVersion minimal version the caller requires
     * @return cached snapshot if it is not behind, otherwise refreshed snapshot
     */
    public CompletableFuture<QuerySnapshot<P>> read(StreamKey key, StreamPosition minVersion) {
        Objects.requireNonNull(minVersion, "Minimal version must be specified");
        QuerySnapshot<P> cached = cache.get(key);
        if (cached != null && !minVersion.isNewerThan(cached.getVersion())) {
            return CompletableFuture.completedFuture(cached);
        }
        return CompletableFuture.supplyAsync(() -> {
            QuerySnapshot<P> refreshed = refresh(key);
            if (minVersion.isNewerThan(refreshed.getVersion())) {
                logger.debug("Projection {} of {} requested at {}, but log only reached {}", name, key, minVersion,
                        refreshed.getVersion());
            }
            return refreshed;
        }, executor);
    }

    /**
     * Version of cached state. Never reads the log.
     * @param key the stream
     * @return cached version or {@link StreamPosition#EMPTY}
     */
    public StreamPosition getCurrentVersion(StreamKey key) {
        QuerySnapshot<P> cached = cache.get(key);
        return cached == null ? StreamPosition.EMPTY : cached.getVersion();
    }

    /**
     * Reference to cached entry. Never reads the log.
     * @param key the stream
     * @return reference, or empty when nothing is cached for the stream
     */
    public Optional<ProjectionReference> getReference(StreamKey key) {
        QuerySnapshot<P> cached = cache.get(key);
        return cached == null ? Optional.empty() : Optional.of(new ProjectionReference(name, key, cached.getVersion()));
    }

    /**
     * Cached state, if it reflects the current version in the log, otherwise refreshed state.
     * @param key the stream
     * @return snapshot at version current in the log
     */
    public QuerySnapshot<P> latest(StreamKey key) {
        QuerySnapshot<P> cached = cache.get(key);
        if (cached != null && !eventLog.currentPosition(key).isNewerThan(cached.getVersion())) {
            return cached;
        }
        return refresh(key);
    }

    /**
     * Bring cached state up to date with the log, synchronously.
     * @param key the stream
     * @return the cached snapshot after refresh
     */
    public QuerySnapshot<P> refresh(StreamKey key) {
        QuerySnapshot<P> cached = cache.get(key);
        QuerySnapshot<P> fresh = cached == null ? load(key) : replay(key, cached);
        return install(key, fresh);
    }

    /**
     * Restore state from latest usable snapshot and the events past it. Does not touch the cache.
     * @param key the stream
     * @return the state at the version current in the log
     */
    public QuerySnapshot<P> load(StreamKey key) {
        long start = System.currentTimeMillis();
        QuerySnapshot<P> initial = snapshotStore.readSnapshot(key, reducer.getHash())
                .map(snapshot -> new QuerySnapshot<>(cast(snapshot.getState()), snapshot.getPosition()))
                .orElseGet(() -> QuerySnapshot.empty(reducer.zero()));
        QuerySnapshot<P> result = replay(key, initial);
        if (logger.isDebugEnabled()) {
            logger.debug("Stream {} recovered by {} in {} ms replaying {} events", key, name,
                    System.currentTimeMillis() - start,
                    result.getVersion().getValue() - initial.getVersion().getValue());
        }
        return result;
    }

    private QuerySnapshot<P> replay(StreamKey key, QuerySnapshot<P> from) {
        try (EventLog.StoredEvents events = eventLog.readEvents(key, from.getVersion())) {
            return events.reduce(from, (snapshot, event) ->
                    new QuerySnapshot<>(reducer.reduce(snapshot.getState(), event.getPayload()), event.getPosition()));
        }
    }

    // snapshots are keyed by reducer hash, so a snapshot found here was produced by this reducer
    private P cast(Object state) {
        return (P) state;
    }

    /**
     * Replace cached pair, unless cache already holds newer version.
     * @param key the stream
     * @param snapshot new state and version
     * @return the snapshot held in cache after the call
     */
    public QuerySnapshot<P> replace(StreamKey key, QuerySnapshot<P> snapshot) {
        return install(key, Objects.requireNonNull(snapshot, "Snapshot must be specified"));
    }

    private QuerySnapshot<P> install(StreamKey key, QuerySnapshot<P> snapshot) {
        return cache.merge(key, snapshot, (cached, fresh) -> cached.isNewerThan(fresh) ? cached : fresh);
    }

    /**
     * Number of streams held in cache, after pending evictions are applied.
     */
    public long getCachedCount() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public void invalidate(StreamKey key) {
        cache.remove(key);
    }

    @Override
    public void onAppended(StreamKey key, StreamPosition previous, StreamPosition current,
            List<? extends Event> events) {
        invalidate(key);
    }

    @Override
    public String toString() {
        return "QueryProjection[" + name + "]";
    }
}
