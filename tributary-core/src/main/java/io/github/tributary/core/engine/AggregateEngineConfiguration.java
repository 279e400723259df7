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

import io.github.tributary.core.projection.CacheSettings;
import io.github.tributary.core.store.SnapshotPolicy;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies and tunables of {@link AggregateEngine}. Instances are immutable, {@code with} methods return
 * modified copy.
 */
public class AggregateEngineConfiguration {
    public static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;

    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final int maxConflictRetries;
    private final SnapshotPolicy snapshotPolicy;
    private final CacheSettings cacheSettings;

    /**
     * Create configuration with default retries and no snapshots.
     * @param executorService thread pool commands are processed in
     * @param schedulerService thread pool for timeouts. <strong>Should be different from executorService</strong>
     */
    public AggregateEngineConfiguration(ExecutorService executorService, ScheduledExecutorService schedulerService) {
        this(executorService, schedulerService, DEFAULT_MAX_CONFLICT_RETRIES, SnapshotPolicy.never(),
                CacheSettings.defaults());
    }

    private AggregateEngineConfiguration(ExecutorService executorService, ScheduledExecutorService schedulerService,
            int maxConflictRetries, SnapshotPolicy snapshotPolicy, CacheSettings cacheSettings) {
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException("Conflict retries cannot be negative: " + maxConflictRetries);
        }
        this.maxConflictRetries = maxConflictRetries;
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy, "Snapshot policy must be specified");
        this.cacheSettings = Objects.requireNonNull(cacheSettings, "Cache settings must be specified");
    }

    /**
     * How many times a command is re-validated against fresh state and appended again, after its append hit
     * version conflict.
     * @param maxConflictRetries number of retries, 0 to surface first conflict
     * @return modified configuration
     */
    public AggregateEngineConfiguration withMaxConflictRetries(int maxConflictRetries) {
        return new AggregateEngineConfiguration(executorService, schedulerService, maxConflictRetries, snapshotPolicy,
                cacheSettings);
    }

    public AggregateEngineConfiguration withSnapshotPolicy(SnapshotPolicy snapshotPolicy) {
        return new AggregateEngineConfiguration(executorService, schedulerService, maxConflictRetries, snapshotPolicy,
                cacheSettings);
    }

    /**
     * Bounds of the cache of aggregate states. Evicted states are restored from snapshot and log when needed.
     */
    public AggregateEngineConfiguration withCacheSettings(CacheSettings cacheSettings) {
        return new AggregateEngineConfiguration(executorService, schedulerService, maxConflictRetries, snapshotPolicy,
                cacheSettings);
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public ScheduledExecutorService getSchedulerService() {
        return schedulerService;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public SnapshotPolicy getSnapshotPolicy() {
        return snapshotPolicy;
    }

    public CacheSettings getCacheSettings() {
        return cacheSettings;
    }
}
