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

import io.github.tributary.core.StreamPosition;

/**
 * Decides after every successful append, whether state of the stream should be snapshotted.
 */
@FunctionalInterface
public interface SnapshotPolicy {
    /**
     * @param previous version before the append
     * @param current version after the append
     * @return true to store a snapshot of state at current version
     */
    boolean shouldSnapshot(StreamPosition previous, StreamPosition current);

    static SnapshotPolicy never() {
        return (previous, current) -> false;
    }

    /**
     * Snapshot whenever the stream crosses a multiple of given interval. Appends of multiple events that jump over
     * the boundary still produce a snapshot, at the version they ended at.
     * @param interval number of events between snapshots
     * @return the policy
     */
    static SnapshotPolicy retainEvery(int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("Snapshot interval must be positive: " + interval);
        }
        return (previous, current) -> current.getValue() / interval > previous.getValue() / interval;
    }
}
