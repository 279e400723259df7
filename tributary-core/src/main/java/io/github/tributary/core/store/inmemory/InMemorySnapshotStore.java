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

import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.store.SnapshotMetadata;
import io.github.tributary.core.store.SnapshotStore;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stores snapshots in memory as they are. Aggregate states are immutable, so no copy is needed.
 */
public class InMemorySnapshotStore extends SnapshotStore<Object> {
    private final ConcurrentMap<StreamKey, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    @Override
    protected Object deserializeSnapshot(SnapshotRecord snapshotRecord) {
        return snapshotRecord.getPayload();
    }

    @Override
    protected SnapshotRecord serializeSnapshot(StreamKey key, StreamPosition position, String reducerHash,
            Object state) {
        return new SnapshotRecord(new SnapshotMetadata.Default(key, Instant.now(), 1, position, reducerHash), state);
    }

    @Override
    public SnapshotRecord retrieveSnapshotRecord(StreamKey key) {
        return snapshotRecords.get(key);
    }

    public StreamPosition getSnapshottedVersion(StreamKey key) {
        SnapshotRecord record = retrieveSnapshotRecord(key);
        return record == null ? StreamPosition.EMPTY : record.getHeader().streamPosition();
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.put(snapshotRecord.getHeader().streamKey(), snapshotRecord);
    }
}
