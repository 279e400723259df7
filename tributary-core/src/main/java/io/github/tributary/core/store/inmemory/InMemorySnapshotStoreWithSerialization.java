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
import io.github.tributary.core.store.Serialization;
import io.github.tributary.core.store.SnapshotMetadata;
import io.github.tributary.core.store.SnapshotStoreWithSerialization;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * InMemoryStore, that also exercises serialization.
 */
public class InMemorySnapshotStoreWithSerialization<T> extends SnapshotStoreWithSerialization<T> {
    private final ConcurrentMap<StreamKey, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();

    public InMemorySnapshotStoreWithSerialization(Serialization<T> serialization) {
        super(serialization);
    }

    @Override
    public SnapshotRecord retrieveSnapshotRecord(StreamKey key) {
        return snapshotRecords.get(key);
    }

    @Override
    public void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        snapshotRecords.put(snapshotRecord.getHeader().streamKey(), snapshotRecord);
    }

    public Optional<String> getSerializedSnapshot(StreamKey key) {
        return Optional.ofNullable(retrieveSnapshotRecord(key)).map(SnapshotRecord::getPayload);
    }

    public OptionalInt getSerializedSnapshotVersion(StreamKey key) {
        SnapshotRecord record = retrieveSnapshotRecord(key);
        if (record != null) {
            return OptionalInt.of(record.getHeader().payloadVersion());
        } else {
            return OptionalInt.empty();
        }
    }

    /**
     * Put a raw snapshot into the store, e. g. one written by older version of the application.
     */
    public void storeSnapshot(StreamKey key, StreamPosition position, String reducerHash, int payloadVersion,
            String payload) {
        storeSnapshotRecord(new SnapshotRecord(new SnapshotMetadata.Default(key, Instant.now(), payloadVersion,
            position, reducerHash), payload));
    }
}
