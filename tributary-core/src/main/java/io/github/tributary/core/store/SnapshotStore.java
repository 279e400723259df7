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

import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common logic for storing snapshots of aggregate state. A snapshot is only usable by the reducer that produced it,
 * therefore every snapshot records the reducer hash, and snapshots with different hash are not returned.
 *
 * @param <P> the type of payload. Most likely String.
 */
public abstract class SnapshotStore<P> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    public static class Snapshot {
        private final StreamPosition position;
        private final Object state;

        Snapshot(StreamPosition position, Object state) {
            this.position = position;
            this.state = state;
        }

        public StreamPosition getPosition() {
            return position;
        }

        public Object getState() {
            return state;
        }
    }

    /**
     * Read latest snapshot of a stream.
     * @param key the stream
     * @param reducerHash hash of reducer that will continue from the snapshot
     * @return snapshot, or empty if none exists, it cannot be deserialized or was produced by different reducer
     */
    public Optional<Snapshot> readSnapshot(StreamKey key, String reducerHash) {
        SnapshotRecord snapshotRecord = retrieveSnapshotRecord(key);
        if (snapshotRecord != null) {
            if (!reducerHash.equals(snapshotRecord.header.reducerHash())) {
                logger.warn("Snapshot of {} at {} was produced by different reducer, it will not be used", key,
                        snapshotRecord.header.streamPosition());
                return Optional.empty();
            }
            try {
                Object state = deserializeSnapshot(snapshotRecord);
                if (state != null) {
                    return Optional.of(new Snapshot(snapshotRecord.header.streamPosition(), state));
                }
            } catch (Exception e) {
                logger.error("Failure during deserialization of snapshot of {}", key, e);
            }
        }
        return Optional.empty();
    }

    /**
     * Obtain a snapshot of the state and store it.
     *
     * @param key the stream
     * @param position version of the state
     * @param reducerHash hash of reducer that produced the state
     * @param stateSupplier supplier of the state
     * @return true if state was serialized and stored
     * @see #serializeSnapshot(StreamKey, StreamPosition, String, Object)
     * @see #storeSnapshotRecord(SnapshotStore.SnapshotRecord)
     */
    public boolean store(StreamKey key, StreamPosition position, String reducerHash, Supplier<Object> stateSupplier) {
        try {
            Object state = stateSupplier.get();
            if (state == null) {
                return false;
            }
            SnapshotRecord snapshotRecord = serializeSnapshot(key, position, reducerHash, state);
            if (snapshotRecord != null) {
                storeSnapshotRecord(snapshotRecord);
                return true;
            }
        } catch (Exception e) {
            logger.error("Creating snapshot of stream {} failed", key, e);
        }
        return false;
    }

    /**
     * Transform stored payload into state. Implementation will decide on header value, most
     * notably {@link SnapshotMetadata#payloadVersion()} on how to deserialize it.
     *
     * @param snapshotRecord the retrieved snapshot record
     * @return state
     */
    protected abstract Object deserializeSnapshot(SnapshotRecord snapshotRecord);

    /**
     * Serialize a state.
     *
     * @param key the stream
     * @param position version of the state
     * @param reducerHash hash of the reducer
     * @param state the state
     * @return header data and payload of the snapshot
     */
    protected abstract SnapshotRecord serializeSnapshot(StreamKey key, StreamPosition position, String reducerHash,
            Object state);

    /**
     * Retrieve most recent snapshot for a stream from store.
     *
     * @param key the stream
     * @return header and payload of the snapshot
     */
    protected abstract SnapshotRecord retrieveSnapshotRecord(StreamKey key);

    /**
     * Actually commit the snapshot record into underlying storage.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * The record about a snapshot.
     */
    protected class SnapshotRecord {
        protected final SnapshotMetadata header;
        protected final P payload;

        public SnapshotMetadata getHeader() {
            return header;
        }

        public P getPayload() {
            return payload;
        }

        public SnapshotRecord(SnapshotMetadata header, P payload) {
            this.header = header;
            this.payload = payload;
        }
    }

}
