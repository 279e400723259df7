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

import java.time.Clock;

/**
 * Snapshot store, that keeps the states as strings produced by a {@link Serialization}.
 *
 * @param <S> type of serialized state
 */
public abstract class SnapshotStoreWithSerialization<S> extends SnapshotStore<String> {
    protected final Serialization<S> serialization;
    private final Clock clock;

    protected SnapshotStoreWithSerialization(Serialization<S> serialization, Clock clock) {
        this.serialization = serialization;
        this.clock = clock;
    }

    protected SnapshotStoreWithSerialization(Serialization<S> serialization) {
        this(serialization, Clock.systemUTC());
    }

    @Override
    protected Object deserializeSnapshot(SnapshotRecord snapshotRecord) {
        SnapshotMetadata header = snapshotRecord.getHeader();
        return serialization.deserialize(header.streamKey(), header.payloadVersion(), snapshotRecord.getPayload());
    }

    @Override
    protected SnapshotRecord serializeSnapshot(StreamKey key, StreamPosition position, String reducerHash,
            Object state) {
        S cast = serialization.toSerializable(state);
        if (cast == null) {
            logger.error("Snapshot is not supported for serialization: {}", state);
            return null;
        }
        String payload = serialization.serialize(cast);
        int payloadVersion = serialization.payloadVersion(cast);
        return new SnapshotRecord(new SnapshotMetadata.Default(key, clock.instant(), payloadVersion, position,
                reducerHash), payload);
    }
}
