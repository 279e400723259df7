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

import java.time.Instant;

/**
 * Header data of a snapshot.
 */
public interface SnapshotMetadata {
    StreamKey streamKey();

    /**
     * Timestamp of the snapshot
     * @return the time when snapshot was created
     */
    Instant getTimestamp();

    /**
     * Payload version
     * @return version of serialization used for the payload
     */
    int payloadVersion();

    /**
     * Stream position
     * @return the version the state was in when this snapshot was generated
     */
    StreamPosition streamPosition();

    /**
     * Hash of the reducer that produced the state.
     * @return reducer hash
     * @see io.github.tributary.core.reduce.RootReducer#getHash()
     */
    String reducerHash();

    class Default implements SnapshotMetadata {

        private final StreamKey streamKey;
        private final Instant timestamp;
        private final int payloadVersion;
        private final StreamPosition position;
        private final String reducerHash;

        public Default(StreamKey streamKey, Instant timestamp, int payloadVersion, StreamPosition position,
                String reducerHash) {
            this.streamKey = streamKey;
            this.timestamp = timestamp;
            this.payloadVersion = payloadVersion;
            this.position = position;
            this.reducerHash = reducerHash;
        }

        @Override
        public StreamKey streamKey() {
            return streamKey;
        }

        @Override
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public int payloadVersion() {
            return payloadVersion;
        }

        @Override
        public StreamPosition streamPosition() {
            return position;
        }

        @Override
        public String reducerHash() {
            return reducerHash;
        }
    }
}
