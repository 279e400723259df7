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

/**
 * String codec of aggregate states kept in snapshots.
 *
 * <p>Every payload is stored with the payload version it was written in. A serialization reads the versions it still
 * understands, and refuses older ones by returning {@code null}, in which case the state is replayed from the stream.
 * An incompatible change of the state class therefore needs a new payload version.</p>
 *
 * @param <T> type of serialized state
 */
public interface Serialization<T> {
    int payloadVersion(T state);

    String serialize(T state);

    /**
     * @param key stream the snapshot belongs to
     * @param payloadVersion version the payload was written in
     * @param payload the payload
     * @return the state, or {@code null} when the payload version is not readable anymore
     */
    T deserialize(StreamKey key, int payloadVersion, String payload);

    /**
     * Narrow a state to serialized type.
     * @return the state, or {@code null} when it is not of serialized type
     */
    T toSerializable(Object state);
}
