package io.github.tributary.core;

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

import java.time.Instant;
import java.util.Objects;

/**
 * An event as it was appended to a stream. The metadata are stored outside of the payload to enable querying and
 * deserialization.
 */
public final class RecordedEvent {
    private final StreamKey streamKey;
    private final StreamPosition position;
    private final Instant timestamp;
    private final Event payload;

    public RecordedEvent(StreamKey streamKey, StreamPosition position, Instant timestamp, Event payload) {
        this.streamKey = Objects.requireNonNull(streamKey, "Stream key must be specified");
        this.position = Objects.requireNonNull(position, "Position must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
        if (position.isEmpty()) {
            throw new IllegalArgumentException("Recorded event cannot be at empty position");
        }
    }

    public StreamKey getStreamKey() {
        return streamKey;
    }

    public StreamPosition getPosition() {
        return position;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Event getPayload() {
        return payload;
    }

    public EventType getEventType() {
        return EventType.of(streamKey.getModule(), streamKey.getCategory(), payload.getType(),
                payload.getSchemaVersion());
    }

    @Override
    public String toString() {
        return "RecordedEvent[" + streamKey + "@" + position + ", " + getEventType() + "]";
    }
}
