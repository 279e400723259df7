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

import io.github.tributary.core.Event;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;

/**
 * Exception generated when appending of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;
    private final StreamPosition currentVersion;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause, StreamPosition currentVersion) {
        super(message, cause);
        this.fault = type;
        this.currentVersion = currentVersion;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * Version of the stream as known by the store when optimistic lock failed.
     * @return current version for {@link Fault#OPTIMISTIC_LOCK}, {@code null} otherwise
     */
    public StreamPosition getCurrentVersion() {
        return currentVersion;
    }

    public boolean isOptimisticLock() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException optimisticLock(StreamKey key, StreamPosition expectedVersion,
            StreamPosition currentVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + key + " append expected version "
                + expectedVersion + " while current version is " + currentVersion, null, currentVersion);
    }

    public static EventStoreException storeFailed(StreamKey key, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Append to stream " + key + " failed. " + cause.getMessage(), cause, null);
    }

    public static EventStoreException emptyAppend(StreamKey key) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Attempted to append no events to stream " + key,
                null, null);
    }

    public static EventStoreException inconsistentVersion(StreamKey key, StreamPosition expectedVersion, int appended,
            StreamPosition reportedVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Appending " + appended + " events to stream " + key
                + " at " + expectedVersion + " resulted in version " + reportedVersion, null, null);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null, null);
    }
}
