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

import io.github.tributary.core.Event;
import io.github.tributary.core.QuerySnapshot;
import io.github.tributary.core.StreamPosition;
import io.github.tributary.core.command.ErrorCodes;
import io.github.tributary.core.command.Rejection;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a command sent to {@link AggregateEngine}.
 * <ul>
 *     <li>{@link Kind#ACCEPTED}: events were appended (possibly none), carries resulting snapshot</li>
 *     <li>{@link Kind#REJECTED}: command handler refused the command, nothing was appended</li>
 *     <li>{@link Kind#CONFLICT}: the stream advanced concurrently more times than the engine was willing to retry,
 *     or the caller's expected version was not current</li>
 * </ul>
 *
 * @param <S> type of state
 */
public final class CommandResult<S> {
    public enum Kind {
        ACCEPTED, REJECTED, CONFLICT
    }

    private final Kind kind;
    private final QuerySnapshot<S> snapshot;
    private final List<Event> events;
    private final Rejection rejection;
    private final StreamPosition expectedVersion;
    private final StreamPosition currentVersion;

    private CommandResult(Kind kind, QuerySnapshot<S> snapshot, List<Event> events, Rejection rejection,
            StreamPosition expectedVersion, StreamPosition currentVersion) {
        this.kind = kind;
        this.snapshot = snapshot;
        this.events = events;
        this.rejection = rejection;
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    public static <S> CommandResult<S> accepted(QuerySnapshot<S> snapshot, List<Event> events) {
        return new CommandResult<>(Kind.ACCEPTED, snapshot, Collections.unmodifiableList(events), null, null,
                snapshot.getVersion());
    }

    public static <S> CommandResult<S> rejected(Rejection rejection, StreamPosition currentVersion) {
        return new CommandResult<>(Kind.REJECTED, null, Collections.emptyList(), rejection, null, currentVersion);
    }

    public static <S> CommandResult<S> conflict(StreamPosition expectedVersion, StreamPosition currentVersion) {
        return new CommandResult<>(Kind.CONFLICT, null, Collections.emptyList(), null, expectedVersion, currentVersion);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public boolean isConflict() {
        return kind == Kind.CONFLICT;
    }

    /**
     * State after the command.
     * @return the snapshot, {@code null} unless accepted
     */
    public QuerySnapshot<S> getSnapshot() {
        return snapshot;
    }

    /**
     * Events appended by the command.
     * @return appended events, empty unless accepted
     */
    public List<Event> getEvents() {
        return events;
    }

    /**
     * @return the rejection, {@code null} unless rejected
     */
    public Rejection getRejection() {
        return rejection;
    }

    /**
     * @return version the append expected, {@code null} unless conflict
     */
    public StreamPosition getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * Version of the stream as known when the command completed. For conflicts, this is the version reported by the
     * event store.
     * @return current version
     */
    public StreamPosition getCurrentVersion() {
        return currentVersion;
    }

    /**
     * Express a failed outcome as rejection. Conflicts map to {@link ErrorCodes#CONCURRENCY_CONFLICT}.
     * @return rejection, or {@code null} if accepted
     */
    public Rejection asRejection() {
        switch (kind) {
            case REJECTED:
                return rejection;
            case CONFLICT:
                return Rejection.of(ErrorCodes.CONCURRENCY_CONFLICT, "Expected version " + expectedVersion
                        + " but stream is at " + currentVersion);
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case ACCEPTED:
                return "Accepted[" + snapshot + ", events=" + events + "]";
            case REJECTED:
                return "Rejected[" + rejection + "]";
            default:
                return "Conflict[expected=" + expectedVersion + ", current=" + currentVersion + "]";
        }
    }
}
