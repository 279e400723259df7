package io.github.tributary.core.command;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of handling a command. Either an ordered list of events to append, or a {@link Rejection}.
 */
public final class Decision {
    private static final Decision NONE = new Decision(Collections.emptyList(), null);

    private final List<Event> events;
    private final Rejection rejection;

    private Decision(List<Event> events, Rejection rejection) {
        this.events = events;
        this.rejection = rejection;
    }

    public static Decision accept(Event... events) {
        return accept(Arrays.asList(events));
    }

    public static Decision accept(List<? extends Event> events) {
        Objects.requireNonNull(events, "Events must be specified");
        for (Event event : events) {
            Objects.requireNonNull(event, "Events must not contain null");
        }
        return events.isEmpty() ? NONE : new Decision(Collections.unmodifiableList(new ArrayList<Event>(events)), null);
    }

    /**
     * Accept the command without producing any event. Used when the command has already been applied.
     * @return accepted decision with no events
     */
    public static Decision none() {
        return NONE;
    }

    public static Decision reject(Rejection rejection) {
        return new Decision(Collections.emptyList(), Objects.requireNonNull(rejection, "Rejection must be specified"));
    }

    public static Decision reject(String code, String message) {
        return reject(Rejection.of(code, message));
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public boolean isRejected() {
        return rejection != null;
    }

    /**
     * Events to append.
     * @return the events, empty if rejected
     */
    public List<Event> getEvents() {
        return events;
    }

    /**
     * The rejection.
     * @return rejection, or {@code null} if accepted
     */
    public Rejection getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted" + events : "Rejected[" + rejection + "]";
    }
}
