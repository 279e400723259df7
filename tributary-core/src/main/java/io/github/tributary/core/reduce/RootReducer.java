package io.github.tributary.core.reduce;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Folds ordered sequence of events into aggregate state.
 *
 * <p>Reducers are registered per event class when the root reducer is built. At runtime the event's class is looked
 * up in the registry, when there's no exact match the first registered supertype applies, and the resolution is
 * remembered. Events are always applied in the order they are given.</p>
 *
 * <p>Root reducer has a hash, that identifies the set of registered event types. Snapshots store the hash, so that
 * a snapshot produced by different set of reducers is not used.</p>
 *
 * @param <S> type of state
 */
public final class RootReducer<S> {
    private static final Logger logger = LoggerFactory.getLogger(RootReducer.class);

    private final String name;
    private final Supplier<S> zero;
    private final Map<Class<?>, Reducer<S, Event>> reducers;
    private final ConcurrentMap<Class<?>, Reducer<S, Event>> resolved = new ConcurrentHashMap<>();
    // marks event classes without reducer in the resolution cache
    private final Reducer<S, Event> unresolved = (s, e) -> s;
    private final UnknownEventPolicy unknownEventPolicy;
    private final String hash;

    private RootReducer(Builder<S> builder) {
        this.name = builder.name;
        this.zero = builder.zero;
        this.reducers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.reducers));
        this.unknownEventPolicy = builder.unknownEventPolicy;
        this.hash = computeHash(builder.revision, reducers.keySet());
    }

    public static <S> Builder<S> builder(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    public UnknownEventPolicy getUnknownEventPolicy() {
        return unknownEventPolicy;
    }

    /**
     * Hash identifying the registered event types and revision of this reducer.
     * @return hex encoded SHA-256
     */
    public String getHash() {
        return hash;
    }

    /**
     * The state of an aggregate before any event happened.
     * @return zero state, may be {@code null}
     */
    public S zero() {
        return zero.get();
    }

    /**
     * Apply single event.
     * @param state current state
     * @param event event to apply
     * @return new state
     * @throws SchemaMismatchException when event is not recognized, and policy is {@link UnknownEventPolicy#REJECT}
     */
    public S reduce(S state, Event event) {
        Reducer<S, Event> reducer = resolve(event);
        if (reducer == unresolved) {
            if (unknownEventPolicy == UnknownEventPolicy.REJECT) {
                throw SchemaMismatchException.unknownEvent(name, event);
            }
            logger.debug("Reducer {} ignores event {}", name, event.getType());
            return state;
        }
        return reducer.reduce(state, event);
    }

    /**
     * Fold events into state, left to right.
     * @param state state to start from
     * @param events events in order as persisted
     * @return resulting state
     */
    public S fold(S state, Iterable<? extends Event> events) {
        S result = state;
        for (Event event : events) {
            result = reduce(result, event);
        }
        return result;
    }

    public S foldFromZero(Iterable<? extends Event> events) {
        return fold(zero(), events);
    }

    /**
     * Whether there is a reducer for the event.
     * @param event the event
     * @return true if a reducer is registered for event's class or any of its supertypes
     */
    public boolean recognizes(Event event) {
        return resolve(event) != unresolved;
    }

    /**
     * Check that events can be reduced, without reducing them.
     * @param events events to check
     * @throws SchemaMismatchException for first unrecognized event, when policy is {@link UnknownEventPolicy#REJECT}
     */
    public void verifySupported(Iterable<? extends Event> events) {
        if (unknownEventPolicy == UnknownEventPolicy.IGNORE) {
            return;
        }
        for (Event event : events) {
            if (!recognizes(event)) {
                throw SchemaMismatchException.unknownEvent(name, event);
            }
        }
    }

    private Reducer<S, Event> resolve(Event event) {
        Objects.requireNonNull(event, "Event must be specified");
        return resolved.computeIfAbsent(event.getClass(), clazz -> {
            Reducer<S, Event> exact = reducers.get(clazz);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<Class<?>, Reducer<S, Event>> entry : reducers.entrySet()) {
                if (entry.getKey().isAssignableFrom(clazz)) {
                    return entry.getValue();
                }
            }
            return unresolved;
        });
    }

    private static String computeHash(String revision, Iterable<Class<?>> eventTypes) {
        List<String> names = new ArrayList<>();
        for (Class<?> eventType : eventTypes) {
            names.add(eventType.getName());
        }
        Collections.sort(names);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(revision.getBytes(StandardCharsets.UTF_8));
            for (String typeName : names) {
                digest.update((byte) '\n');
                digest.update(typeName.getBytes(StandardCharsets.UTF_8));
            }
            StringBuilder hex = new StringBuilder();
            for (byte b : digest.digest()) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static class Builder<S> {
        private final String name;
        private Supplier<S> zero = () -> null;
        private final Map<Class<?>, Reducer<S, Event>> reducers = new LinkedHashMap<>();
        private UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.REJECT;
        private String revision = "";

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
        }

        /**
         * State before any event. {@code null} if not specified.
         * @param zero supplier of zero state
         * @return this
         */
        public Builder<S> zero(Supplier<S> zero) {
            this.zero = Objects.requireNonNull(zero, "Zero state supplier must be specified");
            return this;
        }

        public <E extends Event> Builder<S> on(Class<E> eventClass, Reducer<S, E> reducer) {
            Objects.requireNonNull(eventClass, "Event class must be specified");
            Objects.requireNonNull(reducer, "Reducer must be specified");
            Reducer<S, Event> checked = (state, event) -> reducer.reduce(state, eventClass.cast(event));
            if (reducers.putIfAbsent(eventClass, checked) != null) {
                throw new IllegalStateException("Reducer for " + eventClass.getName() + " already registered in " + name);
            }
            return this;
        }

        public Builder<S> unknownEvents(UnknownEventPolicy policy) {
            this.unknownEventPolicy = Objects.requireNonNull(policy, "Policy must be specified");
            return this;
        }

        /**
         * Label distinguishing changes of reducer logic, that do not change the set of events. Changing the revision
         * invalidates stored snapshots.
         * @param revision revision label
         * @return this
         */
        public Builder<S> revision(String revision) {
            this.revision = Objects.requireNonNull(revision, "Revision must be specified");
            return this;
        }

        public RootReducer<S> build() {
            return new RootReducer<>(this);
        }
    }
}
