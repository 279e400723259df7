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

import java.util.Objects;

/**
 * Aggregate state as of a specific stream position. It is a point-in-time read, that never changes. Newer state is
 * obtained by querying again.
 *
 * @param <S> type of state
 */
public final class QuerySnapshot<S> {
    private final S state;
    private final StreamPosition version;

    public QuerySnapshot(S state, StreamPosition version) {
        this.state = state;
        this.version = Objects.requireNonNull(version, "Version must be specified");
    }

    public static <S> QuerySnapshot<S> empty(S zero) {
        return new QuerySnapshot<>(zero, StreamPosition.EMPTY);
    }

    /**
     * The state. May be {@code null} for aggregates whose zero state is {@code null}.
     * @return the state
     */
    public S getState() {
        return state;
    }

    public StreamPosition getVersion() {
        return version;
    }

    public boolean isNewerThan(QuerySnapshot<?> other) {
        return version.isNewerThan(other.version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuerySnapshot)) {
            return false;
        }
        QuerySnapshot<?> that = (QuerySnapshot<?>) o;
        return version.equals(that.version) && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, version);
    }

    @Override
    public String toString() {
        return "QuerySnapshot[version=" + version + ", state=" + state + "]";
    }
}
