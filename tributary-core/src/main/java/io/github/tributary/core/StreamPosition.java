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

/**
 * Position within an event stream. Position of an event is the version of aggregate state after that event was
 * applied. Position 0 stands for empty stream.
 */
public final class StreamPosition implements Comparable<StreamPosition> {
    public static final StreamPosition EMPTY = new StreamPosition(0);

    private final long value;

    private StreamPosition(long value) {
        this.value = value;
    }

    /**
     * Create a position.
     * @param value non-negative position
     * @return the position
     * @throws IllegalArgumentException if the value is negative
     */
    public static StreamPosition of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Stream position cannot be negative: " + value);
        }
        return value == 0 ? EMPTY : new StreamPosition(value);
    }

    public long getValue() {
        return value;
    }

    public boolean isEmpty() {
        return value == 0;
    }

    public StreamPosition next() {
        return new StreamPosition(value + 1);
    }

    public StreamPosition plus(int count) {
        return of(value + count);
    }

    /**
     * Strict comparison. Equal positions are never newer than each other.
     * @param other position to compare to
     * @return true if this position is after other
     */
    public boolean isNewerThan(StreamPosition other) {
        return value > other.value;
    }

    @Override
    public int compareTo(StreamPosition o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StreamPosition && ((StreamPosition) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
