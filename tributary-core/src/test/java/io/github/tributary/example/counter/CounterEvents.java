package io.github.tributary.example.counter;

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

import java.util.Objects;

/**
 * Events of the counter.
 */
public final class CounterEvents {
    private CounterEvents() {
    }

    abstract static class AmountEvent implements Event {
        private final int amount;

        AmountEvent(int amount) {
            this.amount = amount;
        }

        public int getAmount() {
            return amount;
        }

        @Override
        public boolean equals(Object o) {
            return o != null && o.getClass() == getClass() && ((AmountEvent) o).amount == amount;
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), amount);
        }

        @Override
        public String toString() {
            return getType() + "{" + amount + "}";
        }
    }

    public static final class CounterInitializedEvent extends AmountEvent {
        public CounterInitializedEvent(int initialValue) {
            super(initialValue);
        }
    }

    public static final class CounterIncrementedEvent extends AmountEvent {
        public CounterIncrementedEvent(int amount) {
            super(amount);
        }
    }

    public static final class CounterDecrementedEvent extends AmountEvent {
        public CounterDecrementedEvent(int amount) {
            super(amount);
        }
    }

    public static final class CounterResetEvent extends AmountEvent {
        public CounterResetEvent(int newValue) {
            super(newValue);
        }
    }
}
