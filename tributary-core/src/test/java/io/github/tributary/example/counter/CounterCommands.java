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

import io.github.tributary.core.Command;

/**
 * Commands of the counter.
 */
public final class CounterCommands {
    private CounterCommands() {
    }

    abstract static class AmountCommand implements Command {
        final int amount;

        AmountCommand(int amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "{" + amount + "}";
        }
    }

    public static final class InitializeCounter extends AmountCommand {
        public InitializeCounter(int initialValue) {
            super(initialValue);
        }
    }

    public static final class IncrementCounter extends AmountCommand {
        public IncrementCounter(int amount) {
            super(amount);
        }
    }

    public static final class DecrementCounter extends AmountCommand {
        public DecrementCounter(int amount) {
            super(amount);
        }
    }

    public static final class ResetCounter extends AmountCommand {
        public ResetCounter(int newValue) {
            super(newValue);
        }
    }
}
