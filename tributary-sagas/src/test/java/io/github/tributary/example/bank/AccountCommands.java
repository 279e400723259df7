package io.github.tributary.example.bank;

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

public final class AccountCommands {
    private AccountCommands() {
    }

    public static final class OpenAccount implements Command {
        final String owner;

        public OpenAccount(String owner) {
            this.owner = owner;
        }
    }

    abstract static class MovementCommand implements Command {
        final long amount;

        MovementCommand(long amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "{" + amount + "}";
        }
    }

    public static final class Deposit extends MovementCommand {
        public Deposit(long amount) {
            super(amount);
        }
    }

    public static final class Withdraw extends MovementCommand {
        public Withdraw(long amount) {
            super(amount);
        }
    }
}
