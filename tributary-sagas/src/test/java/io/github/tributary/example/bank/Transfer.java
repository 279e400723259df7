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

import io.github.tributary.core.engine.AggregateEngine;
import io.github.tributary.saga.CommandStep;
import io.github.tributary.saga.SagaDefinition;

import static io.github.tributary.example.bank.AccountCommands.*;

/**
 * Money transfer between two accounts, run as a saga of withdrawal and deposit.
 */
public final class Transfer {
    private final String from;
    private final String to;
    private final long amount;

    public Transfer(String from, String to, long amount) {
        this.from = from;
        this.to = to;
        this.amount = amount;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public long getAmount() {
        return amount;
    }

    public static SagaDefinition<Transfer> saga(AggregateEngine<AccountState> accounts) {
        return SagaDefinition.<Transfer>builder("transfer")
                .step(CommandStep.<Transfer, AccountState>builder("withdraw", accounts)
                        .target(ctx -> accounts.getDefinition().streamKey(ctx.getData().getFrom()))
                        .command(ctx -> new Withdraw(ctx.getData().getAmount()))
                        .compensation(ctx -> new Deposit(ctx.getData().getAmount()))
                        .build())
                .step(CommandStep.<Transfer, AccountState>builder("deposit", accounts)
                        .target(ctx -> accounts.getDefinition().streamKey(ctx.getData().getTo()))
                        .command(ctx -> new Deposit(ctx.getData().getAmount()))
                        .compensation(ctx -> new Withdraw(ctx.getData().getAmount()))
                        .build())
                .build();
    }
}
