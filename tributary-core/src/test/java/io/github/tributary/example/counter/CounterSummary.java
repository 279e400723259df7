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

import io.github.tributary.core.reduce.RootReducer;
import io.github.tributary.core.reduce.UnknownEventPolicy;

import static io.github.tributary.example.counter.CounterEvents.*;

/**
 * Read model over counter streams, counting operations regardless of their amounts.
 */
public final class CounterSummary {
    private final int operations;
    private final boolean initialized;

    CounterSummary(int operations, boolean initialized) {
        this.operations = operations;
        this.initialized = initialized;
    }

    public int getOperations() {
        return operations;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public static RootReducer<CounterSummary> reducer() {
        return RootReducer.<CounterSummary>builder("counter-summary")
                .zero(() -> new CounterSummary(0, false))
                .on(CounterInitializedEvent.class, (s, e) -> new CounterSummary(s.operations + 1, true))
                .on(CounterIncrementedEvent.class, (s, e) -> new CounterSummary(s.operations + 1, s.initialized))
                .on(CounterDecrementedEvent.class, (s, e) -> new CounterSummary(s.operations + 1, s.initialized))
                .unknownEvents(UnknownEventPolicy.IGNORE)
                .build();
    }
}
