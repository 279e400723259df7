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
import io.github.tributary.core.command.ErrorCodes;
import io.github.tributary.core.testing.AggregateScenario;
import org.junit.Test;

import static io.github.tributary.example.counter.CounterCommands.*;
import static io.github.tributary.example.counter.CounterEvents.*;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertSame;

public class CounterTest {
    private final AggregateScenario<CounterState> scenario = AggregateScenario.of(Counter.definition());

    @Test
    public void increment_of_new_counter_starts_from_zero() {
        scenario.when(new IncrementCounter(5))
                .thenEvents(new CounterIncrementedEvent(5))
                .when(new IncrementCounter(1))
                .thenEvents(new CounterIncrementedEvent(1))
                .thenState(equalTo(new CounterState(6, 2, 0, 0)));
    }

    @Test
    public void counter_cannot_go_below_zero() {
        scenario.given(new CounterIncrementedEvent(2))
                .when(new DecrementCounter(5))
                .thenRejected(ErrorCodes.INVARIANT_VIOLATION)
                .thenState(hasProperty("count", equalTo(2)));
    }

    @Test
    public void decrement_to_exactly_zero_is_allowed() {
        scenario.given(new CounterInitializedEvent(3))
                .when(new DecrementCounter(3))
                .thenEvents(new CounterDecrementedEvent(3))
                .thenState(hasProperty("count", equalTo(0)));
    }

    @Test
    public void amount_must_be_positive() {
        scenario.when(new IncrementCounter(0)).thenRejected(ErrorCodes.INVALID_ARGUMENT);
        scenario.when(new DecrementCounter(-1)).thenRejected(ErrorCodes.INVALID_ARGUMENT);
    }

    @Test
    public void counter_is_initialized_once() {
        scenario.when(new InitializeCounter(10))
                .thenEvents(new CounterInitializedEvent(10))
                .when(new InitializeCounter(1))
                .thenRejected(ErrorCodes.ALREADY_EXISTS)
                .thenState(hasProperty("count", equalTo(10)));
    }

    @Test
    public void reset_requires_existing_counter() {
        scenario.when(new ResetCounter(1)).thenRejected(ErrorCodes.NOT_FOUND);
        scenario.given(new CounterIncrementedEvent(4))
                .when(new ResetCounter(1))
                .thenEvents(new CounterResetEvent(1))
                .thenState(equalTo(new CounterState(1, 1, 0, 1)));
    }

    @Test
    public void rejection_leaves_state_untouched() {
        scenario.given(new CounterIncrementedEvent(1));
        CounterState before = scenario.getState();
        scenario.when(new DecrementCounter(2)).thenRejected(ErrorCodes.INVARIANT_VIOLATION);
        assertSame(before, scenario.getState());
    }

    @Test
    public void unknown_command_is_rejected() {
        scenario.when(new Command() {
        }).thenRejected(ErrorCodes.COMMAND_HANDLER_NOT_FOUND);
    }
}
