package io.github.tributary.core.testing;

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
import io.github.tributary.core.Event;
import io.github.tributary.core.command.Decision;
import io.github.tributary.core.command.RootCommandHandler;
import io.github.tributary.core.engine.AggregateDefinition;
import io.github.tributary.core.reduce.RootReducer;
import org.hamcrest.Matcher;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Given-when-then harness for testing aggregate logic without any store or threads.
 * <pre>
 *     AggregateScenario.of(Counter.definition())
 *         .given(new CounterIncrementedEvent(5))
 *         .when(new IncrementCounter(1))
 *         .thenEvents(new CounterIncrementedEvent(1));
 * </pre>
 *
 * @param <S> type of state
 */
public final class AggregateScenario<S> {
    private final RootReducer<S> reducer;
    private final RootCommandHandler<S> commandHandler;
    private S state;
    private Decision decision;

    private AggregateScenario(RootReducer<S> reducer, RootCommandHandler<S> commandHandler) {
        this.reducer = reducer;
        this.commandHandler = commandHandler;
        this.state = reducer.zero();
    }

    public static <S> AggregateScenario<S> of(AggregateDefinition<S> definition) {
        return new AggregateScenario<>(definition.getReducer(), definition.getCommandHandler());
    }

    public AggregateScenario<S> given(Event... history) {
        state = reducer.fold(state, Arrays.asList(history));
        return this;
    }

    /**
     * Decide the command against current state, and apply the events when accepted.
     */
    public AggregateScenario<S> when(Command command) {
        decision = commandHandler.handle(command, state);
        if (decision.isAccepted()) {
            state = reducer.fold(state, decision.getEvents());
        }
        return this;
    }

    public AggregateScenario<S> thenEvents(Event... expected) {
        assertTrue("Expected acceptance, but got " + decision, decision.isAccepted());
        assertEquals(Arrays.asList(expected), decision.getEvents());
        return this;
    }

    public AggregateScenario<S> thenRejected(String code) {
        assertTrue("Expected rejection, but got " + decision, decision.isRejected());
        assertEquals(code, decision.getRejection().getCode());
        return this;
    }

    public AggregateScenario<S> thenState(Matcher<? super S> matcher) {
        assertThat(state, matcher);
        return this;
    }

    public S getState() {
        return state;
    }

    public Decision getDecision() {
        return decision;
    }
}
