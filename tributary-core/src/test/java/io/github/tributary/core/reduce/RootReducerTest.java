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
import io.github.tributary.example.counter.Counter;
import io.github.tributary.example.counter.CounterState;
import io.github.tributary.example.counter.CounterSummary;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.tributary.example.counter.CounterEvents.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class RootReducerTest {
    private final RootReducer<CounterState> reducer = Counter.reducer();

    private final List<Event> history = Arrays.asList(new CounterInitializedEvent(2),
            new CounterIncrementedEvent(3), new CounterDecrementedEvent(1), new CounterIncrementedEvent(4));

    static class UnknownEvent implements Event {
    }

    static class SpecialIncrementEvent implements Event {
    }

    static class DoubleIncrementEvent extends SpecialIncrementEvent {
    }

    @Test
    public void folding_same_events_gives_equal_states() {
        assertEquals(reducer.foldFromZero(history), reducer.foldFromZero(history));
        assertEquals(reducer.foldFromZero(history), Counter.reducer().foldFromZero(history));
    }

    @Test
    public void fold_can_be_split_at_any_point() {
        CounterState whole = reducer.foldFromZero(history);
        for (int i = 0; i <= history.size(); i++) {
            CounterState prefix = reducer.foldFromZero(history.subList(0, i));
            assertEquals("Split at " + i, whole, reducer.fold(prefix, history.subList(i, history.size())));
        }
        assertEquals(8, whole.getCount());
        assertEquals(2, whole.getIncrementCount());
    }

    @Test
    public void zero_state_is_null_unless_specified() {
        assertNull(reducer.zero());
        assertNotNull(CounterSummary.reducer().zero());
    }

    @Test
    public void unknown_event_is_rejected_by_default() {
        try {
            reducer.reduce(null, new UnknownEvent());
            fail("Unknown event should be rejected");
        } catch (SchemaMismatchException e) {
            assertEquals("Unknown", e.getEventType());
        }
        assertFalse(reducer.recognizes(new UnknownEvent()));
    }

    @Test(expected = SchemaMismatchException.class)
    public void verification_fails_for_unknown_event() {
        reducer.verifySupported(Arrays.asList(new CounterIncrementedEvent(1), new UnknownEvent()));
    }

    @Test
    public void unknown_event_is_skipped_when_ignored() {
        RootReducer<CounterSummary> summary = CounterSummary.reducer();
        CounterSummary state = summary.foldFromZero(Arrays.asList(new CounterIncrementedEvent(1), new UnknownEvent(),
                new CounterResetEvent(0)));
        assertEquals(1, state.getOperations());
        summary.verifySupported(Arrays.asList(new UnknownEvent()));
    }

    @Test
    public void reducer_of_supertype_applies_to_subtypes() {
        RootReducer<Integer> special = RootReducer.<Integer>builder("special")
                .zero(() -> 0)
                .on(SpecialIncrementEvent.class, (s, e) -> s + 1)
                .build();
        assertTrue(special.recognizes(new DoubleIncrementEvent()));
        assertEquals(Integer.valueOf(2), special.foldFromZero(Arrays.asList(new DoubleIncrementEvent(),
                new SpecialIncrementEvent())));
    }

    @Test
    public void exact_registration_takes_precedence() {
        RootReducer<Integer> special = RootReducer.<Integer>builder("special")
                .zero(() -> 0)
                .on(SpecialIncrementEvent.class, (s, e) -> s + 1)
                .on(DoubleIncrementEvent.class, (s, e) -> s + 2)
                .build();
        assertEquals(Integer.valueOf(3), special.foldFromZero(Arrays.asList(new DoubleIncrementEvent(),
                new SpecialIncrementEvent())));
    }

    @Test(expected = IllegalStateException.class)
    public void event_class_may_be_registered_once() {
        RootReducer.<Integer>builder("twice")
                .on(UnknownEvent.class, (s, e) -> s)
                .on(UnknownEvent.class, (s, e) -> s);
    }

    @Test
    public void hash_identifies_registered_events_and_revision() {
        assertEquals(reducer.getHash(), Counter.reducer().getHash());
        assertThat(reducer.getHash(), not(equalTo(CounterSummary.reducer().getHash())));
        RootReducer<Integer> first = RootReducer.<Integer>builder("a").on(UnknownEvent.class, (s, e) -> s).build();
        RootReducer<Integer> second = RootReducer.<Integer>builder("a").on(UnknownEvent.class, (s, e) -> s)
                .revision("2").build();
        assertThat(first.getHash(), not(equalTo(second.getHash())));
        assertThat(first.getHash().length(), equalTo(64));
    }
}
