package io.github.tributary.saga;

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

import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class SagaDefinitionTest {
    static SagaStep<String> step(String name) {
        return new SagaStep<String>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public CompletionStage<StepResult> execute(SagaContext<String> context) {
                return CompletableFuture.completedFuture(StepResult.succeeded());
            }
        };
    }

    @Test
    public void step_hash_depends_on_names_and_order() {
        String hash = SagaDefinition.<String>builder("a").step(step("one")).step(step("two")).build().getStepHash();
        String same = SagaDefinition.<String>builder("b").step(step("one")).step(step("two")).build().getStepHash();
        String reordered = SagaDefinition.<String>builder("a").step(step("two")).step(step("one")).build()
                .getStepHash();
        String joined = SagaDefinition.<String>builder("a").step(step("one\ntwo")).build().getStepHash();

        assertEquals(same, hash);
        assertNotEquals(hash, reordered);
        assertNotEquals(hash, joined);
        assertThat(hash, matchesPattern("[0-9a-f]{64}"));
    }

    @Test
    public void steps_are_indexed_in_order() {
        SagaDefinition<String> definition = SagaDefinition.<String>builder("a")
                .step(step("one")).step(step("two")).build();
        assertEquals(2, definition.getStepCount());
        assertEquals("two", definition.getStep(1).getName());
        assertTrue(definition.hasStep(0));
        assertFalse(definition.hasStep(2));
        assertFalse(definition.hasStep(-1));
    }

    @Test(expected = IllegalStateException.class)
    public void step_names_must_be_unique() {
        SagaDefinition.<String>builder("a").step(step("one")).step(step("one"));
    }

    @Test(expected = IllegalStateException.class)
    public void saga_needs_a_step() {
        SagaDefinition.<String>builder("a").build();
    }

    @Test
    public void default_step_is_not_compensatable() throws Exception {
        SagaStep<String> step = step("one");
        assertFalse(step.isCompensatable());
        assertFalse(step.verification().isPresent());
        assertTrue(step.compensate(null).toCompletableFuture().get().isSucceeded());
    }
}
