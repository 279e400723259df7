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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named, ordered list of steps.
 *
 * @param <D> type of data the steps operate on
 */
public final class SagaDefinition<D> {
    private final String name;
    private final List<SagaStep<D>> steps;
    private final String stepHash;

    private SagaDefinition(String name, List<SagaStep<D>> steps) {
        this.name = name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.stepHash = computeHash(steps);
    }

    public static <D> Builder<D> builder(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    public List<SagaStep<D>> getSteps() {
        return steps;
    }

    public int getStepCount() {
        return steps.size();
    }

    public boolean hasStep(int index) {
        return index >= 0 && index < steps.size();
    }

    public SagaStep<D> getStep(int index) {
        return steps.get(index);
    }

    /**
     * Hash of step names in their order. Saga started by a definition with different steps is not continued by
     * this one, its completed steps are compensated instead.
     * @return hex encoded SHA-256
     */
    public String getStepHash() {
        return stepHash;
    }

    private static String computeHash(List<? extends SagaStep<?>> steps) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (SagaStep<?> step : steps) {
                digest.update(step.getName().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            StringBuilder hex = new StringBuilder();
            for (byte b : digest.digest()) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static class Builder<D> {
        private final String name;
        private final List<SagaStep<D>> steps = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
        }

        public Builder<D> step(SagaStep<D> step) {
            Objects.requireNonNull(step, "Step must be specified");
            if (!names.add(step.getName())) {
                throw new IllegalStateException("Step " + step.getName() + " already defined in saga " + name);
            }
            steps.add(step);
            return this;
        }

        public SagaDefinition<D> build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Saga " + name + " has no steps");
            }
            return new SagaDefinition<>(name, steps);
        }
    }
}
