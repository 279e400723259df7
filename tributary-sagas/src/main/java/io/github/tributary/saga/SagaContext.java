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

import java.util.Objects;
import java.util.Optional;

/**
 * What a step knows about the saga it executes in.
 *
 * @param <D> type of saga data
 */
public final class SagaContext<D> {
    private final String sagaId;
    private final Optional<String> correlationId;
    private final D data;
    private final int stepIndex;

    SagaContext(String sagaId, Optional<String> correlationId, D data, int stepIndex) {
        this.sagaId = Objects.requireNonNull(sagaId);
        this.correlationId = Objects.requireNonNull(correlationId);
        this.data = data;
        this.stepIndex = stepIndex;
    }

    public String getSagaId() {
        return sagaId;
    }

    public Optional<String> getCorrelationId() {
        return correlationId;
    }

    public D getData() {
        return data;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    @Override
    public String toString() {
        return "SagaContext[" + sagaId + ", step=" + stepIndex + "]";
    }
}
