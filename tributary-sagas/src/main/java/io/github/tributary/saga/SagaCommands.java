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

import io.github.tributary.core.Command;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Commands driving the saga state machine. Issued by {@link SagaEngine}, handled by {@link SagaCommandHandlers}.
 * Commands carry all timestamps, so that handling them stays deterministic.
 */
public final class SagaCommands {
    private SagaCommands() {
    }

    abstract static class StepCommand implements Command {
        final int stepIndex;
        final String stepName;

        StepCommand(int stepIndex, String stepName) {
            this.stepIndex = stepIndex;
            this.stepName = Objects.requireNonNull(stepName, "Step name must be specified");
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + stepName + "#" + stepIndex + "]";
        }
    }

    public static final class Start implements Command {
        final String sagaId;
        final String stepHash;
        final int stepCount;
        final Optional<String> correlationId;
        final Instant startedAt;

        public Start(String sagaId, String stepHash, int stepCount, Optional<String> correlationId,
                Instant startedAt) {
            this.sagaId = Objects.requireNonNull(sagaId, "Saga id must be specified");
            this.stepHash = Objects.requireNonNull(stepHash, "Step hash must be specified");
            this.stepCount = stepCount;
            this.correlationId = Objects.requireNonNull(correlationId, "Correlation id must not be null");
            this.startedAt = Objects.requireNonNull(startedAt, "Start time must be specified");
        }

        @Override
        public String toString() {
            return "Start[" + sagaId + "]";
        }
    }

    /**
     * Start executing a step. Carries hash of the definition executing it, which must match the hash the saga was
     * started with.
     */
    public static final class BeginStep extends StepCommand {
        final String stepHash;

        public BeginStep(int stepIndex, String stepName, String stepHash) {
            super(stepIndex, stepName);
            this.stepHash = Objects.requireNonNull(stepHash, "Step hash must be specified");
        }
    }

    public static final class AwaitVerification extends StepCommand {
        final Instant deadline;

        public AwaitVerification(int stepIndex, String stepName, Instant deadline) {
            super(stepIndex, stepName);
            this.deadline = Objects.requireNonNull(deadline, "Deadline must be specified");
        }
    }

    public static final class CompleteStep extends StepCommand {
        public CompleteStep(int stepIndex, String stepName) {
            super(stepIndex, stepName);
        }
    }

    public static final class FailStep extends StepCommand {
        final String errorCode;
        final String errorMessage;

        public FailStep(int stepIndex, String stepName, String errorCode, String errorMessage) {
            super(stepIndex, stepName);
            this.errorCode = Objects.requireNonNull(errorCode, "Error code must be specified");
            this.errorMessage = String.valueOf(errorMessage);
        }
    }

    public static final class CompensateStep extends StepCommand {
        public CompensateStep(int stepIndex, String stepName) {
            super(stepIndex, stepName);
        }
    }

    public static final class RecordCompensationFailure extends StepCommand {
        final String errorCode;
        final String errorMessage;

        public RecordCompensationFailure(int stepIndex, String stepName, String errorCode, String errorMessage) {
            super(stepIndex, stepName);
            this.errorCode = Objects.requireNonNull(errorCode, "Error code must be specified");
            this.errorMessage = String.valueOf(errorMessage);
        }
    }

    public static final class CompleteSaga implements Command {
        final Instant completedAt;

        public CompleteSaga(Instant completedAt) {
            this.completedAt = Objects.requireNonNull(completedAt, "Completion time must be specified");
        }

        @Override
        public String toString() {
            return "CompleteSaga";
        }
    }

    /**
     * Conclude compensation, once there are no completed steps left.
     */
    public static final class FinishCompensation implements Command {
        final Instant completedAt;

        public FinishCompensation(Instant completedAt) {
            this.completedAt = Objects.requireNonNull(completedAt, "Completion time must be specified");
        }

        @Override
        public String toString() {
            return "FinishCompensation";
        }
    }
}
