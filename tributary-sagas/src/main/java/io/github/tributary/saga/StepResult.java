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

import io.github.tributary.core.command.Rejection;

import java.util.Objects;

/**
 * Outcome of execution or compensation of a saga step.
 */
public final class StepResult {
    private static final StepResult SUCCEEDED = new StepResult(null, null);

    private final String errorCode;
    private final String errorMessage;

    private StepResult(String errorCode, String errorMessage) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static StepResult succeeded() {
        return SUCCEEDED;
    }

    public static StepResult failed(String errorCode, String errorMessage) {
        return new StepResult(Objects.requireNonNull(errorCode, "Error code must be specified"), errorMessage);
    }

    public static StepResult failed(Rejection rejection) {
        return failed(rejection.getCode(), rejection.getMessage());
    }

    public boolean isSucceeded() {
        return errorCode == null;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSucceeded() ? "Succeeded" : "Failed[" + errorCode + ": " + errorMessage + "]";
    }
}
