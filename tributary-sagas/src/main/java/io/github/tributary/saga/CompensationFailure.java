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

/**
 * Record of a step, whose compensation could not be applied.
 */
public final class CompensationFailure {
    private final int stepIndex;
    private final String stepName;
    private final String errorCode;
    private final String errorMessage;

    public CompensationFailure(int stepIndex, String stepName, String errorCode, String errorMessage) {
        this.stepIndex = stepIndex;
        this.stepName = Objects.requireNonNull(stepName, "Step name must be specified");
        this.errorCode = Objects.requireNonNull(errorCode, "Error code must be specified");
        this.errorMessage = errorMessage;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return stepName;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompensationFailure that = (CompensationFailure) o;
        return stepIndex == that.stepIndex && stepName.equals(that.stepName) && errorCode.equals(that.errorCode)
                && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepIndex, stepName, errorCode, errorMessage);
    }

    @Override
    public String toString() {
        return stepName + "#" + stepIndex + ": " + errorCode + " " + errorMessage;
    }
}
