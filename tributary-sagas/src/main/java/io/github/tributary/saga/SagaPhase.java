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

/**
 * Lifecycle phase of a saga.
 */
public enum SagaPhase {
    /**
     * No saga with given id was started.
     */
    NOT_STARTED,
    /**
     * Steps are being executed.
     */
    RUNNING,
    /**
     * Command of current step succeeded, its effect is being verified.
     */
    AWAITING_VERIFICATION,
    /**
     * A step failed, completed steps are being compensated in reverse order.
     */
    COMPENSATING,
    /**
     * All steps completed, or all completed steps were compensated.
     */
    COMPLETED,
    /**
     * Some compensations could not be applied. Terminal, requires manual remediation.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
