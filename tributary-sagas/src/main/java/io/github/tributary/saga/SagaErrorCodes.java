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
 * Codes of step failures and rejections specific to sagas.
 * @see io.github.tributary.core.command.ErrorCodes
 */
public final class SagaErrorCodes {
    private SagaErrorCodes() {
    }

    public static final String STEP_NOT_FOUND = "StepNotFound";
    public static final String STEP_EXCEPTION = "StepException";
    public static final String STEP_HASH_MISMATCH = "StepHashMismatch";
    public static final String STEP_TIMEOUT = "StepTimeout";
    public static final String COMPENSATION_FAILED = "CompensationFailed";
    public static final String INVALID_TRANSITION = "InvalidTransition";
}
