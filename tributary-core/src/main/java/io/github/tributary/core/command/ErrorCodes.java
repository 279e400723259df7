package io.github.tributary.core.command;

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
 * Machine readable codes of rejections produced by the core and recommended for command handlers.
 */
public final class ErrorCodes {
    private ErrorCodes() {
    }

    public static final String ALREADY_EXISTS = "AlreadyExists";
    public static final String NOT_FOUND = "NotFound";
    public static final String INVARIANT_VIOLATION = "InvariantViolation";
    public static final String INVALID_ARGUMENT = "InvalidArgument";
    public static final String COMMAND_HANDLER_NOT_FOUND = "CommandHandlerNotFound";
    public static final String CONCURRENCY_CONFLICT = "ConcurrencyConflict";
}
