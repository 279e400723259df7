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

import java.util.Objects;

/**
 * Typed refusal of a command. Carries machine readable code and human readable message.
 */
public final class Rejection {
    private final String code;
    private final String message;

    private Rejection(String code, String message) {
        this.code = Objects.requireNonNull(code, "Code must be specified");
        this.message = Objects.requireNonNull(message, "Message must be specified");
    }

    public static Rejection of(String code, String message) {
        return new Rejection(code, message);
    }

    public static Rejection alreadyExists(String message) {
        return of(ErrorCodes.ALREADY_EXISTS, message);
    }

    public static Rejection notFound(String message) {
        return of(ErrorCodes.NOT_FOUND, message);
    }

    public static Rejection invariantViolation(String message) {
        return of(ErrorCodes.INVARIANT_VIOLATION, message);
    }

    public static Rejection invalidArgument(String message) {
        return of(ErrorCodes.INVALID_ARGUMENT, message);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rejection)) {
            return false;
        }
        Rejection that = (Rejection) o;
        return code.equals(that.code) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
