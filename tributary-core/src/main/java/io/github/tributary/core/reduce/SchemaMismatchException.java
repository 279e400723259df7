package io.github.tributary.core.reduce;

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

import io.github.tributary.core.Event;

/**
 * An event was encountered, that the reducer of an aggregate cannot interpret. This is fatal for the stream, and the
 * operation that encountered it is not retried.
 */
public class SchemaMismatchException extends RuntimeException {
    private final String eventType;

    public SchemaMismatchException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public static SchemaMismatchException unknownEvent(String reducerName, Event event) {
        return new SchemaMismatchException(event.getType(), "Reducer " + reducerName
                + " cannot interpret event of type " + event.getType() + " (" + event.getClass().getName() + ")");
    }

    public String getEventType() {
        return eventType;
    }
}
