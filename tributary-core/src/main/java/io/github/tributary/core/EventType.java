package io.github.tributary.core;

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
 * Unique name of an event: module and category of the aggregate, name of the event within it, and its schema version.
 * Also hosts the helpers for deriving type names from class names.
 */
public final class EventType {
    private final String module;
    private final String category;
    private final String name;
    private final int schemaVersion;

    private EventType(String module, String category, String name, int schemaVersion) {
        this.module = Objects.requireNonNull(module, "Module must be specified");
        this.category = Objects.requireNonNull(category, "Category must be specified");
        this.name = Objects.requireNonNull(name, "Name must be specified");
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("Schema version must be positive: " + schemaVersion);
        }
        this.schemaVersion = schemaVersion;
    }

    public static EventType of(String module, String category, String name, int schemaVersion) {
        return new EventType(module, category, name, schemaVersion);
    }

    public String getModule() {
        return module;
    }

    public String getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public static String fromClassStripping(Class<?> clazz, String stripPrefix, String stripSuffix) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), stripPrefix, stripSuffix);
    }

    /**
     * Default implementation of type name. Strips suffix Event.
     * @param simpleClassname the name of the event class
     * @return Simple name. CounterIncrementedEvent becomes CounterIncremented.
     */
    public static String defaultTypeName(String simpleClassname) {
        return fromSimpleClassnameStripping(simpleClassname, "", "Event");
    }

    public static String defaultTypeName(Class<?> clazz) {
        return defaultTypeName(clazz.getSimpleName());
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EventType that = (EventType) o;
        return schemaVersion == that.schemaVersion && module.equals(that.module) && category.equals(that.category)
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, category, name, schemaVersion);
    }

    @Override
    public String toString() {
        return module + "/" + category + "/" + name + ".v" + schemaVersion;
    }
}
