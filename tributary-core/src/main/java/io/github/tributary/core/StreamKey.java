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
 * Identity of a single event stream, and therefore of a single aggregate instance.
 *
 * <p>A key is composed of the module owning the aggregate, the aggregate category (its type) and the id of an
 * instance. Its string form is {@code module|category|id}, where only the id may contain the separator.</p>
 */
public final class StreamKey {
    static final char SEPARATOR = '|';

    private final String module;
    private final String category;
    private final String id;

    private StreamKey(String module, String category, String id) {
        this.module = requireSegment(module, "Module");
        this.category = requireSegment(category, "Category");
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Id must be specified");
        }
        this.id = id;
    }

    private static String requireSegment(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must be specified");
        }
        if (value.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(name + " must not contain '" + SEPARATOR + "': " + value);
        }
        return value;
    }

    public static StreamKey of(String module, String category, String id) {
        return new StreamKey(module, category, id);
    }

    /**
     * Parse key from its string form.
     * @param key string in form {@code module|category|id}
     * @return parsed key
     * @throws IllegalArgumentException when the string is not a valid key
     */
    public static StreamKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key must be specified");
        }
        int first = key.indexOf(SEPARATOR);
        int second = first < 0 ? -1 : key.indexOf(SEPARATOR, first + 1);
        if (second < 0) {
            throw new IllegalArgumentException("Malformed stream key: " + key);
        }
        return new StreamKey(key.substring(0, first), key.substring(first + 1, second), key.substring(second + 1));
    }

    public String getModule() {
        return module;
    }

    public String getCategory() {
        return category;
    }

    public String getId() {
        return id;
    }

    /**
     * Whether this key belongs to given aggregate type.
     * @param module module of the aggregate
     * @param category category of the aggregate
     * @return true if both module and category match
     */
    public boolean belongsTo(String module, String category) {
        return this.module.equals(module) && this.category.equals(category);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StreamKey that = (StreamKey) o;
        return module.equals(that.module) && category.equals(that.category) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, category, id);
    }

    @Override
    public String toString() {
        return module + SEPARATOR + category + SEPARATOR + id;
    }
}
