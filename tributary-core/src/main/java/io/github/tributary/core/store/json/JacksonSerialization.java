package io.github.tributary.core.store.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.tributary.core.StreamKey;
import io.github.tributary.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON serialization of a single type using Jackson. Payloads of other version than the current one are not
 * deserialized, so that the state is replayed from events instead.
 *
 * @param <T> serialized type
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonSerialization.class);

    private final ObjectMapper mapper;
    private final Class<T> type;
    private final int payloadVersion;

    public JacksonSerialization(ObjectMapper mapper, Class<T> type, int payloadVersion) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
        this.payloadVersion = payloadVersion;
    }

    public JacksonSerialization(Class<T> type, int payloadVersion) {
        this(defaultMapper(), type, payloadVersion);
    }

    /**
     * Object mapper supporting Optionals and java.time, writing dates as ISO strings.
     * @return new object mapper
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public int payloadVersion(T state) {
        return payloadVersion;
    }

    @Override
    public String serialize(T state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public T deserialize(StreamKey key, int payloadVersion, String payload) {
        if (payloadVersion != this.payloadVersion) {
            logger.info("Snapshot of {} has payload version {} of {}, current version is {}. It will be replayed",
                    key, payloadVersion, this.type.getSimpleName(), this.payloadVersion);
            return null;
        }
        try {
            return mapper.readValue(payload, this.type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public T toSerializable(Object state) {
        return type.isInstance(state) ? type.cast(state) : null;
    }
}
