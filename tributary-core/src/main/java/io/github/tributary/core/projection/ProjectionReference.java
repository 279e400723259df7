package io.github.tributary.core.projection;

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

import io.github.tributary.core.StreamKey;
import io.github.tributary.core.StreamPosition;

import java.util.Objects;

/**
 * Cheap handle of a projection's cached entry: which projection, which stream, and what version it holds.
 */
public final class ProjectionReference {
    private final String projection;
    private final StreamKey streamKey;
    private final StreamPosition version;

    public ProjectionReference(String projection, StreamKey streamKey, StreamPosition version) {
        this.projection = projection;
        this.streamKey = streamKey;
        this.version = version;
    }

    public String getProjection() {
        return projection;
    }

    public StreamKey getStreamKey() {
        return streamKey;
    }

    public StreamPosition getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProjectionReference)) {
            return false;
        }
        ProjectionReference that = (ProjectionReference) o;
        return projection.equals(that.projection) && streamKey.equals(that.streamKey) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projection, streamKey, version);
    }

    @Override
    public String toString() {
        return projection + "[" + streamKey + "@" + version + "]";
    }
}
