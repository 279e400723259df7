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

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds of projection cache. A stream dropped from the cache is restored from snapshot and log on next read.
 */
public final class CacheSettings {
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;
    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofMinutes(10);

    private static final CacheSettings DEFAULTS = new CacheSettings(DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_ACCESS);

    private final long maximumSize;
    private final Duration expireAfterAccess;

    private CacheSettings(long maximumSize, Duration expireAfterAccess) {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("Cache must hold at least one stream, got " + maximumSize);
        }
        this.expireAfterAccess = Objects.requireNonNull(expireAfterAccess, "Expiry must be specified");
        if (expireAfterAccess.isNegative() || expireAfterAccess.isZero()) {
            throw new IllegalArgumentException("Expiry must be positive, got " + expireAfterAccess);
        }
        this.maximumSize = maximumSize;
    }

    public static CacheSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Number of streams kept in cache.
     */
    public CacheSettings withMaximumSize(long maximumSize) {
        return new CacheSettings(maximumSize, expireAfterAccess);
    }

    /**
     * Time after which a stream nobody read or wrote leaves the cache.
     */
    public CacheSettings withExpireAfterAccess(Duration expireAfterAccess) {
        return new CacheSettings(maximumSize, expireAfterAccess);
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public Duration getExpireAfterAccess() {
        return expireAfterAccess;
    }

    @Override
    public String toString() {
        return "CacheSettings[maximumSize=" + maximumSize + ", expireAfterAccess=" + expireAfterAccess + "]";
    }
}
