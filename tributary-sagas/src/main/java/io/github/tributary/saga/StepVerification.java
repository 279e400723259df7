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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Condition, that confirms effect of a step, which cannot be confirmed by the step's command itself. The condition
 * is polled in given interval, or in {@linkplain SagaConfiguration#getPollInterval() configured one}, until it holds or
 * timeout elapses. Timeout fails the step.
 *
 * @param <D> type of saga data
 */
public final class StepVerification<D> {
    private final Check<D> check;
    private final Duration timeout;
    private final Duration interval;

    @FunctionalInterface
    public interface Check<D> {
        CompletionStage<Boolean> isSatisfied(SagaContext<D> context);
    }

    private StepVerification(Check<D> check, Duration timeout, Duration interval) {
        this.check = Objects.requireNonNull(check, "Check must be specified");
        this.timeout = Objects.requireNonNull(timeout, "Timeout must be specified");
        this.interval = interval;
        if (timeout.isNegative() || (interval != null && (interval.isNegative() || interval.isZero()))) {
            throw new IllegalArgumentException("Verification needs non-negative timeout and positive interval, got "
                    + timeout + " and " + interval);
        }
    }

    public static <D> StepVerification<D> of(Check<D> check, Duration timeout) {
        return new StepVerification<>(check, timeout, null);
    }

    public static <D> StepVerification<D> of(Check<D> check, Duration timeout, Duration interval) {
        return new StepVerification<>(check, timeout, Objects.requireNonNull(interval, "Interval must be specified"));
    }

    public Check<D> getCheck() {
        return check;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Optional<Duration> getInterval() {
        return Optional.ofNullable(interval);
    }
}
