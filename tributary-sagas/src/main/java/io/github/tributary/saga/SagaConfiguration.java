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

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies of {@link SagaEngine}.
 */
public class SagaConfiguration {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final ScheduledExecutorService schedulerService;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration stepTimeout;

    /**
     * @param schedulerService thread pool verification polls are scheduled on
     */
    public SagaConfiguration(ScheduledExecutorService schedulerService) {
        this(schedulerService, Clock.systemUTC());
    }

    public SagaConfiguration(ScheduledExecutorService schedulerService, Clock clock) {
        this(schedulerService, clock, DEFAULT_POLL_INTERVAL, null);
    }

    private SagaConfiguration(ScheduledExecutorService schedulerService, Clock clock, Duration pollInterval,
            Duration stepTimeout) {
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval must be specified");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval);
        }
        if (stepTimeout != null && (stepTimeout.isNegative() || stepTimeout.isZero())) {
            throw new IllegalArgumentException("Step timeout must be positive, got " + stepTimeout);
        }
        this.stepTimeout = stepTimeout;
    }

    public SagaConfiguration withClock(Clock clock) {
        return new SagaConfiguration(schedulerService, clock, pollInterval, stepTimeout);
    }

    /**
     * Interval of polling verifications, that do not specify their own.
     */
    public SagaConfiguration withPollInterval(Duration pollInterval) {
        return new SagaConfiguration(schedulerService, clock, pollInterval, stepTimeout);
    }

    /**
     * Deadline of step executions and compensations, that do not specify their own. A step still running when it
     * passes fails with {@link SagaErrorCodes#STEP_TIMEOUT}.
     */
    public SagaConfiguration withStepTimeout(Duration stepTimeout) {
        return new SagaConfiguration(schedulerService, clock, pollInterval,
                Objects.requireNonNull(stepTimeout, "Step timeout must be specified"));
    }

    public ScheduledExecutorService getSchedulerService() {
        return schedulerService;
    }

    public Clock getClock() {
        return clock;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Optional<Duration> getStepTimeout() {
        return Optional.ofNullable(stepTimeout);
    }
}
