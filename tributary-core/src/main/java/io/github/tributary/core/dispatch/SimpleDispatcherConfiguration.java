package io.github.tributary.core.dispatch;

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

import io.github.tributary.core.Request;
import io.github.tributary.core.StreamKey;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Dispatcher configuration assembled from its pools and two strategies, one executing the requests and one deciding
 * on retries. Instances are immutable, {@link #withRetryStrategy(RetryStrategy)} returns a copy.
 *
 * <p>{@link io.github.tributary.core.engine.AggregateEngine} configures its dispatcher with {@link #noRetries()}.
 * A command is only ever repeated after version conflict, and that repetition happens inside the engine against
 * fresh state. Retry strategies serve dispatchers of idempotent requests.</p>
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final RequestExecutor requestExecutor;
    private final RetryStrategy retryStrategy;

    /**
     * Configuration that fails requests on first failure.
     * @param name name of the dispatcher, usually the aggregate it serves
     * @param executorService pool requests execute on
     * @param schedulerService pool for delays and timeouts
     * @param requestExecutor strategy executing the requests
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
            ScheduledExecutorService schedulerService, RequestExecutor requestExecutor) {
        this(name, executorService, schedulerService, requestExecutor, noRetries());
    }

    private SimpleDispatcherConfiguration(String name, ExecutorService executorService,
            ScheduledExecutorService schedulerService, RequestExecutor requestExecutor, RetryStrategy retryStrategy) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduler service must be specified");
        this.requestExecutor = Objects.requireNonNull(requestExecutor, "Request executor must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    public SimpleDispatcherConfiguration withRetryStrategy(RetryStrategy retryStrategy) {
        return new SimpleDispatcherConfiguration(name, executorService, schedulerService, requestExecutor,
                retryStrategy);
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public <R extends Request<RS>, RS> void execute(StreamKey key, R request, CancellationSignal signal,
            BiConsumer<RS, Throwable> callback) {
        requestExecutor.execute(key, request, signal, callback);
    }

    @Override
    public long retryDelay(StreamKey key, Request<?> request, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(key, request, t, completedAttempts);
    }

    /**
     * @see DispatcherConfiguration#execute(StreamKey, Request, CancellationSignal, BiConsumer)
     */
    @FunctionalInterface
    public interface RequestExecutor {
        <R extends Request<RS>, RS> void execute(StreamKey key, R request, CancellationSignal signal,
                BiConsumer<RS, Throwable> callback);
    }

    /**
     * @see DispatcherConfiguration#retryDelay(StreamKey, Request, Throwable, int)
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;

        long retryDelay(StreamKey key, Request<?> request, Throwable t, int completedAttempts);
    }

    public static RetryStrategy noRetries() {
        return (key, request, t, completedAttempts) -> RetryStrategy.DO_NOT_RETRY;
    }

    /**
     * Attempt a failed request up to {@code attempts} times in total, pausing between attempts.
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        if (attempts < 1) {
            throw new IllegalArgumentException("At least one attempt is needed, got " + attempts);
        }
        long delayMillis = unit.toMillis(delay);
        return (key, request, t, completedAttempts) -> completedAttempts < attempts
                ? delayMillis
                : RetryStrategy.DO_NOT_RETRY;
    }
}
