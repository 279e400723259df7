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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;

/**
 * What a {@link Dispatcher} runs on, how it executes requests, and when it retries them.
 */
public interface DispatcherConfiguration {
    /**
     * Name of the dispatcher. Its logger is named {@code Dispatcher.<name>}.
     */
    String dispatcherName();

    ExecutorService executorService();

    /**
     * Pool for delayed requests and timeouts. <strong>Must be different from {@link #executorService()}</strong>,
     * otherwise a blocked execution could prevent its own timeout from firing.
     */
    ScheduledExecutorService schedulerService();

    /**
     * Execute request on executor thread and report outcome to the callback. No other request for the same stream
     * starts until the callback is called.
     * @param key stream the request is serialized by
     * @param request request to execute
     * @param signal cancellation requested by the caller during execution
     * @param callback receiver of the response or failure
     * @param <R> type of request
     * @param <RS> type of response
     */
    <R extends Request<RS>, RS> void execute(StreamKey key, R request, CancellationSignal signal,
            BiConsumer<RS, Throwable> callback);

    /**
     * Delay of next attempt of failed request.
     * @param key stream of the request
     * @param request the failed request
     * @param t the failure
     * @param completedAttempts attempts made so far, at least {@code 1}
     * @return negative to fail the request, zero to retry immediately, or milliseconds until next attempt. Other
     *     requests for the stream may execute during the delay
     */
    long retryDelay(StreamKey key, Request<?> request, Throwable t, int completedAttempts);
}
