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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes requests one at a time per stream.
 *
 * <p>Every stream has its own mailbox, a queue of pending invocations. Adding to an idle mailbox submits it to the
 * executor, and the mailbox then drains itself one invocation after another, until it finds itself empty. An empty
 * mailbox retires and leaves the dispatcher, next request for the stream opens a new one. Streams do not share any
 * lock, so requests for different streams execute in parallel.</p>
 *
 * <p>Returned futures are {@linkplain FutureResponse read only}. Cancelling one before its request started removes
 * it from the mailbox, cancelling it later is observable by the execution through {@link CancellationSignal}.</p>
 */
public class Dispatcher {

    private static final int RETIRED = -1;

    private final DispatcherConfiguration configuration;
    private final ConcurrentMap<StreamKey, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration configuration) {
        this.configuration = configuration;
        this.logger = LoggerFactory.getLogger(Dispatcher.class.getName() + "." + configuration.dispatcherName());
    }

    /**
     * Queue request for execution.
     * @param key stream the request is serialized by
     * @param request request to execute
     * @param <R> type of request
     * @param <RS> type of response
     * @return future response
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> execute(StreamKey key, R request) {
        return enqueue(new Invocation<>(key, request));
    }

    /**
     * Queue request, that must complete within timeout. A request still queued when the timeout elapses is cancelled,
     * an executing one is {@linkplain CancellationSignal asked} to abandon.
     * @see CancellationSignal
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeWithTimeout(StreamKey key, R request, long timeout,
            TimeUnit unit) {
        Invocation<R, RS> invocation = new Invocation<>(key, request);
        invocation.expireAfter(timeout, unit);
        return enqueue(invocation);
    }

    /**
     * Queue request after a delay.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLater(StreamKey key, R request, long delay,
            TimeUnit unit) {
        Invocation<R, RS> invocation = new Invocation<>(key, request);
        return enqueueLater(invocation, delay, unit);
    }

    /**
     * Queue request after a delay. The timeout counts from now, not from end of the delay.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLaterWithTimeout(StreamKey key, R request,
            long delay, long timeout, TimeUnit unit) {
        Invocation<R, RS> invocation = new Invocation<>(key, request);
        invocation.expireAfter(timeout, unit);
        return enqueueLater(invocation, delay, unit);
    }

    /**
     * Number of invocations waiting for a stream, not counting an executing one nor delayed ones.
     */
    public int getPendingCount(StreamKey key) {
        Mailbox mailbox = mailboxes.get(key);
        return mailbox == null ? 0 : mailbox.queue.size();
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex instanceof CompletionException && ex.getCause() != null) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Number of streams that have pending or executing invocations.
     */
    public int getActiveStreamCount() {
        return mailboxes.size();
    }

    private <R extends Request<RS>, RS> CompletableFuture<RS> enqueue(Invocation<R, RS> invocation) {
        while (true) {
            Mailbox mailbox = mailboxes.computeIfAbsent(invocation.key, Mailbox::new);
            if (mailbox.offer(invocation)) {
                return invocation.response;
            }
            // retired between lookup and offer
            mailboxes.remove(invocation.key, mailbox);
        }
    }

    private <R extends Request<RS>, RS> CompletableFuture<RS> enqueueLater(Invocation<R, RS> invocation, long delay,
            TimeUnit unit) {
        configuration.schedulerService().schedule(() -> enqueue(invocation), delay, unit);
        return invocation.response;
    }

    /**
     * Invocations of single stream. Resolves concurrency between adding invocations and draining them.
     */
    class Mailbox implements Runnable {
        private final StreamKey key;
        private final Deque<Invocation<?, ?>> queue = new ConcurrentLinkedDeque<>();
        // number of offers since the mailbox was last idle, RETIRED once drained
        private final AtomicInteger pendingSignals = new AtomicInteger();
        private final AtomicReference<Invocation<?, ?>> executing = new AtomicReference<>();

        Mailbox(StreamKey key) {
            this.key = key;
        }

        /**
         * Add invocation, unless the mailbox is retired.
         * @return false when the mailbox no longer accepts invocations
         */
        boolean offer(Invocation<?, ?> invocation) {
            int before;
            do {
                before = pendingSignals.get();
                if (before == RETIRED) {
                    return false;
                }
            } while (!pendingSignals.compareAndSet(before, before + 1));
            invocation.mailbox = this;
            queue.add(invocation);
            if (before == 0) {
                logger.debug("Mailbox of {} starts draining", key);
                configuration.executorService().submit(this);
            } else {
                logger.debug("Mailbox of {} is busy, {} invocations arrived meanwhile", key, before);
            }
            return true;
        }

        /**
         * Execute next invocation. Runs when an idle mailbox receives an invocation, and after every finished
         * invocation.
         */
        @Override
        public void run() {
            Invocation<?, ?> next = poll();
            if (next == null) {
                return;
            }
            if (executing.compareAndSet(null, next)) {
                next.run();
            } else {
                logger.error("Mailbox of {} was drained while {} executes. Putting back {}", key, executing.get(),
                        next);
                queue.addFirst(next);
            }
        }

        private Invocation<?, ?> poll() {
            while (true) {
                int signals = pendingSignals.get();
                Invocation<?, ?> next = queue.poll();
                if (next != null) {
                    return next;
                }
                // retiring only succeeds when nothing was offered since the signals were read. Otherwise poll
                // again, the offering thread did not submit the mailbox
                if (pendingSignals.compareAndSet(signals, RETIRED)) {
                    mailboxes.remove(key, this);
                    logger.debug("Mailbox of {} is drained", key);
                    return null;
                }
            }
        }

        void finished(Invocation<?, ?> invocation) {
            if (executing.compareAndSet(invocation, null)) {
                configuration.executorService().submit(this);
            } else {
                logger.error("{} finished in mailbox of {}, but {} was executing", invocation, key, executing.get());
            }
        }
    }

    /**
     * Single request with its response. Resolves concurrency between execution and cancellation, and retries failed
     * executions.
     */
    class Invocation<R extends Request<RS>, RS> implements Runnable {
        private final StreamKey key;
        private final R request;
        private final FutureResponse<RS> response = new FutureResponse<>(this::dequeue);
        private final Instant submitted = Instant.now();
        private volatile Mailbox mailbox;
        private ScheduledFuture<?> expiry;
        private int attempts;
        private Instant started;

        Invocation(StreamKey key, R request) {
            this.key = key;
            this.request = request;
        }

        void expireAfter(long timeout, TimeUnit unit) {
            this.expiry = configuration.schedulerService().schedule(this::expire, timeout, unit);
        }

        @Override
        public void run() {
            if (!response.tryStart()) {
                logger.info("Skipping cancelled {}", this);
                mailbox.finished(this);
                return;
            }
            attempts++;
            started = Instant.now();
            try {
                configuration.execute(key, request, response, this::completed);
            } catch (RuntimeException e) {
                logger.error("{} threw instead of calling back", this, e);
                completed(null, e);
            }
        }

        private void dequeue() {
            Mailbox current = mailbox;
            if (current != null) {
                current.queue.remove(this);
            }
        }

        private void expire() {
            if (response.cancel(true)) {
                logger.info("{} timed out before it started", this);
            } else if (!response.isDone()) {
                logger.warn("ACTIVE {} timed out, cancellation requested", this);
            }
        }

        private void completed(RS value, Throwable throwable) {
            // a delayed retry may reach another mailbox before this one is released
            Mailbox current = mailbox;
            if (throwable == null) {
                stopExpiry();
                response.respond(value);
            } else {
                Throwable cause = unwrapCompletionException(throwable);
                boolean cancelled = response.isCancellationRequested() || cause instanceof CancellationException;
                long delay = cancelled ? -1 : configuration.retryDelay(key, request, cause, attempts);
                if (delay >= 0) {
                    response.release();
                }
                if (delay == 0) {
                    current.queue.add(this);
                } else if (delay > 0) {
                    configuration.schedulerService().schedule(() -> enqueue(this), delay, TimeUnit.MILLISECONDS);
                } else {
                    stopExpiry();
                    response.fail(cause);
                }
            }
            started = null;
            current.finished(this);
        }

        private void stopExpiry() {
            if (expiry != null && !expiry.isDone()) {
                expiry.cancel(false);
            }
        }

        @Override
        public String toString() {
            return "Invocation[" + key + ", " + request + ", submitted=" + submitted + ", attempts=" + attempts
                    + (started == null ? "" : ", started=" + started) + "]";
        }
    }
}
