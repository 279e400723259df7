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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Response to a dispatched request. Only the dispatcher completes it, callers can just cancel.
 * <p>Cancelling a response, whose request is still queued, removes the request from its mailbox. Cancelling a
 * response during execution only records the request, that the execution observes via {@link CancellationSignal}.</p>
 */
final class FutureResponse<T> extends CompletableFuture<T> implements CancellationSignal {
    private enum Stage {
        QUEUED, EXECUTING
    }

    private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.QUEUED);
    private final AtomicBoolean cancellationRequested = new AtomicBoolean();
    private final Runnable dequeue;

    /**
     * @param dequeue removes the request from its mailbox
     */
    FutureResponse(Runnable dequeue) {
        this.dequeue = dequeue;
    }

    /**
     * Move from queued to executing. Fails when the response was cancelled meanwhile, or the request executes already.
     */
    boolean tryStart() {
        return stage.compareAndSet(Stage.QUEUED, Stage.EXECUTING);
    }

    /**
     * Return to queued stage after an attempt, so that the request can be attempted again.
     */
    void release() {
        stage.set(Stage.QUEUED);
    }

    void respond(T value) {
        super.complete(value);
    }

    void fail(Throwable t) {
        super.completeExceptionally(t);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (isDone()) {
            return false;
        }
        if (tryStart()) {
            // never to be started
            dequeue.run();
            return super.cancel(mayInterruptIfRunning);
        }
        cancellationRequested.set(true);
        return false;
    }

    @Override
    public boolean complete(T value) {
        throw readOnly();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw readOnly();
    }

    @Override
    public void obtrudeValue(T value) {
        throw readOnly();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw readOnly();
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("Response of dispatched request can only be cancelled");
    }
}
