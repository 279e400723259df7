/**
 * Event sourced aggregates with optimistic concurrency.
 *
 * <h2>What is an aggregate?</h2>
 * <p>An aggregate is a consistency boundary identified by a {@link io.github.tributary.core.StreamKey}. Its state is
 * never stored directly, it is derived by folding the events of its stream with a
 * {@linkplain io.github.tributary.core.reduce.RootReducer reducer}. Changes are requested by
 * {@linkplain io.github.tributary.core.Command commands}, that a
 * {@linkplain io.github.tributary.core.command.RootCommandHandler command handler} either accepts by producing
 * events, or rejects with a machine readable code. Handlers do not change state and do not perform side effects.
 *
 * <h2>Execution</h2>
 * <p>{@link io.github.tributary.core.engine.AggregateEngine} executes commands. Commands addressed to single stream
 * are executed one at a time by the {@linkplain io.github.tributary.core.dispatch dispatcher}, commands for different
 * streams run concurrently. Events are appended with expected version of the stream, and when another writer
 * appended in the meantime, the command is handled again against fresh state. The caller always receives a
 * CompletableFuture of {@link io.github.tributary.core.engine.CommandResult}, that is either accepted, rejected or
 * conflicting.
 *
 * <h2>Reading</h2>
 * <p>{@link io.github.tributary.core.projection.QueryProjection} caches latest known state of streams and serves
 * reads without blocking writers. Snapshots kept by a {@link io.github.tributary.core.store.SnapshotStore} shorten
 * the replay of long streams, and are ignored when the reducer that created them changed.
 *
 * @see io.github.tributary.core.engine.AggregateEngine
 * @see io.github.tributary.core.store.EventStore
 * @see io.github.tributary.core.Event
 */
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
