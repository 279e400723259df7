/**
 * Sagas coordinating commands across aggregates, with compensation of completed steps on failure.
 *
 * <p>A saga is itself an event sourced aggregate. Its stream records which steps were started, completed, failed
 * and compensated, so that a saga interrupted by restart can be {@linkplain io.github.tributary.saga.SagaEngine#resume
 * resumed} from its last recorded phase. The state machine is enforced by command handlers of
 * {@link io.github.tributary.saga.SagaAggregate}, the {@link io.github.tributary.saga.SagaEngine} only drives it.</p>
 *
 * <p>Steps are executed in order of definition. A step may require verification, an externally observable condition
 * polled until a deadline. When a step fails, or its verification times out, the completed steps are compensated in
 * reverse order of completion. Compensation is best effort: failure of single compensation is recorded, and the sweep
 * continues with the preceding step. Saga with any unsuccessful compensation ends {@link io.github.tributary.saga.SagaPhase#FAILED}
 * and needs manual remediation.</p>
 */
@ImmutablesSupport
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

import io.github.tributary.immutables.ImmutablesSupport;
