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

/**
 * Immutable request expressing intent to change state of an aggregate.
 *
 * <p>Command carries no expectation about stream position. It is validated against whatever the current state is,
 * and concurrency is resolved when resulting events are appended.</p>
 */
public interface Command {
}
