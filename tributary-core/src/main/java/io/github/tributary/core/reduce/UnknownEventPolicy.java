package io.github.tributary.core.reduce;

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
 * What a {@link RootReducer} does with an event it has no reducer for.
 */
public enum UnknownEventPolicy {
    /**
     * Pass the state through unchanged.
     */
    IGNORE,
    /**
     * Throw {@link SchemaMismatchException}.
     */
    REJECT
}
