package io.github.tributary.immutables;

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

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * Style of value types generated by Immutables: saga events and saga state. Put it on {@code package-info.java} of
 * the package holding the abstract value types.
 *
 * <p>Generated implementations are package private and hidden behind the abstract type. Values offer no
 * {@code with*} copy methods, changed values are built by {@code builder().from(value)}.</p>
 */
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Value.Style(overshadowImplementation = true,
        visibility = Value.Style.ImplementationVisibility.PACKAGE,
        get = {"get*", "is*"},
        defaults = @Value.Immutable(copy = false),
        optionalAcceptNullable = true,
        depluralize = true,
        jdkOnly = true)
@JsonSerialize
public @interface ImmutablesSupport {
}
