/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.vastgen.variation.distribution;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation used to mark a {@link DistributionFactory} implementation with the kind tag
 * it handles in variation documents.
 *
 * <p>This annotation is used by {@link DistributionRegistry} to discover factories by tag
 * via the ServiceLoader mechanism.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * @DistributionKind("uniform")
 * public class UniformDistributionFactory implements DistributionFactory {
 *     // ...
 * }
 * }</pre>
 *
 * @see DistributionFactory
 * @see DistributionRegistry
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DistributionKind {
    /**
     * The tag used as {@code type:} in a parameter declaration.
     *
     * @return the kind name
     */
    String value();
}
