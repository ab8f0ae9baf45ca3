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

/**
 * Builds a {@link Distribution} from the fields of one parameter declaration.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/io.vastgen.variation.distribution.DistributionFactory}, carry a
 * {@link DistributionKind} annotation and need a public no-arg constructor. New kinds can
 * be added by putting such a factory on the class path; nothing else changes.
 */
public interface DistributionFactory {

    /**
     * @param fields the declaration, including its {@code type} field
     * @return the distribution
     * @throws InvalidDistributionException if the fields do not describe a valid distribution
     */
    Distribution create(DistributionFields fields);
}
