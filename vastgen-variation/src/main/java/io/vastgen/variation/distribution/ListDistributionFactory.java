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

import com.google.auto.service.AutoService;

/// Factory for the `list` kind: `values` (required, non-empty) and `mode`.
@AutoService(DistributionFactory.class)
@DistributionKind(ListDistribution.KIND)
public class ListDistributionFactory implements DistributionFactory {

    @Override
    public Distribution create(DistributionFields fields) {
        fields.checkOnly("values", "mode");
        ListDistribution.Mode mode;
        try {
            mode = ListDistribution.Mode.parse(fields.optionalString("mode"));
        } catch (IllegalArgumentException e) {
            throw fields.invalid(e.getMessage());
        }
        try {
            return new ListDistribution(fields.requireList("values"), mode);
        } catch (InvalidDistributionException e) {
            throw e.forParameter(fields.getParameterName());
        }
    }
}
