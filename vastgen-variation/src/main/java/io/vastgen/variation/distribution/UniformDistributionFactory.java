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

/// Factory for the `uniform` kind: `low`, `high` and an optional `value_type`.
@AutoService(DistributionFactory.class)
@DistributionKind(UniformDistribution.KIND)
public class UniformDistributionFactory implements DistributionFactory {

    @Override
    public Distribution create(DistributionFields fields) {
        fields.checkOnly("low", "high", "value_type");
        ValueType valueType = fields.valueType("value_type");
        // bool draws use only the probability in high
        double low = valueType == ValueType.BOOL ? 0.0 : fields.requireDouble("low");
        double high = fields.requireDouble("high");
        try {
            return new UniformDistribution(low, high, valueType);
        } catch (InvalidDistributionException e) {
            throw e.forParameter(fields.getParameterName());
        }
    }
}
