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
 * Thrown when a distribution is declared with parameters that cannot describe a valid
 * distribution, for example {@code low > high}, a negative standard deviation, or a
 * missing required field.
 */
public class InvalidDistributionException extends RuntimeException {

    private final String parameterName;
    private final String reason;

    public InvalidDistributionException(String parameterName, String reason) {
        super(parameterName == null ? reason : "parameter '" + parameterName + "': " + reason);
        this.parameterName = parameterName;
        this.reason = reason;
    }

    /**
     * @param name the parameter the distribution was declared for
     * @return an equivalent exception naming the parameter
     */
    public InvalidDistributionException forParameter(String name) {
        InvalidDistributionException named = new InvalidDistributionException(name, reason);
        named.setStackTrace(getStackTrace());
        return named;
    }

    /// @return the problem without the parameter prefix
    public String getReason() {
        return reason;
    }

    /// @return the offending parameter, or null if the distribution was built outside a document
    public String getParameterName() {
        return parameterName;
    }
}
