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


package io.vastgen.variation.spec;

/// Thrown when the same parameter name is declared more than once.
public class DuplicateParameterNameException extends SpecParseException {

    private final String parameterName;

    public DuplicateParameterNameException(String parameterName) {
        super("parameter '" + parameterName + "' is declared more than once");
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
