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


package io.vastgen.command;

/// Process exit codes shared by all commands.
public final class ExitCodes {
    /// every variant succeeded, or the command had no variants to run
    public static final int SUCCESS = 0;
    /// the run finished but some variants failed or were cancelled
    public static final int VARIANTS_FAILED = 1;
    /// the specification, generation or archive step failed; also picocli's usage error code
    public static final int ERROR = 2;

    private ExitCodes() {
    }
}
