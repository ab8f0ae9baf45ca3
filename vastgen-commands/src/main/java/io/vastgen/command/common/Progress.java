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


package io.vastgen.command.common;

import io.vastgen.status.LoggerProgressSink;
import io.vastgen.status.ProgressSink;
import org.apache.logging.log4j.Level;

/// Where commands send engine progress.
public final class Progress {

    public static final String LOGGER_NAME = "vastgen.progress";

    private Progress() {
    }

    public static ProgressSink toLog() {
        return new LoggerProgressSink(LOGGER_NAME, Level.INFO);
    }
}
