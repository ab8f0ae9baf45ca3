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

package io.vastgen.status;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A progress sink that writes each message to a Log4j 2 logger.
 *
 * <p>This is the sink used when the engine runs without an interactive front end:
 * progress ends up in the same log stream as the rest of the engine's diagnostics.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // log at DEBUG under a custom category
 * ProgressSink sink = new LoggerProgressSink("vastgen.progress", Level.DEBUG);
 * }</pre>
 */
public class LoggerProgressSink implements ProgressSink {

    private final Logger logger;
    private final Level level;

    /**
     * Creates a sink that logs at INFO to this class's logger.
     */
    public LoggerProgressSink() {
        this(LogManager.getLogger(LoggerProgressSink.class));
    }

    /**
     * Creates a sink that logs at INFO to the given logger.
     *
     * @param logger the target logger
     */
    public LoggerProgressSink(Logger logger) {
        this(logger, Level.INFO);
    }

    /**
     * Creates a sink with a custom logger and level.
     *
     * @param logger the target logger
     * @param level the level for progress messages; INFO when null
     */
    public LoggerProgressSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    /**
     * Creates a sink that logs to the named logger.
     *
     * @param loggerName the logger name
     * @param level the level for progress messages; INFO when null
     */
    public LoggerProgressSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void progress(String message) {
        if (logger.isEnabled(level)) {
            logger.log(level, message);
        }
    }

    /**
     * @return the level this sink logs at
     */
    public Level getLevel() {
        return level;
    }
}
