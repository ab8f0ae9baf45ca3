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

import java.util.Objects;

/**
 * A receiver for human-readable progress messages emitted by the engine.
 *
 * <p>The engine never formats output for a particular presentation layer. Callers
 * (a command line shell, a GUI, an automation harness) implement this interface and
 * decide what to do with each message. Sinks may be invoked from dispatcher worker
 * threads, so implementations must be safe for concurrent use.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ProgressSink sink = new LoggerProgressSink()
 *     .andThen(msg -> statusLabel.setText(msg));
 * generator.generate(spec, sink);
 * }</pre>
 *
 * @see LoggerProgressSink
 * @see NoopProgressSink
 */
@FunctionalInterface
public interface ProgressSink {

    /**
     * Receives a single progress message.
     *
     * @param message the status text, never null
     */
    void progress(String message);

    /**
     * Returns a sink that forwards each message to this sink and then to {@code next}.
     *
     * @param next the sink to invoke after this one
     * @return the composed sink
     * @throws NullPointerException if next is null
     */
    default ProgressSink andThen(ProgressSink next) {
        Objects.requireNonNull(next, "next");
        return message -> {
            progress(message);
            next.progress(message);
        };
    }

    /**
     * Returns a sink which prefixes every message with {@code prefix: }.
     *
     * @param prefix the label to prepend, typically the component name
     * @return a prefixing view of this sink
     */
    default ProgressSink withPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return message -> progress(prefix + ": " + message);
    }

    /**
     * @return a sink that discards everything
     */
    static ProgressSink none() {
        return NoopProgressSink.INSTANCE;
    }
}
