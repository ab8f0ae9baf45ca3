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

/// A progress sink that silently discards all messages.
///
/// Used as the default when a caller does not care about progress, so engine code
/// never has to null-check its sink.
public final class NoopProgressSink implements ProgressSink {

    /// Shared instance; the sink holds no state.
    public static final NoopProgressSink INSTANCE = new NoopProgressSink();

    private NoopProgressSink() {
    }

    @Override
    public void progress(String message) {
    }

    @Override
    public String toString() {
        return "NoopProgressSink";
    }
}
