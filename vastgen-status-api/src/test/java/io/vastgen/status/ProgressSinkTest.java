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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressSinkTest {

    @Test
    void andThenForwardsToBothSinksInOrder() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        ProgressSink first = m -> seen.add("first " + m);
        ProgressSink composed = first.andThen(m -> seen.add("second " + m));

        composed.progress("a");
        composed.progress("b");

        assertThat(seen).containsExactly("first a", "second a", "first b", "second b");
    }

    @Test
    void prefixesAreNested() {
        List<String> seen = new ArrayList<>();
        ProgressSink sink = ((ProgressSink) seen::add).withPrefix("dispatch").withPrefix("run-1");

        sink.progress("submitted");

        assertThat(seen).containsExactly("dispatch: run-1: submitted");
    }

    @Test
    void noneIsTheSharedNoopInstance() {
        assertThat(ProgressSink.none()).isSameAs(NoopProgressSink.INSTANCE);
        ProgressSink.none().progress("ignored");
    }

    @Test
    void nullArgumentsAreRejected() {
        ProgressSink sink = ProgressSink.none();
        assertThatThrownBy(() -> sink.andThen(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> sink.withPrefix(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void loggerSinkDefaultsToInfo() {
        assertThat(new LoggerProgressSink().getLevel()).isEqualTo(Level.INFO);
        assertThat(new LoggerProgressSink("vastgen.test", null).getLevel()).isEqualTo(Level.INFO);
        LoggerProgressSink debug = new LoggerProgressSink("vastgen.test", Level.DEBUG);
        assertThat(debug.getLevel()).isEqualTo(Level.DEBUG);
        debug.progress("below threshold");
    }
}
