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

import picocli.CommandLine;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/// Parses durations given as ISO-8601 (`PT10M`) or as whole seconds (`600`).
public class DurationConverter implements CommandLine.ITypeConverter<Duration> {

    @Override
    public Duration convert(String value) {
        String v = value.trim();
        if (v.matches("\\d+")) {
            return Duration.ofSeconds(Long.parseLong(v));
        }
        try {
            return Duration.parse(v.toUpperCase());
        } catch (DateTimeParseException e) {
            throw new CommandLine.TypeConversionException("Invalid duration '" + value + "': use ISO-8601 like PT10M, or seconds");
        }
    }
}
