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


package io.vastgen.dispatch;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/// Derives scheduler-safe names from run and variant identifiers.
///
/// Job names follow DNS-1123 label rules: lower-case alphanumerics and `-`, starting and
/// ending with an alphanumeric, at most 63 characters. Names that would be longer keep a
/// readable head and end in an 8 character hash of the full name, so distinct inputs
/// stay distinct after truncation.
public final class JobNames {

    public static final int MAX_LENGTH = 63;
    private static final int HASH_LENGTH = 8;

    private static final Pattern NOT_DNS = Pattern.compile("[^a-z0-9-]+");
    private static final Pattern NOT_LABEL = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final Pattern DASHES = Pattern.compile("-{2,}");

    private JobNames() {
    }

    /**
     * @param runId the run identifier
     * @param variantId the variant identifier
     * @param attempt the 1-based attempt number
     * @return the cluster job name {@code <run>-<variant>-<attempt>}, sanitised
     */
    public static String forAttempt(String runId, String variantId, int attempt) {
        return dnsLabel(runId + "-" + variantId + "-" + attempt);
    }

    /// @return `raw` lower-cased and reduced to a valid DNS-1123 label
    public static String dnsLabel(String raw) {
        String name = NOT_DNS.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("-");
        name = trim(DASHES.matcher(name).replaceAll("-"), '-');
        if (name.isEmpty()) {
            name = "job";
        }
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        String head = trim(name.substring(0, MAX_LENGTH - HASH_LENGTH - 1), '-');
        return head + "-" + shortHash(raw);
    }

    /// @return `raw` reduced to a valid label value: case kept, `._-` allowed, alphanumeric at both ends
    public static String labelValue(String raw) {
        String value = NOT_LABEL.matcher(raw).replaceAll("-");
        value = trimNonAlphanumeric(value);
        if (value.length() > MAX_LENGTH) {
            value = trimNonAlphanumeric(value.substring(0, MAX_LENGTH - HASH_LENGTH - 1)) + "-" + shortHash(raw);
        }
        return value;
    }

    private static String shortHash(String raw) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, HASH_LENGTH / 2);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String trim(String s, char c) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == c) start++;
        while (end > start && s.charAt(end - 1) == c) end--;
        return s.substring(start, end);
    }

    private static String trimNonAlphanumeric(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && !Character.isLetterOrDigit(s.charAt(start))) start++;
        while (end > start && !Character.isLetterOrDigit(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }
}
