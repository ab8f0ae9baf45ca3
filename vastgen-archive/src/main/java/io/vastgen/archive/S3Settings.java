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


package io.vastgen.archive;

import java.util.Map;
import java.util.Objects;

/**
 * Object storage endpoint and credentials, read from the {@code S3_*} environment
 * variables. Unset variables fall back to a local MinIO default.
 */
public final class S3Settings {

    public static final String ENDPOINT = "S3_ENDPOINT";
    public static final String ACCESS_KEY = "S3_ACCESS_KEY";
    public static final String SECRET_KEY = "S3_SECRET_KEY";
    public static final String REGION = "S3_REGION";

    public static final String DEFAULT_ENDPOINT = "http://localhost:9000";
    public static final String DEFAULT_CREDENTIAL = "minioadmin";
    public static final String DEFAULT_REGION = "us-east-1";

    private final String endpoint;
    private final String accessKey;
    private final String secretKey;
    private final String region;

    public S3Settings(String endpoint, String accessKey, String secretKey, String region) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.accessKey = Objects.requireNonNull(accessKey, "accessKey");
        this.secretKey = Objects.requireNonNull(secretKey, "secretKey");
        this.region = Objects.requireNonNull(region, "region");
    }

    public static S3Settings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static S3Settings fromEnvironment(Map<String, String> env) {
        return new S3Settings(
            valueOr(env, ENDPOINT, DEFAULT_ENDPOINT),
            valueOr(env, ACCESS_KEY, DEFAULT_CREDENTIAL),
            valueOr(env, SECRET_KEY, DEFAULT_CREDENTIAL),
            valueOr(env, REGION, DEFAULT_REGION));
    }

    private static String valueOr(Map<String, String> env, String name, String fallback) {
        String value = env.get(name);
        return value == null || value.isBlank() ? fallback : value;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public String getRegion() {
        return region;
    }

    /// Credentials are left out.
    @Override
    public String toString() {
        return "S3Settings{" + endpoint + ", region=" + region + "}";
    }
}
