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

import java.util.Objects;

/**
 * Where a job writes its results: a bucket and the key prefix
 * {@code <run id>/<variant id>/}.
 */
public final class ResultLocation {

    private final String bucket;
    private final String prefix;

    private ResultLocation(String bucket, String prefix) {
        this.bucket = bucket;
        this.prefix = prefix;
    }

    public static ResultLocation of(String bucket, String runId, String variantId) {
        Objects.requireNonNull(bucket, "bucket");
        return new ResultLocation(bucket, prefix(runId, variantId));
    }

    /// @return the key prefix all of one variant's result objects share, ending in `/`
    public static String prefix(String runId, String variantId) {
        return Objects.requireNonNull(runId, "runId") + "/" + Objects.requireNonNull(variantId, "variantId") + "/";
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }

    /// @return `s3://bucket/run/variant/`
    public String toUri() {
        return "s3://" + bucket + "/" + prefix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultLocation)) return false;
        ResultLocation that = (ResultLocation) o;
        return bucket.equals(that.bucket) && prefix.equals(that.prefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, prefix);
    }

    @Override
    public String toString() {
        return toUri();
    }
}
