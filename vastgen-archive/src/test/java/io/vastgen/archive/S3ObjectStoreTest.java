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

import com.amazonaws.services.s3.AbstractAmazonS3;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class S3ObjectStoreTest {

    /// Serves a fixed bucket, two keys per listing page.
    private static final class FakeS3 extends AbstractAmazonS3 {
        private final TreeMap<String, String> objects = new TreeMap<>();
        private int listCalls;

        FakeS3 put(String key, String content) {
            objects.put(key, content);
            return this;
        }

        @Override
        public ListObjectsV2Result listObjectsV2(ListObjectsV2Request request) {
            listCalls++;
            List<String> keys = new ArrayList<>();
            for (String key : objects.keySet()) {
                boolean afterToken = request.getContinuationToken() == null || key.compareTo(request.getContinuationToken()) > 0;
                if (key.startsWith(request.getPrefix()) && afterToken) {
                    keys.add(key);
                }
            }
            ListObjectsV2Result result = new ListObjectsV2Result();
            result.setBucketName(request.getBucketName());
            List<String> page = keys.subList(0, Math.min(2, keys.size()));
            for (String key : page) {
                S3ObjectSummary summary = new S3ObjectSummary();
                summary.setBucketName(request.getBucketName());
                summary.setKey(key);
                summary.setSize(objects.get(key).length());
                summary.setLastModified(new Date(1000L));
                result.getObjectSummaries().add(summary);
            }
            boolean truncated = keys.size() > 2;
            result.setTruncated(truncated);
            result.setNextContinuationToken(truncated ? page.get(page.size() - 1) : null);
            return result;
        }

        @Override
        public S3Object getObject(String bucketName, String key) {
            String content = objects.get(key);
            if (content == null) {
                AmazonS3Exception e = new AmazonS3Exception("The specified key does not exist.");
                e.setStatusCode(404);
                throw e;
            }
            S3Object object = new S3Object();
            object.setBucketName(bucketName);
            object.setKey(key);
            object.setObjectContent(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
            return object;
        }
    }

    @Test
    void listingFollowsContinuationTokens() throws IOException {
        FakeS3 s3 = new FakeS3()
            .put("run-1/v0/a", "1")
            .put("run-1/v0/b", "22")
            .put("run-1/v0/c", "333")
            .put("run-1/v1/a", "4")
            .put("run-1/v0/dir/", "");
        S3ObjectStore store = new S3ObjectStore(s3, "results");

        List<ObjectRef> refs = store.list("run-1/v0/");

        assertThat(refs).extracting(ObjectRef::getKey).containsExactly("run-1/v0/a", "run-1/v0/b", "run-1/v0/c");
        assertThat(refs).extracting(ObjectRef::getSize).containsExactly(1L, 2L, 3L);
        assertThat(refs.get(0).getLastModified().toEpochMilli()).isEqualTo(1000L);
        assertThat(s3.listCalls).isEqualTo(2);
    }

    @Test
    void openStreamsTheObject() throws IOException {
        S3ObjectStore store = new S3ObjectStore(new FakeS3().put("run-1/v0/a", "hello"), "results");
        ObjectRef ref = store.list("run-1/").get(0);

        try (InputStream in = store.open(ref)) {
            assertThat(IOUtils.toString(in, StandardCharsets.UTF_8)).isEqualTo("hello");
        }
    }

    @Test
    void missingObjectIsAnIOException() {
        S3ObjectStore store = new S3ObjectStore(new FakeS3(), "results");
        ObjectRef ref = new ObjectRef("results", "run-1/v0/gone", 1, Instant.EPOCH);

        assertThatThrownBy(() -> store.open(ref))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("run-1/v0/gone");
    }

    @Test
    void settingsFallBackToLocalDefaults() {
        S3Settings defaults = S3Settings.fromEnvironment(Map.of());
        assertThat(defaults.getEndpoint()).isEqualTo("http://localhost:9000");
        assertThat(defaults.getAccessKey()).isEqualTo("minioadmin");

        S3Settings custom = S3Settings.fromEnvironment(Map.of(S3Settings.ENDPOINT, "http://minio:9000", S3Settings.REGION, "eu-west-1"));
        assertThat(custom.getEndpoint()).isEqualTo("http://minio:9000");
        assertThat(custom.getRegion()).isEqualTo("eu-west-1");
        assertThat(custom.toString()).doesNotContain("minioadmin");
    }
}
