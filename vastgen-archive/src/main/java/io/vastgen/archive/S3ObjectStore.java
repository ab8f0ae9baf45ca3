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

import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An S3 bucket as an object store, through the AWS SDK. Path-style access is enabled so
 * the same client works against MinIO and other S3-compatible servers.
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger logger = LogManager.getLogger(S3ObjectStore.class);

    private final AmazonS3 s3;
    private final String bucket;

    public S3ObjectStore(AmazonS3 s3, String bucket) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    /**
     * @param settings endpoint and credentials
     * @param bucket the bucket holding run results
     * @return a store with its own S3 client
     */
    public static S3ObjectStore connect(S3Settings settings, String bucket) {
        BasicAWSCredentials credentials = new BasicAWSCredentials(settings.getAccessKey(), settings.getSecretKey());
        AmazonS3 client = AmazonS3ClientBuilder.standard()
            .withCredentials(new AWSStaticCredentialsProvider(credentials))
            .withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(settings.getEndpoint(), settings.getRegion()))
            .withPathStyleAccessEnabled(true)
            .build();
        logger.debug("Connected to {} bucket {}", settings.getEndpoint(), bucket);
        return new S3ObjectStore(client, bucket);
    }

    public String getBucket() {
        return bucket;
    }

    @Override
    public List<ObjectRef> list(String prefix) throws IOException {
        List<ObjectRef> refs = new ArrayList<>();
        ListObjectsV2Request request = new ListObjectsV2Request().withBucketName(bucket).withPrefix(prefix);
        try {
            ListObjectsV2Result page;
            do {
                page = s3.listObjectsV2(request);
                for (S3ObjectSummary summary : page.getObjectSummaries()) {
                    if (summary.getKey().endsWith("/")) {
                        continue;
                    }
                    Instant modified = summary.getLastModified() == null ? Instant.EPOCH : summary.getLastModified().toInstant();
                    refs.add(new ObjectRef(bucket, summary.getKey(), summary.getSize(), modified));
                }
                request.setContinuationToken(page.getNextContinuationToken());
            } while (page.isTruncated());
        } catch (SdkClientException e) {
            throw new IOException("could not list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }
        Collections.sort(refs);
        return refs;
    }

    @Override
    public InputStream open(ObjectRef ref) throws IOException {
        try {
            S3Object object = s3.getObject(ref.getBucket(), ref.getKey());
            return object.getObjectContent();
        } catch (SdkClientException e) {
            throw new IOException("could not read s3://" + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "S3ObjectStore{" + bucket + "}";
    }
}
