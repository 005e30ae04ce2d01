/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package org.gemini.recordstore.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.net.URI;
import java.net.URL;
import java.time.Duration;

/**
 * S3-compatible object storage (AWS S3 or MinIO). Presigning is computed locally from the credentials; no request is
 * sent to the endpoint.
 */
public class S3ObjectStorage implements ObjectStorage {
    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorage.class);

    private final S3Presigner presigner;
    private final String defaultBucket;

    /**
     * @param endpoint  e.g. "http://minio:9000"; null for AWS S3. A custom endpoint implies path-style URLs.
     */
    public S3ObjectStorage(String endpoint, String region, String defaultBucket, String accessKey, String secretKey) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey)));
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }
        this.presigner = builder.build();
        this.defaultBucket = defaultBucket;
        logger.info("object storage at {} (region {}, default bucket {})",
                endpoint != null ? endpoint : "AWS S3", region, defaultBucket);
    }

    @Override
    public String getDefaultBucket() {
        return defaultBucket;
    }

    @Override
    public URL presignedDownloadUrl(RecordFile file, Duration expiry, String contentType) {
        GetObjectRequest.Builder get = GetObjectRequest.builder()
                .bucket(file.getBucket())
                .key(file.getKey());
        if (contentType != null) {
            get.responseContentType(contentType);
        }
        PresignedGetObjectRequest presigned = presigner.presignGetObject(GetObjectPresignRequest.builder()
                .signatureDuration(expiry)
                .getObjectRequest(get.build())
                .build());
        logger.debug("presigned {} for {}", file, expiry);
        return presigned.url();
    }

    @Override
    public void close() {
        presigner.close();
    }
}
