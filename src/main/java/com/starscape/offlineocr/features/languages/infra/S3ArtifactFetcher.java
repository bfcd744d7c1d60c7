package com.starscape.offlineocr.features.languages.infra;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.IOException;

/**
 * Fetches artifacts from an S3 bucket under the configured key prefix.
 */
@Component
@ConditionalOnProperty(name = "app.artifacts.source", havingValue = "s3")
public class S3ArtifactFetcher implements ArtifactFetcher {
    
    private static final Logger log = LoggerFactory.getLogger(S3ArtifactFetcher.class);
    
    private final S3Client s3Client;
    private final ArtifactProperties artifactProperties;
    private final String bucket;
    
    public S3ArtifactFetcher(
            S3Client s3Client,
            ArtifactProperties artifactProperties,
            @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.artifactProperties = artifactProperties;
        this.bucket = bucket;
    }
    
    @Override
    public byte[] fetch(String code) throws IOException {
        String key = artifactProperties.remoteKey(code);
        log.debug("Downloading artifact: s3://{}/{}", bucket, key);
        
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            return response.readAllBytes();
        } catch (SdkException e) {
            throw new IOException("s3://" + bucket + "/" + key + " could not be read: " + e.getMessage(), e);
        }
    }
}
