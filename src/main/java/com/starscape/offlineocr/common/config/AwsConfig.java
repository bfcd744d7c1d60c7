package com.starscape.offlineocr.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

/**
 * AWS clients, only created when artifacts are served from an S3 bucket.
 */
@Configuration
@ConditionalOnProperty(name = "app.artifacts.source", havingValue = "s3")
public class AwsConfig {
    
    @Value("${aws.region}")
    private String region;
    
    @Value("${aws.profile:}")
    private String profile;
    
    @Value("${aws.s3.endpoint:}")
    private String endpoint;
    
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        // Use profile if specified, otherwise use default credentials chain
        if (profile != null && !profile.isBlank()) {
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }
    
    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider) {
        var builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider);
        // Custom endpoint for S3-compatible mirrors (MinIO, LocalStack)
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }
}
