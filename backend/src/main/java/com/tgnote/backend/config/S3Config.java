package com.tgnote.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * Process-wide S3 client and presigner, pointed at MinIO (or any S3 compatible endpoint).
 * Both are thread safe and shared by every request.
 */
@Slf4j
@Configuration
public class S3Config {

    private final URI endpoint;
    private final Region region;
    private final String accessKey;
    private final String secretKey;

    public S3Config(
            @Value("${application.config.storage.endpoint}") String endpoint,
            @Value("${application.config.storage.region:us-east-1}") String region,
            @Value("${application.config.storage.access-key:}") String accessKey,
            @Value("${application.config.storage.secret-key:}") String secretKey
    ) {
        this.endpoint = URI.create(endpoint);
        this.region = Region.of(region);
        this.accessKey = accessKey;
        this.secretKey = secretKey;
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        log.info("Object storage endpoint: {} (region {})", endpoint, region);
        return S3Client.builder()
                .endpointOverride(endpoint)
                .region(region)
                .credentialsProvider(credentials())
                .forcePathStyle(true)
                .build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        return S3Presigner.builder()
                .endpointOverride(endpoint)
                .region(region)
                .credentialsProvider(credentials())
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .build();
    }

    private AwsCredentialsProvider credentials() {
        if (StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey)) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.warn("No object storage access key configured, falling back to the default AWS credentials chain");
        return DefaultCredentialsProvider.create();
    }
}
