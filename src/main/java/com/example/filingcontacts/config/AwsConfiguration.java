package com.example.filingcontacts.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

import jakarta.annotation.PostConstruct;

/**
 * AWS clients for the filing store and cloud OCR. Credentials come from the
 * default provider chain (environment, profile, instance role).
 */
@Configuration
public class AwsConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AwsConfiguration.class);

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${storage.s3.bucket:}")
    private String bucket;

    @PostConstruct
    public void initialize() {
        if (bucket == null || bucket.isEmpty()) {
            logger.warn("⚠️ No S3 bucket configured (storage.s3.bucket); ingestion and cloud OCR will fail");
        } else {
            logger.info("✅ AWS configured: region={}, bucket={}", region, bucket);
        }
    }

    @Bean
    @Lazy
    public S3Client s3Client() {
        return S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    @Lazy
    public TextractClient textractClient() {
        return TextractClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }
}
