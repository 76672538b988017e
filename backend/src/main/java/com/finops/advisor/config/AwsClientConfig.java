package com.finops.advisor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.support.SupportClient;

/**
 * AWS SDK clients, enabled with app.env=aws.
 *
 * Credentials come from the default provider chain. Trusted Advisor is only
 * served from us-east-1, whatever the workload region.
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@Slf4j
public class AwsClientConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    private DefaultCredentialsProvider credentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public Ec2Client ec2Client() {
        log.info("AWS MODE: EC2 client for region {}", region);
        return Ec2Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider())
                .build();
    }

    @Bean
    public S3Client s3Client() {
        return S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider())
                .build();
    }

    @Bean
    public SupportClient supportClient() {
        return SupportClient.builder()
                .region(Region.US_EAST_1)
                .credentialsProvider(credentialsProvider())
                .build();
    }
}
