package com.ukdataalerts.coronavirus.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.ses.SesClient;

import java.time.Duration;

/**
 * Transport clients handed to the fetch, store and dispatch collaborators.
 * Nothing else in the application touches them.
 */
@Configuration
@Slf4j
public class ClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AlertsProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(properties.getApi().getReadTimeoutSeconds()))
                .build();
    }

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(AlertsProperties properties) {
        String profile = properties.getAws().getProfile();
        if (profile == null || profile.isBlank()) {
            log.info("Connecting to AWS with the default credentials chain");
            return DefaultCredentialsProvider.create();
        }
        log.info("Connecting to AWS with locally specified profile: {}", profile);
        return ProfileCredentialsProvider.create(profile);
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client(AlertsProperties properties, AwsCredentialsProvider credentials) {
        return S3Client.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(credentials)
                .build();
    }

    @Bean(destroyMethod = "close")
    public SesClient sesClient(AlertsProperties properties, AwsCredentialsProvider credentials) {
        return SesClient.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(credentials)
                .build();
    }
}
