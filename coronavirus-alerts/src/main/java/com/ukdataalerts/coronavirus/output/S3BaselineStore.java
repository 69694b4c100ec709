package com.ukdataalerts.coronavirus.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeps the baseline as a single JSON object in S3.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class S3BaselineStore implements BaselineStore {

    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final AlertsProperties properties;

    @Override
    public Optional<MetricDefinitions> readBaseline() {
        String bucket = properties.getBaseline().getS3().getBucket();
        String key = properties.getBaseline().getS3().getKey();
        log.info("Downloading metrics from s3://{}/{}", bucket, key);

        try {
            ResponseBytes<GetObjectResponse> object = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return Optional.of(objectMapper.readValue(object.asByteArray(), MetricDefinitions.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Error getting previous metrics from s3://{}/{}: {}", bucket, key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeBaseline(MetricDefinitions definitions) {
        String bucket = properties.getBaseline().getS3().getBucket();
        String key = properties.getBaseline().getS3().getKey();

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(definitions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise metric definitions", e);
        }

        log.info("Uploading {} metrics to s3://{}/{}", definitions.size(), bucket, key);
        s3Client.putObject(PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentType("application/json")
                        .build(),
                RequestBody.fromBytes(body));
    }
}
