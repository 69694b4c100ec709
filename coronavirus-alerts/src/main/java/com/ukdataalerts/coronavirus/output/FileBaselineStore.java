package com.ukdataalerts.coronavirus.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Keeps the baseline as a JSON file on local disk, for running outside AWS.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FileBaselineStore implements BaselineStore {

    private final ObjectMapper objectMapper;
    private final AlertsProperties properties;

    @Override
    public Optional<MetricDefinitions> readBaseline() {
        Path path = path();
        if (!Files.exists(path)) {
            log.warn("No previous metrics at {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), MetricDefinitions.class));
        } catch (IOException e) {
            log.warn("Error reading previous metrics from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeBaseline(MetricDefinitions definitions) {
        Path path = path();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), definitions);
            log.info("Saved {} metrics to {}", definitions.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write metric baseline to " + path, e);
        }
    }

    private Path path() {
        return Paths.get(properties.getBaseline().getFile().getPath());
    }
}
