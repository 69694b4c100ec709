package com.ukdataalerts.coronavirus.output;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes baseline reads and writes to S3 or the local file, based on configuration.
 */
@Component
@Primary
@RequiredArgsConstructor
public class BaselineStoreRouter implements BaselineStore {

    private final S3BaselineStore s3BaselineStore;
    private final FileBaselineStore fileBaselineStore;
    private final AlertsProperties properties;

    @Override
    public Optional<MetricDefinitions> readBaseline() {
        return target().readBaseline();
    }

    @Override
    public void writeBaseline(MetricDefinitions definitions) {
        target().writeBaseline(definitions);
    }

    private BaselineStore target() {
        return switch (properties.getBaseline().getStorage()) {
            case S3 -> s3BaselineStore;
            case FILE -> fileBaselineStore;
        };
    }
}
