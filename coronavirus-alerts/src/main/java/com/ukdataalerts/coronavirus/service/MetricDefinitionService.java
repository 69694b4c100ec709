package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.engine.DefinitionDiffDetector;
import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import com.ukdataalerts.coronavirus.output.BaselineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Detects metrics newly published on the dashboard since the last run, then
 * replaces the stored baseline with the current manifest.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricDefinitionService {

    private final MetricDefinitionSource definitionSource;
    private final BaselineStore baselineStore;
    private final DefinitionDiffDetector diffDetector;

    /**
     * The baseline is overwritten whether or not anything new was found.
     *
     * @return identifiers added since the previous baseline, possibly empty
     */
    public Set<String> detectNewDefinitions() {
        MetricDefinitions current = definitionSource.fetchCurrentDefinitions();
        MetricDefinitions previous = baselineStore.readBaseline().orElseGet(() -> {
            log.warn("Continuing with empty previous metrics set");
            return MetricDefinitions.empty();
        });

        Set<String> added = diffDetector.added(current, previous);
        if (added.isEmpty()) {
            log.info("No new metrics found");
        } else {
            log.info("{} new metrics found: {}", added.size(), added);
        }

        baselineStore.writeBaseline(current);
        return added;
    }
}
