package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.MetricDefinitions;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds metric identifiers published since the baseline was taken.
 * Removed identifiers are not reported.
 */
@Component
public class DefinitionDiffDetector {

    /**
     * @return identifiers in {@code current} but not in {@code previous}, in manifest order
     */
    public Set<String> added(MetricDefinitions current, MetricDefinitions previous) {
        Set<String> added = new LinkedHashSet<>(current.identifiers());
        added.removeAll(previous.identifiers());
        return added;
    }
}
