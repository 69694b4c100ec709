package com.ukdataalerts.coronavirus.output;

import com.ukdataalerts.coronavirus.model.MetricDefinitions;

import java.util.Optional;

/**
 * Persists the metric manifest seen on the previous run. The stored baseline is
 * overwritten every run; it is a rolling snapshot, not a history.
 */
public interface BaselineStore {

    /**
     * Fails soft: a missing or unreadable baseline is logged and reported as empty.
     */
    Optional<MetricDefinitions> readBaseline();

    void writeBaseline(MetricDefinitions definitions);
}
