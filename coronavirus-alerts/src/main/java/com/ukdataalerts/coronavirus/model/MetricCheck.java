package com.ukdataalerts.coronavirus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured (area type, metric, aggregation) comparison.
 * Bound from the {@code coronavirus-alerts.checks} list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricCheck {

    /** API area type, e.g. ltla or nhsRegion */
    private String areaType;

    /** API metric name, e.g. newCasesBySpecimenDate */
    private String metric;

    private AggregationOperator aggregation = AggregationOperator.SUM;

    private MetricType metricType = MetricType.CASE_COUNT;

    /** Null when no per-capita rate should be computed */
    private PopulationSourceType populationSource;

    public String describe() {
        return areaType + "/" + metric;
    }
}
