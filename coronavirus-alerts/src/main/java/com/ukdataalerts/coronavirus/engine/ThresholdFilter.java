package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.MetricType;
import com.ukdataalerts.coronavirus.model.Thresholds;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Selects the areas worth alerting on and ranks them by week-on-week change.
 */
@Component
public class ThresholdFilter {

    /**
     * @return rows passing both criteria, highest change first; ties keep input order
     */
    public List<AreaResult> filter(Collection<AreaResult> rows, MetricType metricType, Thresholds thresholds) {
        Predicate<AreaResult> secondCriterion = secondCriterion(metricType, thresholds);

        return rows.stream()
                .filter(r -> r.getPercentageChange() > thresholds.percentageChange())
                .filter(secondCriterion)
                .sorted(Comparator.comparingDouble(AreaResult::getPercentageChange).reversed())
                .collect(Collectors.toList());
    }

    static Predicate<AreaResult> secondCriterion(MetricType metricType, Thresholds thresholds) {
        return switch (metricType) {
            case CASE_COUNT -> r -> r.getPer100000Rate() != null
                    && r.getPer100000Rate() > thresholds.casesPer100000();
            case HOSPITAL -> r -> r.getCurrentAggregate() > thresholds.hospitalAbsolute();
        };
    }
}
