package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.AggregationOperator;
import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Aggregates one metric per area over the prior and current windows and
 * normalises the current week by population where a table is supplied.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AreaAggregator {

    private static final double PER_POPULATION = 100_000d;

    private final ChangeEvaluator changeEvaluator;

    /**
     * Compares every area of the series, in order of first appearance.
     *
     * @param populations null when the metric has no population source
     * @throws AmbiguousAreaCodeException if an area name maps to more than one code
     */
    public Comparison compareAll(Collection<TimeSeriesPoint> series,
                                 AggregationOperator aggregation,
                                 ComparisonWindow window,
                                 PopulationTable populations) {
        Map<String, List<TimeSeriesPoint>> byArea = new LinkedHashMap<>();
        for (TimeSeriesPoint point : series) {
            byArea.computeIfAbsent(point.areaName(), k -> new ArrayList<>()).add(point);
        }

        List<AreaResult> rows = new ArrayList<>(byArea.size());
        int excluded = 0;
        for (Map.Entry<String, List<TimeSeriesPoint>> area : byArea.entrySet()) {
            Optional<AreaResult> row = compare(area.getKey(), area.getValue(), aggregation, window, populations);
            if (row.isPresent()) {
                rows.add(row.get());
            } else {
                excluded++;
            }
        }
        return new Comparison(rows, excluded);
    }

    public Optional<AreaResult> compare(String areaName,
                                        List<TimeSeriesPoint> areaRows,
                                        AggregationOperator aggregation,
                                        ComparisonWindow window,
                                        PopulationTable populations) {
        String areaCode = areaCodeFor(areaName, areaRows);

        OptionalDouble prior = aggregate(areaRows, aggregation, p -> window.inPrior(p.date()));
        OptionalDouble current = aggregate(areaRows, aggregation, p -> window.inCurrent(p.date()));

        boolean rateColumn = populations != null;
        Double rate = null;
        if (rateColumn && current.isPresent()) {
            rate = per100000(current.getAsDouble(), populations, areaName, areaCode);
        }

        return changeEvaluator.evaluate(areaName, areaCode, prior, current, rate, rateColumn);
    }

    static String areaCodeFor(String areaName, List<TimeSeriesPoint> areaRows) {
        Set<String> codes = new LinkedHashSet<>();
        for (TimeSeriesPoint point : areaRows) {
            codes.add(point.areaCode());
        }
        if (codes.size() != 1) {
            throw new AmbiguousAreaCodeException(areaName, codes);
        }
        return codes.iterator().next();
    }

    private OptionalDouble aggregate(List<TimeSeriesPoint> areaRows,
                                     AggregationOperator aggregation,
                                     Predicate<TimeSeriesPoint> inWindow) {
        return aggregation.apply(areaRows.stream()
                .filter(inWindow)
                .map(TimeSeriesPoint::metricValue)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue));
    }

    private Double per100000(double current, PopulationTable populations, String areaName, String areaCode) {
        OptionalLong population = populations.lookupArea(areaName, areaCode);
        if (population.isEmpty() || population.getAsLong() == 0L) {
            log.warn("Error getting population for area '{}', key '{}' not found in {} population table",
                    areaName, populations.keyFor(areaName, areaCode), populations.getType());
            return null;
        }
        return (current / population.getAsLong()) * PER_POPULATION;
    }

    /**
     * @param excludedAreas areas left out because one of the windows had no data
     */
    public record Comparison(List<AreaResult> rows, int excludedAreas) {
    }
}
