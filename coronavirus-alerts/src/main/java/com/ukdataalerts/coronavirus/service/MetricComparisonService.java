package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.engine.AreaAggregator;
import com.ukdataalerts.coronavirus.engine.PopulationTable;
import com.ukdataalerts.coronavirus.engine.ThresholdFilter;
import com.ukdataalerts.coronavirus.engine.WindowResolver;
import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.CheckResult;
import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import com.ukdataalerts.coronavirus.model.MetricCheck;
import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;
import com.ukdataalerts.coronavirus.output.CsvReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Fetches one metric for one area type and compares the last two weeks
 * area by area.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricComparisonService {

    private final TimeSeriesSource timeSeriesSource;
    private final WindowResolver windowResolver;
    private final AreaAggregator areaAggregator;
    private final ThresholdFilter thresholdFilter;
    private final CsvReportWriter csvReportWriter;

    /**
     * @throws com.ukdataalerts.coronavirus.engine.FatalInputException if the series is empty or area codes are ambiguous
     * @throws DataFetchException if the series or a population table cannot be fetched
     */
    public CheckResult evaluate(MetricCheck check, RunContext context) {
        List<TimeSeriesPoint> series = timeSeriesSource.fetchTimeSeries(check.getAreaType(), check.getMetric());
        ComparisonWindow window = windowResolver.resolve(check.getMetric(), series, context.getVerificationMode());
        PopulationTable populations = context.populations(check.getPopulationSource());

        AreaAggregator.Comparison comparison =
                areaAggregator.compareAll(series, check.getAggregation(), window, populations);
        List<AreaResult> alerts =
                thresholdFilter.filter(comparison.rows(), check.getMetricType(), context.getThresholds());

        log.info("{}: compared {} areas ({} excluded), {} above thresholds",
                check.describe(), comparison.rows().size(), comparison.excludedAreas(), alerts.size());
        if (log.isDebugEnabled()) {
            comparison.rows().forEach(r -> log.debug("{} {}: {} -> {} ({}%), per 100k {}",
                    check.getMetric(), r.getAreaName(), r.getPriorAggregate(), r.getCurrentAggregate(),
                    r.roundedPercentageChange(), r.roundedPer100000Rate()));
        }

        CheckResult result = CheckResult.builder()
                .check(check)
                .window(window)
                .rows(comparison.rows())
                .alerts(alerts)
                .excludedAreas(comparison.excludedAreas())
                .build();

        if (csvReportWriter.isEnabled()) {
            writeReport(result);
        }
        return result;
    }

    // a failed report never fails the check
    private void writeReport(CheckResult result) {
        try {
            csvReportWriter.write(result);
        } catch (UncheckedIOException e) {
            log.error("{}: CSV report not written: {}", result.getCheck().describe(), e.getMessage(), e);
        }
    }
}
