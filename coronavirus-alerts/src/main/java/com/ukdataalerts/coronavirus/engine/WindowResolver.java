package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;
import com.ukdataalerts.coronavirus.model.VerificationMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;

/**
 * Picks the two comparison windows for a series.
 *
 * The upper bound is the newest date anywhere in the series (not per area),
 * pulled back by the verification lag in VERIFIED mode.
 */
@Component
@Slf4j
public class WindowResolver {

    public ComparisonWindow resolve(String metricName, Collection<TimeSeriesPoint> series, VerificationMode mode) {
        LocalDate latest = series.stream()
                .map(TimeSeriesPoint::date)
                .max(Comparator.naturalOrder())
                .orElseThrow(() -> new EmptySeriesException(metricName));

        LocalDate upperBound = latest.minusDays(mode.lagDays());
        ComparisonWindow window = ComparisonWindow.endingOn(metricName, upperBound);

        log.debug("{}: latest date {}, mode {}, comparing {} with {}",
                metricName, latest, mode, window.priorLabel(), window.currentLabel());
        return window;
    }
}
