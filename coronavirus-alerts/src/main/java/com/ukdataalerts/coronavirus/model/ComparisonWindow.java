package com.ukdataalerts.coronavirus.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * The two adjacent 7-day windows compared for one metric.
 *
 * <pre>
 *   prior   = [upperBound - 13, upperBound - 7]
 *   current = [upperBound - 6,  upperBound]
 * </pre>
 *
 * Both bounds are inclusive.
 */
public record ComparisonWindow(String metricName,
                               LocalDate upperBound,
                               LocalDate priorStart,
                               LocalDate priorEnd,
                               LocalDate currentStart,
                               LocalDate currentEnd) {

    public static final int WINDOW_DAYS = 7;

    private static final DateTimeFormatter LABEL_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    public static ComparisonWindow endingOn(String metricName, LocalDate upperBound) {
        return new ComparisonWindow(
                metricName,
                upperBound,
                upperBound.minusDays(2L * WINDOW_DAYS - 1),
                upperBound.minusDays(WINDOW_DAYS),
                upperBound.minusDays(WINDOW_DAYS - 1),
                upperBound);
    }

    public boolean inPrior(LocalDate date) {
        return !date.isBefore(priorStart) && !date.isAfter(priorEnd);
    }

    public boolean inCurrent(LocalDate date) {
        return !date.isBefore(currentStart) && !date.isAfter(currentEnd);
    }

    /** e.g. {@code newCasesBySpecimenDate-01-03-2021-to-07-03-2021} */
    public String priorLabel() {
        return label(priorStart, priorEnd);
    }

    public String currentLabel() {
        return label(currentStart, currentEnd);
    }

    private String label(LocalDate from, LocalDate to) {
        return metricName + "-" + LABEL_DATE.format(from) + "-to-" + LABEL_DATE.format(to);
    }
}
