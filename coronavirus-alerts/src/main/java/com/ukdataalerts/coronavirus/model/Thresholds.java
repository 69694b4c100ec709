package com.ukdataalerts.coronavirus.model;

/**
 * Alerting thresholds. All comparisons are strictly greater-than.
 *
 * @param percentageChange  week-on-week change, in percent
 * @param casesPer100000    current week per 100,000 people, for {@link MetricType#CASE_COUNT}
 * @param hospitalAbsolute  raw current-week aggregate, for {@link MetricType#HOSPITAL}
 */
public record Thresholds(double percentageChange, double casesPer100000, double hospitalAbsolute) {
}
