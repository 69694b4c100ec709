package com.ukdataalerts.coronavirus.model;

/**
 * Selects the second alerting criterion applied next to the week-on-week change.
 */
public enum MetricType {

    /** Case counts: the current week per 100,000 people must exceed the cases threshold. */
    CASE_COUNT,

    /** Hospital admissions / occupancy: the raw current-week aggregate must exceed the absolute threshold. */
    HOSPITAL
}
