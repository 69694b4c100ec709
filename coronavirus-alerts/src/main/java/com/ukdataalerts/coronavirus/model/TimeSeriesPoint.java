package com.ukdataalerts.coronavirus.model;

import java.time.LocalDate;

/**
 * One day of one metric for one area, as published by the coronavirus dashboard API.
 *
 * @param metricValue null when the API row carries no value for the day
 */
public record TimeSeriesPoint(String areaName, String areaCode, LocalDate date, Double metricValue) {
}
