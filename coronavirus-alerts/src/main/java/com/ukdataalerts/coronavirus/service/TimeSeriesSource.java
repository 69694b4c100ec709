package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;

import java.util.List;

public interface TimeSeriesSource {

    /**
     * @throws DataFetchException if the series cannot be retrieved
     */
    List<TimeSeriesPoint> fetchTimeSeries(String areaType, String metricName);
}
