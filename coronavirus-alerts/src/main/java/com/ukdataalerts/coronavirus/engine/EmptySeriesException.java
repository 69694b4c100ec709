package com.ukdataalerts.coronavirus.engine;

public class EmptySeriesException extends FatalInputException {

    public EmptySeriesException(String metricName) {
        super("No rows in series for metric '" + metricName + "', cannot determine comparison windows");
    }
}
