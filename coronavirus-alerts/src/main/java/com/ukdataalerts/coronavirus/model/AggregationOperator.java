package com.ukdataalerts.coronavirus.model;

import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Collapses the daily values of one window into a single figure.
 * Cumulative-style daily counts are summed; occupancy-style figures are averaged.
 */
public enum AggregationOperator {
    SUM {
        @Override
        protected double combine(double[] values) {
            return DoubleStream.of(values).sum();
        }
    },
    MEAN {
        @Override
        protected double combine(double[] values) {
            return DoubleStream.of(values).sum() / values.length;
        }
    };

    /**
     * @return empty when no value contributes, never zero
     */
    public OptionalDouble apply(DoubleStream values) {
        double[] contributing = values.toArray();
        if (contributing.length == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(combine(contributing));
    }

    protected abstract double combine(double[] values);
}
