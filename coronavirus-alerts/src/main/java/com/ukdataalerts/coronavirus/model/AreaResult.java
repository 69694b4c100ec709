package com.ukdataalerts.coronavirus.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Week-on-week comparison of one metric for one area.
 *
 * Values are kept unrounded; thresholds compare against these.
 * Use the {@code rounded*} accessors for anything shown to a reader.
 */
@Value
@Builder
public class AreaResult {

    String areaName;
    String areaCode;

    double priorAggregate;
    double currentAggregate;

    /** May be {@link Double#POSITIVE_INFINITY} when the prior week was zero. */
    double percentageChange;

    /** Current week per 100,000 people; null when the area has no population entry. */
    Double per100000Rate;

    /**
     * Whether this metric carries a rate at all. False for checks with no
     * population source, in which case the column is left out of reports.
     */
    boolean rateColumn;

    public double roundedPercentageChange() {
        return round(percentageChange);
    }

    public Double roundedPer100000Rate() {
        return per100000Rate == null ? null : round(per100000Rate);
    }

    static double round(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
