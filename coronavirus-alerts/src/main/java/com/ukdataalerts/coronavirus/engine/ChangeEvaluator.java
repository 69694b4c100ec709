package com.ukdataalerts.coronavirus.engine;

import com.ukdataalerts.coronavirus.model.AreaResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Week-on-week percentage change and assembly of the per-area row.
 *
 * Zero prior week: 0 -> 0 is no change, 0 -> anything else is an unbounded rise
 * and therefore {@link Double#POSITIVE_INFINITY}.
 */
@Component
@Slf4j
public class ChangeEvaluator {

    public static double percentageChange(double prior, double current) {
        if (prior == 0d) {
            return current == 0d ? 0d : Double.POSITIVE_INFINITY;
        }
        return ((current - prior) / prior) * 100.0;
    }

    public OptionalDouble percentageChange(OptionalDouble prior, OptionalDouble current) {
        if (prior.isEmpty() || current.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(percentageChange(prior.getAsDouble(), current.getAsDouble()));
    }

    /**
     * @param per100000Rate null when no population was found
     * @param rateColumn    false when the metric has no population source at all
     * @return empty when either week has no data; the area is then left out
     */
    public Optional<AreaResult> evaluate(String areaName,
                                         String areaCode,
                                         OptionalDouble prior,
                                         OptionalDouble current,
                                         Double per100000Rate,
                                         boolean rateColumn) {
        OptionalDouble change = percentageChange(prior, current);
        if (change.isEmpty()) {
            log.warn("Cannot calculate percentage change for area '{}': {} week has no data",
                    areaName, prior.isEmpty() ? "prior" : "current");
            return Optional.empty();
        }

        return Optional.of(AreaResult.builder()
                .areaName(areaName)
                .areaCode(areaCode)
                .priorAggregate(prior.getAsDouble())
                .currentAggregate(current.getAsDouble())
                .percentageChange(change.getAsDouble())
                .per100000Rate(rateColumn ? per100000Rate : null)
                .rateColumn(rateColumn)
                .build());
    }
}
