package com.tradewatch.engine.sandbox;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Named output of one series line.
 *
 * @param name        line name as written in the series code
 * @param expressions source of each plotted expression
 * @param points      warmup-trimmed points, oldest first
 */
public record IndicatorSeries(String name, List<String> expressions, List<SeriesPoint> points) {

    public IndicatorSeries {
        expressions = List.copyOf(expressions);
        points = List.copyOf(points);
    }

    /**
     * Primary value of the newest point.
     */
    @JsonIgnore
    public OptionalDouble latest() {
        if (points.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(points.get(points.size() - 1).y());
    }
}
