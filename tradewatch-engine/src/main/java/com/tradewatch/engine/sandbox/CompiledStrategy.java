package com.tradewatch.engine.sandbox;

import com.tradewatch.core.dsl.AstNode;
import com.tradewatch.core.dsl.ExpressionPrinter;
import com.tradewatch.core.model.Trader;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed filter and optional series program of one trader version.
 */
public final class CompiledStrategy {

    private final String traderId;
    private final int version;
    private final String filterSource;
    private final String seriesSource;
    private final AstNode filter;
    private final SeriesProgram series;

    CompiledStrategy(String traderId, int version, String filterSource, String seriesSource,
                     AstNode filter, SeriesProgram series) {
        this.traderId = traderId;
        this.version = version;
        this.filterSource = filterSource;
        this.seriesSource = seriesSource;
        this.filter = filter;
        this.series = series;
    }

    public String getTraderId() {
        return traderId;
    }

    public int getVersion() {
        return version;
    }

    public AstNode getFilter() {
        return filter;
    }

    /**
     * Series program, or null when the trader has no series code.
     */
    public SeriesProgram getSeries() {
        return series;
    }

    public boolean hasSeries() {
        return series != null;
    }

    /**
     * Intervals referenced with {@code @interval} in the filter or series code.
     */
    public Set<String> referencedIntervals() {
        Set<String> intervals = new LinkedHashSet<>(ExpressionPrinter.referencedIntervals(filter));
        if (series != null) {
            series.lines().forEach(l -> l.expressions()
                .forEach(e -> intervals.addAll(ExpressionPrinter.referencedIntervals(e))));
        }
        return intervals;
    }

    /**
     * True when this compilation is still valid for the given trader definition.
     */
    public boolean isCurrentFor(Trader trader) {
        return version == trader.getVersion()
            && Objects.equals(filterSource, trader.getFilterCode())
            && Objects.equals(seriesSource, trader.hasSeriesCode() ? trader.getSeriesCode() : null);
    }
}
