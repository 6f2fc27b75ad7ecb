package com.tradewatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A configured screening strategy: filter code, optional series code, the intervals it needs
 * and how often it is evaluated.
 *
 * Loaded from the trader source at startup and on every reload. Instances are replaced, not
 * mutated, once handed to the screener.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trader {

    // Identity
    private String id;
    private String name;
    private int version = 1;

    // Strategy source
    private String filterCode;
    private String seriesCode;
    private List<String> seriesIndicators = new ArrayList<>();

    // Scheduling
    private String refreshInterval = Interval.DEFAULT;
    private List<String> requiredTimeframes = new ArrayList<>();
    private int maxSignalsPerRun = 0;

    private boolean enabled = true;

    public Trader() {
        // For Jackson
    }

    public Trader(String id, String name, String filterCode, String refreshInterval) {
        this.id = id;
        this.name = name;
        this.filterCode = filterCode;
        this.refreshInterval = refreshInterval;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getFilterCode() {
        return filterCode;
    }

    public void setFilterCode(String filterCode) {
        this.filterCode = filterCode;
    }

    public String getSeriesCode() {
        return seriesCode;
    }

    public void setSeriesCode(String seriesCode) {
        this.seriesCode = seriesCode;
    }

    public List<String> getSeriesIndicators() {
        return seriesIndicators;
    }

    public void setSeriesIndicators(List<String> seriesIndicators) {
        this.seriesIndicators = seriesIndicators != null ? seriesIndicators : new ArrayList<>();
    }

    public String getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(String refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public List<String> getRequiredTimeframes() {
        return requiredTimeframes;
    }

    public void setRequiredTimeframes(List<String> requiredTimeframes) {
        this.requiredTimeframes = requiredTimeframes != null ? requiredTimeframes : new ArrayList<>();
    }

    public int getMaxSignalsPerRun() {
        return maxSignalsPerRun;
    }

    public void setMaxSignalsPerRun(int maxSignalsPerRun) {
        this.maxSignalsPerRun = maxSignalsPerRun;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Interval the filter is evaluated on and whose closes advance dedupe bar counts.
     */
    @JsonIgnore
    public String primaryInterval() {
        return refreshInterval != null && !refreshInterval.isBlank() ? refreshInterval : Interval.DEFAULT;
    }

    /**
     * Refresh interval plus every declared timeframe, in declaration order.
     */
    @JsonIgnore
    public Set<String> allIntervals() {
        Set<String> intervals = new LinkedHashSet<>();
        intervals.add(primaryInterval());
        for (String tf : requiredTimeframes) {
            if (tf != null && !tf.isBlank()) {
                intervals.add(tf);
            }
        }
        return intervals;
    }

    @JsonIgnore
    public boolean hasSeriesCode() {
        return seriesCode != null && !seriesCode.isBlank();
    }

    /**
     * True when the strategy source or schedule differs, i.e. a recompile or reschedule is needed.
     */
    public boolean differsFrom(Trader other) {
        return other == null
            || version != other.version
            || !Objects.equals(filterCode, other.filterCode)
            || !Objects.equals(seriesCode, other.seriesCode)
            || !Objects.equals(primaryInterval(), other.primaryInterval())
            || !Objects.equals(allIntervals(), other.allIntervals())
            || !Objects.equals(seriesIndicators, other.seriesIndicators)
            || maxSignalsPerRun != other.maxSignalsPerRun;
    }

    @Override
    public String toString() {
        return name + " (" + id + " v" + version + ")";
    }
}
