package org.carball.qan.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Metric name to statistical summary, split by metric kind.
 */
@Data
public class Metrics {
    @JsonProperty("time_metrics")
    private SortedMap<String, TimeStats> timeMetrics = new TreeMap<>();

    @JsonProperty("number_metrics")
    private SortedMap<String, NumberStats> numberMetrics = new TreeMap<>();

    public TimeStats time(String name) {
        return timeMetrics.computeIfAbsent(name, k -> new TimeStats());
    }

    public NumberStats number(String name) {
        return numberMetrics.computeIfAbsent(name, k -> new NumberStats());
    }
}
