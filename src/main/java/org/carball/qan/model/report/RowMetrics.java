package org.carball.qan.model.report;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The metric samples one delta row contributes to its class.
 */
@Getter
public class RowMetrics {
    private final long queries;
    private final Map<String, TimeStats> timings = new LinkedHashMap<>();
    private final Map<String, Long> counters = new LinkedHashMap<>();

    public RowMetrics(long queries) {
        this.queries = queries;
    }

    public RowMetrics timing(String name, TimeStats sample) {
        timings.put(name, sample);
        return this;
    }

    public RowMetrics counter(String name, long value) {
        counters.put(name, value);
        return this;
    }

    public Map<String, TimeStats> getTimings() {
        return Collections.unmodifiableMap(timings);
    }

    public Map<String, Long> getCounters() {
        return Collections.unmodifiableMap(counters);
    }
}
