package org.carball.qan.analyzer;

import org.carball.qan.model.report.Metrics;
import org.carball.qan.model.report.NumberStats;
import org.carball.qan.model.report.QueryClass;
import org.carball.qan.model.report.RowMetrics;
import org.carball.qan.model.report.TimeStats;

import java.util.Map;

/**
 * Folds delta rows into class statistics. Timing metrics keep min, max, sum and count,
 * counters only their sum. Every operation is a sum, min or max, so the outcome does not
 * depend on the order rows arrive in.
 */
public final class MetricsAccumulator {

    private MetricsAccumulator() {
        // Utility class - prevent instantiation
    }

    /**
     * Adds the samples of one delta row to a class.
     */
    public static void fold(QueryClass queryClass, RowMetrics sample) {
        queryClass.setTotalQueries(queryClass.getTotalQueries() + sample.getQueries());
        fold(queryClass.getMetrics(), sample);
    }

    /**
     * Adds the samples of one delta row to a metrics bag.
     */
    public static void fold(Metrics bag, RowMetrics sample) {
        for (Map.Entry<String, TimeStats> timing : sample.getTimings().entrySet()) {
            bag.time(timing.getKey()).merge(timing.getValue());
        }
        for (Map.Entry<String, Long> counter : sample.getCounters().entrySet()) {
            bag.number(counter.getKey()).add(counter.getValue());
        }
    }

    /**
     * Adds everything accumulated in {@code from} to {@code into}.
     */
    public static void merge(QueryClass into, QueryClass from) {
        into.setTotalQueries(into.getTotalQueries() + from.getTotalQueries());
        for (Map.Entry<String, TimeStats> timing : from.getMetrics().getTimeMetrics().entrySet()) {
            into.getMetrics().time(timing.getKey()).merge(timing.getValue());
        }
        for (Map.Entry<String, NumberStats> number : from.getMetrics().getNumberMetrics().entrySet()) {
            into.getMetrics().number(number.getKey()).add(number.getValue().getSum());
        }
    }
}
