package org.carball.qan.model.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a timing metric, in seconds. The average is derived from sum and count when read
 * so it cannot drift from them.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = {"avg"}, allowGetters = true)
public class TimeStats {
    private double sum;
    private long count;
    private Double min;
    private Double max;

    /**
     * A summary of one pre-aggregated sample: {@code count} executions totalling {@code sum},
     * the fastest taking {@code min} and the slowest {@code max}.
     */
    public static TimeStats of(double sum, long count, double min, double max) {
        TimeStats stats = new TimeStats();
        stats.add(sum, count, min, max);
        return stats;
    }

    /**
     * A summary of a single execution.
     */
    public static TimeStats single(double value) {
        return of(value, 1, value, value);
    }

    public void add(double sampleSum, long sampleCount, double sampleMin, double sampleMax) {
        sum += sampleSum;
        count += sampleCount;
        min = min == null ? sampleMin : Math.min(min, sampleMin);
        max = max == null ? sampleMax : Math.max(max, sampleMax);
    }

    /**
     * A summary known only by its total, for sources that keep no extremes. Min and max stay
     * absent until merged with a summary that has them.
     */
    public static TimeStats totals(double sum, long count) {
        TimeStats stats = new TimeStats();
        stats.sum = sum;
        stats.count = count;
        return stats;
    }

    public void merge(TimeStats other) {
        if (other == null) {
            return;
        }
        sum += other.sum;
        count += other.count;
        if (other.min != null) {
            min = min == null ? other.min : Math.min(min, other.min);
        }
        if (other.max != null) {
            max = max == null ? other.max : Math.max(max, other.max);
        }
    }

    public double getAvg() {
        return count == 0 ? 0.0 : sum / count;
    }
}
