package org.carball.qan.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qan.model.interval.Interval;

import java.util.ArrayList;
import java.util.List;

/**
 * Report of one interval: per-class statistics of the activity between two adjacent snapshots,
 * plus a global class folding all of them. Classes are ordered by id.
 */
@Data
@NoArgsConstructor
public class Result {

    @JsonProperty("interval")
    private Interval interval;

    @JsonProperty("global")
    private QueryClass global;

    @JsonProperty("classes")
    private List<QueryClass> classes = new ArrayList<>();

    @JsonProperty("run_time_ms")
    private long runTimeMillis;
}
