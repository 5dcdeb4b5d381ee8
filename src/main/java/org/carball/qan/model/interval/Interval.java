package org.carball.qan.model.interval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A numbered, time-bounded sampling window.
 *
 * <p>{@code startTime} is the stop time of the previous interval and is absent (null) for the
 * first interval a sequencer emits. At least one of the two times must be present.
 */
public record Interval(
        @JsonProperty("number") long number,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("stop_time") Instant stopTime
) {

    public Interval {
        if (number < 1) {
            throw new IllegalArgumentException("Interval number must be >= 1, got " + number);
        }
        if (startTime == null && stopTime == null) {
            throw new IllegalArgumentException("Interval " + number + " has neither start nor stop time");
        }
    }

    /**
     * The instant this interval is anchored to: its stop time, or its start time when the
     * interval was built without one.
     */
    @JsonIgnore
    public Instant boundary() {
        return stopTime != null ? stopTime : startTime;
    }

    /**
     * Tests whether this interval is the immediate successor of {@code previous}: the number
     * advanced by exactly one and time moved strictly forward.
     */
    public boolean follows(Interval previous) {
        if (previous == null) {
            return false;
        }
        return number == previous.number + 1 && boundary().isAfter(previous.boundary());
    }
}
