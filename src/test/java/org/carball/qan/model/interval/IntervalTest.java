package org.carball.qan.model.interval;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntervalTest {

    private static final Instant T1 = Instant.parse("2015-01-01T00:01:00Z");
    private static final Instant T2 = Instant.parse("2015-01-01T00:02:00Z");

    @Test
    void shouldFollowPreviousInterval() {
        Interval first = new Interval(1, null, T1);
        Interval second = new Interval(2, T1, T2);

        assertThat(second.follows(first)).isTrue();
        assertThat(first.follows(second)).isFalse();
        assertThat(first.follows(null)).isFalse();
    }

    @Test
    void shouldNotFollowWhenNumberSkipped() {
        assertThat(new Interval(3, T1, T2).follows(new Interval(1, null, T1))).isFalse();
    }

    @Test
    void shouldNotFollowWhenTimeDidNotAdvance() {
        assertThat(new Interval(2, null, T1).follows(new Interval(1, null, T1))).isFalse();
        assertThat(new Interval(2, null, T1).follows(new Interval(1, null, T2))).isFalse();
    }

    @Test
    void shouldUseStartTimeWhenStopTimeMissing() {
        Interval interval = new Interval(1, T1, null);

        assertThat(interval.boundary()).isEqualTo(T1);
        assertThat(new Interval(2, T2, null).follows(interval)).isTrue();
    }

    @Test
    void shouldRejectInvalidIntervals() {
        assertThatThrownBy(() -> new Interval(0, T1, T2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(">= 1");
        assertThatThrownBy(() -> new Interval(1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
