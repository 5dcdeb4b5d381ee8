package org.carball.qan.model.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeStatsTest {

    @Test
    void shouldDeriveAverageFromSumAndCount() {
        TimeStats stats = TimeStats.of(3.0, 4, 0.5, 1.5);

        assertThat(stats.getAvg()).isEqualTo(0.75);
        assertThat(new TimeStats().getAvg()).isZero();
    }

    @Test
    void shouldIgnoreEmptyStatsOnMerge() {
        TimeStats stats = TimeStats.single(0.25);

        stats.merge(new TimeStats());
        stats.merge(null);

        assertThat(stats.getCount()).isEqualTo(1);
        assertThat(stats.getMin()).isEqualTo(0.25);
        assertThat(stats.getMax()).isEqualTo(0.25);
    }

    @Test
    void shouldWidenExtremesOnMerge() {
        TimeStats stats = TimeStats.of(1.0, 2, 0.25, 0.75);

        stats.merge(TimeStats.of(2.0, 2, 0.125, 1.875));

        assertThat(stats.getSum()).isEqualTo(3.0);
        assertThat(stats.getCount()).isEqualTo(4);
        assertThat(stats.getMin()).isEqualTo(0.125);
        assertThat(stats.getMax()).isEqualTo(1.875);
    }

    @Test
    void shouldMergeTotalsWithoutInventingExtremes() {
        TimeStats stats = new TimeStats();

        stats.merge(TimeStats.totals(0.5, 3));
        stats.merge(TimeStats.totals(0.25, 1));

        assertThat(stats.getSum()).isEqualTo(0.75);
        assertThat(stats.getCount()).isEqualTo(4);
        assertThat(stats.getMin()).isNull();
        assertThat(stats.getMax()).isNull();

        stats.merge(TimeStats.of(1.0, 1, 1.0, 1.0));

        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getMax()).isEqualTo(1.0);
    }
}
