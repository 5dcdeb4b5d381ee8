package org.carball.qan.worker;

/**
 * How a current cumulative row relates to the row of the same identity in the previous
 * snapshot. Only {@link #ADVANCED} rows are differenced; the others count from zero so a
 * reset never shows up as negative activity.
 */
public enum CounterBaseline {
    /** No row with this identity in the previous snapshot. */
    FIRST_SEEN,
    /** Some counter went backwards: the server reset its statistics in between. */
    RESET,
    /** Every counter is at or above its previous value. */
    ADVANCED;

    public static <R> CounterBaseline classify(RowAdapter<R> adapter, R previous, R current) {
        if (previous == null) {
            return FIRST_SEEN;
        }
        return adapter.regressed(previous, current) ? RESET : ADVANCED;
    }
}
