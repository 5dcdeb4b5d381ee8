package org.carball.qan.worker;

import org.carball.qan.fingerprint.FingerprintException;
import org.carball.qan.model.report.RowMetrics;

/**
 * What the snapshot-diff worker needs to know about one kind of row.
 */
public interface RowAdapter<R> {

    /**
     * Key matching a row to its predecessor in the previous snapshot.
     */
    String identity(R row);

    /**
     * Key of the class the row is folded into.
     */
    String classId(R row) throws FingerprintException;

    /**
     * Whether rows carry cumulative counters that need differencing. Rows of event sources
     * are new activity each and are folded as captured.
     */
    boolean cumulative();

    /**
     * True when a cumulative counter of {@code current} is below {@code previous}.
     */
    boolean regressed(R previous, R current);

    /**
     * The activity between {@code previous} and {@code current}.
     */
    R subtract(R current, R previous);

    /**
     * Samples of a delta row.
     */
    RowMetrics metrics(R delta);

    /**
     * A concrete query for the class, if the source has one.
     */
    default String example(R row) {
        return null;
    }
}
