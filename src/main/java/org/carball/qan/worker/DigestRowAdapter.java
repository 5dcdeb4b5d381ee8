package org.carball.qan.worker;

import org.carball.qan.model.digest.DigestRow;
import org.carball.qan.model.digest.UnsignedLongDeserializer;
import org.carball.qan.model.report.RowMetrics;
import org.carball.qan.model.report.TimeStats;

/**
 * Statement digest rows come keyed by the server, so the digest itself is the class id.
 */
public class DigestRowAdapter implements RowAdapter<DigestRow> {

    private static final double PICOSECONDS_PER_SECOND = 1e12;

    @Override
    public String identity(DigestRow row) {
        return row.identity();
    }

    @Override
    public String classId(DigestRow row) {
        return row.digest();
    }

    @Override
    public boolean cumulative() {
        return true;
    }

    @Override
    public boolean regressed(DigestRow previous, DigestRow current) {
        return current.isBehind(previous);
    }

    @Override
    public DigestRow subtract(DigestRow current, DigestRow previous) {
        return current.minus(previous);
    }

    @Override
    public RowMetrics metrics(DigestRow delta) {
        long count = delta.countStar();

        return new RowMetrics(count)
                .timing("Query_time", TimeStats.of(
                        seconds(delta.sumTimerWait()), count,
                        seconds(delta.minTimerWait()), seconds(delta.maxTimerWait())))
                // the digest table keeps no lock time extremes
                .timing("Lock_time", TimeStats.totals(seconds(delta.sumLockTime()), count))
                .counter("Rows_sent", delta.sumRowsSent())
                .counter("Rows_examined", delta.sumRowsExamined())
                .counter("Rows_affected", delta.sumRowsAffected())
                .counter("Errors", delta.sumErrors())
                .counter("Warnings", delta.sumWarnings())
                .counter("Tmp_tables", delta.sumCreatedTmpTables())
                .counter("Tmp_disk_tables", delta.sumCreatedTmpDiskTables())
                .counter("Full_join", delta.sumSelectFullJoin())
                .counter("Full_scan", delta.sumSelectScan())
                .counter("Merge_passes", delta.sumSortMergePasses())
                .counter("Sort_rows", delta.sumSortRows())
                .counter("No_index_used", delta.sumNoIndexUsed())
                .counter("No_good_index_used", delta.sumNoGoodIndexUsed());
    }

    private static double seconds(long picoseconds) {
        return UnsignedLongDeserializer.toDouble(picoseconds) / PICOSECONDS_PER_SECOND;
    }
}
