package org.carball.qan.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.qan.fingerprint.FingerprintException;
import org.carball.qan.fingerprint.Fingerprinter;
import org.carball.qan.model.profile.SystemProfile;
import org.carball.qan.model.report.RowMetrics;
import org.carball.qan.model.report.TimeStats;

/**
 * Profiler entries record one execution each. They carry no server-side grouping key, so the
 * class id is the fingerprint of the query document.
 */
public class ProfileRowAdapter implements RowAdapter<SystemProfile> {

    private final Fingerprinter fingerprinter;
    private final boolean exampleQueries;

    public ProfileRowAdapter(Fingerprinter fingerprinter, boolean exampleQueries) {
        this.fingerprinter = fingerprinter;
        this.exampleQueries = exampleQueries;
    }

    @Override
    public String identity(SystemProfile row) {
        return row.getNs() + "|" + row.getOp() + "|" + row.getTs();
    }

    @Override
    public String classId(SystemProfile row) throws FingerprintException {
        return fingerprinter.fingerprint(row);
    }

    @Override
    public boolean cumulative() {
        return false;
    }

    @Override
    public boolean regressed(SystemProfile previous, SystemProfile current) {
        return false;
    }

    @Override
    public SystemProfile subtract(SystemProfile current, SystemProfile previous) {
        return current;
    }

    @Override
    public RowMetrics metrics(SystemProfile delta) {
        return new RowMetrics(1)
                .timing("Query_time", TimeStats.single(delta.getMillis() / 1000.0))
                .counter("Docs_returned", delta.getNreturned())
                .counter("Docs_examined", delta.getDocsExamined())
                .counter("Keys_examined", delta.getKeysExamined())
                .counter("Bytes_sent", delta.getResponseLength());
    }

    @Override
    public String example(SystemProfile row) {
        if (!exampleQueries) {
            return null;
        }
        JsonNode command = row.getCommand();
        JsonNode example = command != null && command.size() > 0 ? command : row.getQuery();
        return example == null ? null : example.toString();
    }
}
