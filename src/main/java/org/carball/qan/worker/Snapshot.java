package org.carball.qan.worker;

import org.carball.qan.model.interval.Interval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows captured at one interval boundary. Rows of cumulative sources are indexed by identity,
 * a later duplicate replacing an earlier one.
 */
final class Snapshot<R> {

    private final Interval interval;
    private final List<R> rows;
    private final Map<String, R> byIdentity;

    private Snapshot(Interval interval, List<R> rows, Map<String, R> byIdentity) {
        this.interval = interval;
        this.rows = rows;
        this.byIdentity = byIdentity;
    }

    static <R> Snapshot<R> of(Interval interval, List<R> captured, RowAdapter<R> adapter) {
        if (!adapter.cumulative()) {
            return new Snapshot<>(interval, Collections.unmodifiableList(new ArrayList<>(captured)), Map.of());
        }
        Map<String, R> index = new LinkedHashMap<>();
        for (R row : captured) {
            index.put(adapter.identity(row), row);
        }
        return new Snapshot<>(interval, List.copyOf(index.values()), index);
    }

    Interval interval() {
        return interval;
    }

    Collection<R> rows() {
        return rows;
    }

    R get(String identity) {
        return byIdentity.get(identity);
    }

    int size() {
        return rows.size();
    }
}
