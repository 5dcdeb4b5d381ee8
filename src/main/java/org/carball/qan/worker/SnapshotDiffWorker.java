package org.carball.qan.worker;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.analyzer.MetricsAccumulator;
import org.carball.qan.fingerprint.FingerprintException;
import org.carball.qan.model.interval.Interval;
import org.carball.qan.model.report.QueryClass;
import org.carball.qan.model.report.Result;
import org.carball.qan.model.report.RowMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Turns two adjacent snapshots of cumulative query statistics into a report of the activity
 * between them.
 *
 * <p>Only the snapshot of the previous interval is retained. A result is produced when the
 * new interval directly follows it; otherwise the new snapshot just becomes the baseline for
 * the next interval. Failed captures never replace the baseline.
 */
@Slf4j
public class SnapshotDiffWorker<R> implements Worker {

    public static final int DEFAULT_ROW_QUEUE_CAPACITY = 1000;
    public static final int DEFAULT_TEXT_CACHE_SIZE = 1000;
    private static final long POLL_MILLIS = 100;

    private final String name;
    private final RowAdapter<R> adapter;
    private final RowSource<R> rowSource;
    private final TextSource textSource;
    private final int rowQueueCapacity;
    private final Clock clock;
    private final Map<String, String> textCache;
    private final Map<String, String> status = new ConcurrentHashMap<>();

    private Snapshot<R> previous;
    private Instant lastFetch;

    // in-flight capture, set by setup and cleared by cleanup
    private Interval interval;
    private BlockingQueue<R> rows;
    private CompletableFuture<Void> done;
    private Instant fetchStarted;

    public SnapshotDiffWorker(String name, RowAdapter<R> adapter, RowSource<R> rowSource, TextSource textSource) {
        this(name, adapter, rowSource, textSource, DEFAULT_ROW_QUEUE_CAPACITY, DEFAULT_TEXT_CACHE_SIZE, Clock.systemUTC());
    }

    public SnapshotDiffWorker(String name, RowAdapter<R> adapter, RowSource<R> rowSource, TextSource textSource,
                              int rowQueueCapacity, int textCacheSize, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.rowSource = Objects.requireNonNull(rowSource, "rowSource");
        this.textSource = Objects.requireNonNull(textSource, "textSource");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (rowQueueCapacity <= 0) {
            throw new IllegalArgumentException("row queue capacity must be positive: " + rowQueueCapacity);
        }
        this.rowQueueCapacity = rowQueueCapacity;
        this.textCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > textCacheSize;
            }
        };
    }

    @Override
    public void setup(Interval interval) throws WorkerException {
        Objects.requireNonNull(interval, "interval");
        if (done != null) {
            throw new IllegalStateException(name + ": setup called again before cleanup");
        }

        Instant now = clock.instant();
        double lastFetchSeconds = lastFetch == null ? 0 : Duration.between(lastFetch, now).toMillis() / 1000.0;
        BlockingQueue<R> queue = new ArrayBlockingQueue<>(rowQueueCapacity);
        CompletableFuture<Void> completion = new CompletableFuture<>();

        try {
            rowSource.fetch(queue, lastFetchSeconds, completion);
        } catch (WorkerException e) {
            notice("cannot start capture for interval " + interval.number() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            notice("cannot start capture for interval " + interval.number() + ": " + e.getMessage());
            throw new WorkerException(name + ": cannot start capture for interval " + interval.number(), e);
        }

        this.interval = interval;
        this.rows = queue;
        this.done = completion;
        this.fetchStarted = now;
        status.put(name + "-interval", describe(interval));
        log.debug("{}: capturing snapshot for interval {}", name, interval.number());
    }

    @Override
    public Optional<Result> run() throws WorkerException {
        if (done == null) {
            throw new IllegalStateException(name + ": run called without a successful setup");
        }
        Instant started = clock.instant();

        List<R> captured = new ArrayList<>();
        Throwable failure = drain(captured);
        if (failure != null) {
            notice("capture for interval " + interval.number() + " failed: " + failure.getMessage());
            log.warn("{}: capture for interval {} failed after {} rows, keeping previous snapshot",
                    name, interval.number(), captured.size());
            throw new WorkerException(name + ": capture for interval " + interval.number() + " failed", failure);
        }
        lastFetch = fetchStarted;

        Snapshot<R> current = Snapshot.of(interval, captured, adapter);
        Snapshot<R> baseline = previous;

        if (baseline == null) {
            previous = current;
            status.put(name + "-last", String.format("rows: %d, first interval", current.size()));
            log.info("{}: interval {} captured {} rows, no result until the next interval",
                    name, interval.number(), current.size());
            return Optional.empty();
        }
        if (!interval.follows(baseline.interval())) {
            previous = current;
            status.put(name + "-last", String.format("rows: %d, out of sequence", current.size()));
            log.warn("{}: interval {} at {} does not follow interval {} at {}, no result",
                    name, interval.number(), interval.boundary(),
                    baseline.interval().number(), baseline.interval().boundary());
            return Optional.empty();
        }

        Result result = diff(baseline, current);
        previous = current;
        result.setRunTimeMillis(Duration.between(started, clock.instant()).toMillis());
        return Optional.of(result);
    }

    @Override
    public void cleanup() {
        if (done != null && !done.isDone()) {
            log.warn("{}: abandoning unfinished capture for interval {}", name, interval.number());
        }
        if (rows != null) {
            rows.clear();
        }
        interval = null;
        rows = null;
        done = null;
        fetchStarted = null;
    }

    @Override
    public Map<String, String> status() {
        return new TreeMap<>(status);
    }

    public String getName() {
        return name;
    }

    private Result diff(Snapshot<R> baseline, Snapshot<R> current) {
        Map<String, QueryClass> classes = new TreeMap<>();
        int deltas = 0;
        int resets = 0;
        int skipped = 0;

        for (R row : current.rows()) {
            R delta = row;
            if (adapter.cumulative()) {
                R before = baseline.get(adapter.identity(row));
                CounterBaseline kind = CounterBaseline.classify(adapter, before, row);
                if (kind == CounterBaseline.ADVANCED) {
                    delta = adapter.subtract(row, before);
                } else if (kind == CounterBaseline.RESET) {
                    resets++;
                }
            }

            RowMetrics sample = adapter.metrics(delta);
            if (sample.getQueries() <= 0) {
                continue;
            }

            String classId;
            try {
                classId = adapter.classId(row);
            } catch (FingerprintException e) {
                skipped++;
                notice("skipped row: " + e.getMessage());
                log.warn("{}: skipping row in interval {}: {}", name, interval.number(), e.getMessage());
                continue;
            }

            QueryClass queryClass = classes.computeIfAbsent(classId, this::newClass);
            if (queryClass.getExample() == null) {
                queryClass.setExample(adapter.example(row));
            }
            MetricsAccumulator.fold(queryClass, sample);
            deltas++;
        }

        if (resets > 0) {
            log.info("{}: {} rows had counters below the previous snapshot, counting them from zero", name, resets);
        }

        QueryClass global = new QueryClass();
        for (QueryClass queryClass : classes.values()) {
            MetricsAccumulator.merge(global, queryClass);
        }

        Result result = new Result();
        result.setInterval(interval);
        result.setGlobal(global);
        result.setClasses(new ArrayList<>(classes.values()));

        status.put(name + "-last", String.format("rows: %d, deltas: %d, classes: %d, resets: %d, skipped: %d",
                current.size(), deltas, classes.size(), resets, skipped));
        log.debug("{}: interval {} produced {} classes from {} delta rows",
                name, interval.number(), classes.size(), deltas);
        return result;
    }

    private QueryClass newClass(String classId) {
        QueryClass queryClass = new QueryClass(classId);
        queryClass.setFingerprint(text(classId));
        return queryClass;
    }

    private String text(String classId) {
        // absent texts are cached too, only failures are retried
        if (textCache.containsKey(classId)) {
            return textCache.get(classId);
        }
        try {
            String text = textSource.fetchText(classId);
            textCache.put(classId, text);
            return text;
        } catch (WorkerException | RuntimeException e) {
            notice("no text for class " + classId + ": " + e.getMessage());
            log.warn("{}: cannot fetch text for class {}: {}", name, classId, e.getMessage());
            return null;
        }
    }

    /**
     * Consumes rows until the producer signalled completion and nothing is left, so a producer
     * blocked on a full queue always gets to finish. Returns the failure the producer reported.
     */
    private Throwable drain(List<R> captured) throws WorkerException {
        try {
            while (true) {
                R row = rows.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (row != null) {
                    captured.add(row);
                } else if (done.isDone()) {
                    rows.drainTo(captured);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!done.isDone()) {
                notice("interrupted while capturing interval " + interval.number()
                        + ", producer abandoned after " + captured.size() + " rows");
            }
            throw new WorkerException(name + ": interrupted while capturing interval " + interval.number(), e);
        }

        Throwable failure = done.handle((ignored, error) -> error).join();
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private void notice(String message) {
        status.put(name + "-notice", clock.instant() + " " + message);
    }

    private static String describe(Interval interval) {
        return String.format("%d (%s to %s)", interval.number(), interval.startTime(), interval.stopTime());
    }
}
