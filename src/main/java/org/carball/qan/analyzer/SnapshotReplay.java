package org.carball.qan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.config.AnalyzerConfig;
import org.carball.qan.interval.IntervalSequencer;
import org.carball.qan.model.digest.DigestRow;
import org.carball.qan.model.profile.SystemProfile;
import org.carball.qan.model.report.Result;
import org.carball.qan.parser.SnapshotFileSource;
import org.carball.qan.worker.TextSource;
import org.carball.qan.worker.Worker;
import org.carball.qan.worker.WorkerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a directory of exported snapshots through the same sequencer, worker and driver an
 * online analyzer uses. Interval n ends {@code n * interval_seconds} after the start instant.
 */
@Slf4j
public class SnapshotReplay {

    private final AnalyzerConfig config;
    private final Instant start;
    private final WorkerFactory workerFactory;
    private Map<String, String> lastStatus = Map.of();

    public SnapshotReplay(AnalyzerConfig config, Instant start) {
        this.config = config.getUuid() == null ? config.toBuilder().uuid("replay").build() : config;
        this.start = start;
        this.workerFactory = new WorkerFactory(Clock.systemUTC());
    }

    /**
     * Processes every snapshot file in {@code directory} and returns the results in interval
     * order. Failed intervals produce no result and are counted in {@link #getLastStatus()}.
     */
    public List<Result> replay(Path directory) throws IOException {
        List<Result> results = new ArrayList<>();
        String name = "qan-worker-" + config.getUuid();

        switch (config.getSourceType()) {
            case PERF_SCHEMA: {
                Map<String, String> texts = new ConcurrentHashMap<>();
                try (SnapshotFileSource<DigestRow> source = new SnapshotFileSource<>(directory, DigestRow.class)) {
                    source.onRow(row -> {
                        if (row.digestText() != null) {
                            texts.put(row.digest(), row.digestText());
                        }
                    });
                    TextSource textSource = texts::get;
                    run(workerFactory.perfSchema(name, config, source, textSource), source.remaining(), results);
                }
                break;
            }
            case MONGO_PROFILER: {
                try (SnapshotFileSource<SystemProfile> source =
                             new SnapshotFileSource<>(directory, SystemProfile.class)) {
                    run(workerFactory.mongoProfiler(name, config, source), source.remaining(), results);
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported source type: " + config.getSourceType());
        }
        return results;
    }

    /**
     * Status of the driver after the last replay, including worker and sequencer keys.
     */
    public Map<String, String> getLastStatus() {
        return lastStatus;
    }

    private void run(Worker worker, int snapshots, List<Result> results) {
        IntervalAnalyzer analyzer = new IntervalAnalyzer(config, worker, (instance, result) -> results.add(result),
                Clock.systemUTC());
        IntervalSequencer sequencer = new IntervalSequencer("qan-replay-" + config.getUuid(),
                new ArrayBlockingQueue<>(1));
        Duration step = Duration.ofSeconds(config.getIntervalSeconds());

        log.info("Replaying {} snapshots as {} intervals of {}s", snapshots, config.getSourceType().getLabel(),
                config.getIntervalSeconds());
        for (int i = 1; i <= snapshots; i++) {
            analyzer.processInterval(sequencer.next(start.plus(step.multipliedBy(i))));
        }
        lastStatus = analyzer.status();
    }
}
