package org.carball.qan.worker;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.config.AnalyzerConfig;
import org.carball.qan.fingerprint.Fingerprinter;
import org.carball.qan.model.digest.DigestRow;
import org.carball.qan.model.profile.SystemProfile;

import java.time.Clock;

/**
 * Builds the worker matching the source type of a monitored instance.
 */
@Slf4j
public class WorkerFactory {

    private final Clock clock;

    public WorkerFactory() {
        this(Clock.systemUTC());
    }

    public WorkerFactory(Clock clock) {
        this.clock = clock;
    }

    public SnapshotDiffWorker<DigestRow> perfSchema(String name, AnalyzerConfig config,
                                                    RowSource<DigestRow> rows, TextSource texts) {
        log.info("Creating {} worker {}", SourceType.PERF_SCHEMA.getLabel(), name);
        return new SnapshotDiffWorker<>(name, new DigestRowAdapter(), rows, texts,
                config.getRowQueueCapacity(), config.getTextCacheSize(), clock);
    }

    public SnapshotDiffWorker<SystemProfile> mongoProfiler(String name, AnalyzerConfig config,
                                                           RowSource<SystemProfile> rows) {
        log.info("Creating {} worker {} with key filters {}", SourceType.MONGO_PROFILER.getLabel(), name,
                config.getKeyFilters());
        Fingerprinter fingerprinter = new Fingerprinter(config.getKeyFilters());
        return new SnapshotDiffWorker<>(name, new ProfileRowAdapter(fingerprinter, config.isExampleQueries()),
                rows, TextSource.identity(), config.getRowQueueCapacity(), config.getTextCacheSize(), clock);
    }
}
