package org.carball.qan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.config.AnalyzerConfig;
import org.carball.qan.interval.IntervalSequencer;
import org.carball.qan.model.interval.Interval;
import org.carball.qan.model.report.Result;
import org.carball.qan.worker.Worker;
import org.carball.qan.worker.WorkerException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one monitored instance: ticks a sequencer every {@code interval_seconds} and runs the
 * worker once per interval on its own thread. Instances share nothing, each has its own
 * sequencer, worker and threads.
 */
@Slf4j
public class IntervalAnalyzer {

    private static final int TICK_BACKLOG = 10;

    private final String instance;
    private final AnalyzerConfig config;
    private final Worker worker;
    private final ResultSink sink;
    private final Clock clock;
    private final BlockingQueue<Instant> ticks = new ArrayBlockingQueue<>(TICK_BACKLOG);
    private final IntervalSequencer sequencer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong intervalsProcessed = new AtomicLong();
    private final AtomicLong resultsSent = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile String lastError;
    private Duration stopTimeout = Duration.ofSeconds(5);

    private ScheduledExecutorService ticker;
    private ScheduledFuture<?> tickTask;
    private ExecutorService runner;

    public IntervalAnalyzer(AnalyzerConfig config, Worker worker, ResultSink sink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.instance = Objects.requireNonNull(config.getUuid(), "config.uuid");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sequencer = new IntervalSequencer(instance + "-sequencer", ticks);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Analyzer already running: instance={}", instance);
            return;
        }

        sequencer.start();
        runner = Executors.newSingleThreadExecutor(r -> new Thread(r, instance + "-worker"));
        runner.submit(this::consumeIntervals);

        ticker = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, instance + "-ticker"));
        tickTask = ticker.scheduleAtFixedRate(this::tick, 0, config.getIntervalSeconds(), TimeUnit.SECONDS);
        log.info("Started analyzer: instance={}, source={}, interval_sec={}",
                instance, config.getSourceType(), config.getIntervalSeconds());
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        if (tickTask != null) {
            tickTask.cancel(false);
        }
        ticker.shutdownNow();
        sequencer.stop();
        runner.shutdownNow();
        boolean terminated = false;
        try {
            terminated = runner.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for worker to stop: instance={}", instance);
        }
        if (terminated) {
            worker.cleanup();
        } else {
            // the worker thread still owns the cycle and cleans up when its interval ends
            log.warn("Worker thread did not stop within {}ms, leaving its interval to finish: instance={}",
                    stopTimeout.toMillis(), instance);
        }
        log.info("Stopped analyzer: instance={}", instance);
    }

    void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one full worker cycle. Failures are logged and counted; the next interval retries.
     */
    public void processInterval(Interval interval) {
        intervalsProcessed.incrementAndGet();
        try {
            worker.setup(interval);
            Optional<Result> result = worker.run();
            if (result.isPresent()) {
                sink.accept(instance, result.get());
                resultsSent.incrementAndGet();
            }
        } catch (WorkerException | IOException | RuntimeException e) {
            failures.incrementAndGet();
            lastError = e.getMessage();
            log.error("Interval {} failed: instance={}", interval.number(), instance, e);
        } finally {
            worker.cleanup();
        }
    }

    /**
     * Flattened status of the analyzer, its sequencer and its worker.
     */
    public Map<String, String> status() {
        Map<String, String> status = new TreeMap<>();
        String prefix = "qan-analyzer-" + instance;
        status.put(prefix, running.get() ? "Running" : "Stopped");
        status.put(prefix + "-intervals", String.valueOf(intervalsProcessed.get()));
        status.put(prefix + "-results", String.valueOf(resultsSent.get()));
        status.put(prefix + "-failures", String.valueOf(failures.get()));
        if (lastError != null) {
            status.put(prefix + "-last-error", lastError);
        }
        status.putAll(sequencer.status());
        status.putAll(worker.status());
        return status;
    }

    private void tick() {
        Instant now = clock.instant();
        if (!ticks.offer(now)) {
            log.warn("Dropping tick {}: {} ticks already waiting, instance={}", now, TICK_BACKLOG, instance);
        }
    }

    private void consumeIntervals() {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                Interval interval = sequencer.intervals().take();
                processInterval(interval);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
