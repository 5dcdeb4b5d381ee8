package org.carball.qan.analyzer;

import org.carball.qan.config.AnalyzerConfig;
import org.carball.qan.model.interval.Interval;
import org.carball.qan.model.report.Result;
import org.carball.qan.worker.Worker;
import org.carball.qan.worker.WorkerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalAnalyzerTest {

    private static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

    private AnalyzerConfig config;
    private StubWorker worker;
    private List<Result> sent;
    private IntervalAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        config = AnalyzerConfig.builder().uuid("db-1").intervalSeconds(1).build();
        worker = new StubWorker();
        sent = new CopyOnWriteArrayList<>();
        analyzer = new IntervalAnalyzer(config, worker, (instance, result) -> sent.add(result), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        analyzer.stop();
    }

    @Test
    void shouldSendResultOfCompletedInterval() {
        // When
        analyzer.processInterval(new Interval(1, null, T0));
        analyzer.processInterval(new Interval(2, T0, T0.plusSeconds(60)));

        // Then
        assertThat(sent).extracting(result -> result.getInterval().number()).containsExactly(2L);
        assertThat(worker.cleanups).isEqualTo(2);
        assertThat(analyzer.status())
                .containsEntry("qan-analyzer-db-1", "Stopped")
                .containsEntry("qan-analyzer-db-1-intervals", "2")
                .containsEntry("qan-analyzer-db-1-results", "1")
                .containsEntry("qan-analyzer-db-1-failures", "0")
                .containsEntry("stub-worker", "ok");
    }

    @Test
    void shouldCountFailedIntervalsAndCarryOn() {
        // Given
        worker.failSetup = true;

        // When
        analyzer.processInterval(new Interval(1, null, T0));
        worker.failSetup = false;
        analyzer.processInterval(new Interval(2, T0, T0.plusSeconds(60)));

        // Then
        assertThat(sent).hasSize(1);
        assertThat(worker.cleanups).isEqualTo(2);
        assertThat(analyzer.status())
                .containsEntry("qan-analyzer-db-1-failures", "1")
                .containsEntry("qan-analyzer-db-1-last-error", "cannot connect");
    }

    @Test
    void shouldCountSinkFailures() {
        // Given
        IntervalAnalyzer failing = new IntervalAnalyzer(config, worker, (instance, result) -> {
            throw new IOException("disk full");
        }, Clock.systemUTC());

        // When
        failing.processInterval(new Interval(2, T0, T0.plusSeconds(60)));

        // Then
        assertThat(failing.status()).containsEntry("qan-analyzer-db-1-failures", "1");
    }

    @Test
    void shouldProcessTicksWhileRunning() throws Exception {
        // When
        analyzer.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (sent.size() < 1 && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }

        // Then
        assertThat(analyzer.isRunning()).isTrue();
        assertThat(sent).isNotEmpty();
        assertThat(sent.get(0).getInterval().number()).isGreaterThanOrEqualTo(2);
        assertThat(analyzer.status())
                .containsEntry("qan-analyzer-db-1", "Running")
                .containsKey("db-1-sequencer-next-number");

        analyzer.stop();
        assertThat(analyzer.isRunning()).isFalse();
    }

    @Test
    void shouldNotCleanUpUnderWorkerThatIgnoresStop() throws Exception {
        // Given - a worker stuck in run until released
        BlockingWorker blocking = new BlockingWorker();
        IntervalAnalyzer stuck = new IntervalAnalyzer(config, blocking, (instance, result) -> sent.add(result),
                Clock.systemUTC());
        stuck.setStopTimeout(Duration.ofMillis(100));
        stuck.start();
        assertThat(blocking.entered.await(10, TimeUnit.SECONDS)).isTrue();

        // When
        stuck.stop();

        // Then
        assertThat(stuck.isRunning()).isFalse();
        assertThat(blocking.cleanups.get()).isZero();
        assertThat(blocking.cleanedUpDuringRun).isFalse();

        blocking.release.countDown();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (blocking.cleanups.get() < 1 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(blocking.cleanups.get()).isEqualTo(1);
        assertThat(blocking.cleanedUpDuringRun).isFalse();
    }

    private static class BlockingWorker implements Worker {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger cleanups = new AtomicInteger();
        volatile boolean inRun;
        volatile boolean cleanedUpDuringRun;

        @Override
        public void setup(Interval interval) {
        }

        @Override
        public Optional<Result> run() {
            inRun = true;
            entered.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            inRun = false;
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        }

        @Override
        public void cleanup() {
            if (inRun) {
                cleanedUpDuringRun = true;
            }
            cleanups.incrementAndGet();
        }

        @Override
        public Map<String, String> status() {
            return Map.of();
        }
    }

    private static class StubWorker implements Worker {
        volatile boolean failSetup;
        volatile int cleanups;
        private Interval interval;

        @Override
        public void setup(Interval interval) throws WorkerException {
            if (failSetup) {
                throw new WorkerException("cannot connect");
            }
            this.interval = interval;
        }

        @Override
        public Optional<Result> run() {
            if (interval.number() < 2) {
                return Optional.empty();
            }
            Result result = new Result();
            result.setInterval(interval);
            return Optional.of(result);
        }

        @Override
        public void cleanup() {
            interval = null;
            cleanups++;
        }

        @Override
        public Map<String, String> status() {
            return Map.of("stub-worker", "ok");
        }
    }
}
