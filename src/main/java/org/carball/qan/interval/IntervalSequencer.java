package org.carball.qan.interval;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.model.interval.Interval;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Turns clock ticks into numbered intervals. The n-th tick yields interval n, starting where
 * interval n-1 stopped.
 *
 * <p>Ticks are consumed from a queue on a single thread and every tick is handed over as its
 * own interval through a queue of capacity one. The sequencer waits for the consumer to take
 * an interval before it reads the next tick, so ticks arriving faster than intervals are
 * processed queue up in the tick queue and are never merged.
 *
 * <p>Ticks are not corrected: a tick that is not after the previous one is logged and still
 * emitted. Deciding whether two intervals can be compared is left to the worker.
 */
@Slf4j
public class IntervalSequencer {

    private final String name;
    private final BlockingQueue<Instant> ticks;
    private final BlockingQueue<Interval> intervals = new ArrayBlockingQueue<>(1);

    private ExecutorService executor;
    private Instant lastStopTime;
    private long nextNumber = 1;

    public IntervalSequencer(BlockingQueue<Instant> ticks) {
        this("interval-sequencer", ticks);
    }

    public IntervalSequencer(String name, BlockingQueue<Instant> ticks) {
        this.name = name;
        this.ticks = ticks;
    }

    /**
     * Emits the interval ending at {@code tick}.
     */
    public synchronized Interval next(Instant tick) {
        if (lastStopTime != null && !tick.isAfter(lastStopTime)) {
            log.warn("{}: tick {} is not after the previous tick {}", name, tick, lastStopTime);
        }
        Interval interval = new Interval(nextNumber, lastStopTime, tick);
        lastStopTime = tick;
        nextNumber++;
        return interval;
    }

    public BlockingQueue<Interval> intervals() {
        return intervals;
    }

    public synchronized void start() {
        if (executor != null) {
            log.warn("{} already running", name);
            return;
        }
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::loop);
        log.info("Started {}", name);
    }

    public void stop() {
        ExecutorService running;
        synchronized (this) {
            running = executor;
            executor = null;
        }
        if (running == null) {
            return;
        }
        running.shutdownNow();
        try {
            if (!running.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} did not stop within 5s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping {}", name);
        }
        log.info("Stopped {}", name);
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public synchronized Map<String, String> status() {
        Map<String, String> status = new TreeMap<>();
        status.put(name + "-next-number", String.valueOf(nextNumber));
        status.put(name + "-last-tick", lastStopTime == null ? "" : lastStopTime.toString());
        return status;
    }

    private void loop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Instant tick = ticks.take();
                intervals.put(next(tick));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} interrupted", name);
        }
    }
}
