package org.carball.qan.worker;

import org.carball.qan.model.interval.Interval;
import org.carball.qan.model.report.Result;

import java.util.Map;
import java.util.Optional;

/**
 * One sampling cycle per interval, always called as {@code setup}, {@code run},
 * {@code cleanup} and never concurrently for the same instance.
 */
public interface Worker {

    /**
     * Starts capturing the snapshot for {@code interval}. On failure the interval is abandoned
     * and retained state is untouched.
     */
    void setup(Interval interval) throws WorkerException;

    /**
     * Waits for the capture and diffs it against the previous snapshot. Returns empty when the
     * two snapshots are not adjacent, which is expected on the first interval and after clock
     * or sequence glitches.
     */
    Optional<Result> run() throws WorkerException;

    /**
     * Releases whatever the capture held. Safe to call at any time and more than once.
     */
    void cleanup();

    /**
     * Operational status for health reporting. Does not block or change diff state.
     */
    Map<String, String> status();
}
