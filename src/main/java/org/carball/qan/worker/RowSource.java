package org.carball.qan.worker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Streams the rows of one snapshot. Implementations start producing asynchronously and return
 * at once: zero or more rows go to {@code rows}, then {@code done} is completed exactly once,
 * normally on success or exceptionally on failure, after the last row was handed over.
 */
@FunctionalInterface
public interface RowSource<R> {

    /**
     * @param rows             bounded queue the consumer drains, {@code put} may block
     * @param lastFetchSeconds seconds since the previous successful fetch, 0 for the first
     * @param done             completion signal
     * @throws WorkerException if production could not even begin
     */
    void fetch(BlockingQueue<R> rows, double lastFetchSeconds, CompletableFuture<Void> done) throws WorkerException;
}
