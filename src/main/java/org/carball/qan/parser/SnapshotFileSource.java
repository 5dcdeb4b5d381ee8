package org.carball.qan.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qan.worker.RowSource;
import org.carball.qan.worker.WorkerException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Replays snapshots exported to a directory. Each file named {@code iter*.json} holds a JSON
 * array of rows; every fetch serves the next file in name order. Rows are put on the queue
 * from a background thread, so a small queue only slows the producer down.
 */
@Slf4j
public class SnapshotFileSource<R> implements RowSource<R>, AutoCloseable {

    private static final String PREFIX = "iter";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final JavaType listType;
    private final ObjectMapper objectMapper;
    private final Deque<Path> pending;
    private final ExecutorService executor;
    private Consumer<R> listener = row -> { };

    public SnapshotFileSource(Path directory, Class<R> rowType) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Snapshot directory not found: " + directory);
        }
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, rowType);
        this.pending = new ArrayDeque<>(snapshotFiles(directory));
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "snapshot-file-source");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Found {} snapshot files in {}", pending.size(), directory);
    }

    /**
     * Registers a callback seeing every row as it is read, before it is queued.
     */
    public SnapshotFileSource<R> onRow(Consumer<R> listener) {
        this.listener = listener;
        return this;
    }

    @Override
    public synchronized void fetch(BlockingQueue<R> rows, double lastFetchSeconds, CompletableFuture<Void> done)
            throws WorkerException {
        Path file = pending.poll();
        if (file == null) {
            throw new WorkerException("No snapshot files left in " + directory);
        }
        log.debug("Serving {} ({}s since last fetch)", file.getFileName(), lastFetchSeconds);
        try {
            executor.execute(() -> stream(file, rows, done));
        } catch (RejectedExecutionException e) {
            throw new WorkerException("Snapshot source for " + directory + " is closed", e);
        }
    }

    public synchronized int remaining() {
        return pending.size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private void stream(Path file, BlockingQueue<R> rows, CompletableFuture<Void> done) {
        try {
            List<R> snapshot = objectMapper.readValue(file.toFile(), listType);
            for (R row : snapshot) {
                listener.accept(row);
                rows.put(row);
            }
            done.complete(null);
        } catch (IOException e) {
            done.completeExceptionally(new IOException("Cannot read snapshot " + file + ": " + e.getMessage(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done.completeExceptionally(e);
        } catch (RuntimeException e) {
            done.completeExceptionally(e);
        }
    }

    static List<Path> snapshotFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(PREFIX) && name.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
