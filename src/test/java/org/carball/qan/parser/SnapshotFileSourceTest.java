package org.carball.qan.parser;

import org.carball.qan.model.digest.DigestRow;
import org.carball.qan.worker.WorkerException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotFileSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldServeFilesInNameOrder() throws Exception {
        // Given
        Files.writeString(tempDir.resolve("iter02.json"), "[" + row("b", 2) + "]");
        Files.writeString(tempDir.resolve("iter01.json"), "[" + row("a", 1) + ", " + row("c", 3) + "]");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        try (SnapshotFileSource<DigestRow> source = new SnapshotFileSource<>(tempDir, DigestRow.class)) {
            assertThat(source.remaining()).isEqualTo(2);

            // When
            List<DigestRow> first = fetch(source, 10);
            List<DigestRow> second = fetch(source, 10);

            // Then
            assertThat(first).extracting(DigestRow::digest).containsExactly("a", "c");
            assertThat(first.get(1).countStar()).isEqualTo(3);
            assertThat(second).extracting(DigestRow::digest).containsExactly("b");
            assertThat(source.remaining()).isZero();
            assertThatThrownBy(() -> fetch(source, 10))
                    .isInstanceOf(WorkerException.class)
                    .hasMessageContaining("No snapshot files left");
        }
    }

    @Test
    void shouldStreamMoreRowsThanQueueHolds() throws Exception {
        // Given
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 50; i++) {
            json.append(i == 0 ? "" : ",").append(row("d" + i, i));
        }
        Files.writeString(tempDir.resolve("iter01.json"), json.append("]").toString());
        List<String> seen = new ArrayList<>();

        try (SnapshotFileSource<DigestRow> source = new SnapshotFileSource<>(tempDir, DigestRow.class)) {
            source.onRow(r -> seen.add(r.digest()));

            // When
            List<DigestRow> rows = fetch(source, 3);

            // Then
            assertThat(rows).hasSize(50);
            assertThat(seen).hasSize(50).startsWith("d0", "d1");
        }
    }

    @Test
    void shouldSignalUnreadableFile() throws Exception {
        // Given
        Files.writeString(tempDir.resolve("iter01.json"), "{ not json");

        try (SnapshotFileSource<DigestRow> source = new SnapshotFileSource<>(tempDir, DigestRow.class)) {
            BlockingQueue<DigestRow> rows = new ArrayBlockingQueue<>(10);
            CompletableFuture<Void> done = new CompletableFuture<>();

            // When
            source.fetch(rows, 0, done);

            // Then
            assertThatThrownBy(() -> done.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .hasMessageContaining("iter01.json");
        }
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThatThrownBy(() -> new SnapshotFileSource<>(tempDir.resolve("missing"), DigestRow.class))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Snapshot directory not found");
    }

    private static List<DigestRow> fetch(SnapshotFileSource<DigestRow> source, int capacity) throws Exception {
        BlockingQueue<DigestRow> rows = new ArrayBlockingQueue<>(capacity);
        CompletableFuture<Void> done = new CompletableFuture<>();
        source.fetch(rows, 0, done);

        List<DigestRow> captured = new ArrayList<>();
        while (!done.isDone() || !rows.isEmpty()) {
            DigestRow row = rows.poll(100, TimeUnit.MILLISECONDS);
            if (row != null) {
                captured.add(row);
            }
        }
        done.get(5, TimeUnit.SECONDS);
        return captured;
    }

    private static String row(String digest, long count) {
        return "{\"SCHEMA_NAME\": \"test\", \"DIGEST\": \"" + digest + "\", \"COUNT_STAR\": " + count
                + ", \"SUM_TIMER_WAIT\": " + (count * 1000) + ", \"EXTRA_COLUMN\": 1}";
    }
}
