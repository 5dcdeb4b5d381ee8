package org.carball.qan.config;

import org.carball.qan.worker.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerConfigStoreTest {

    @TempDir
    Path tempDir;

    private AnalyzerConfigStore store;

    @BeforeEach
    void setUp() {
        store = new AnalyzerConfigStore(tempDir.resolve("config"));
    }

    @Test
    void shouldPersistConfigPerInstance() throws Exception {
        // Given
        AnalyzerConfig config = AnalyzerConfig.builder()
                .uuid("3130000000000000000000000000000b")
                .sourceType(SourceType.MONGO_PROFILER)
                .intervalSeconds(30)
                .keyFilters(List.of("^shardVersion$", "^lsid$"))
                .build();

        // When
        Path file = store.save(config);

        // Then
        assertThat(file.getFileName().toString()).isEqualTo("qan-3130000000000000000000000000000b.json");
        assertThat(Files.readString(file)).contains("\"source_type\" : \"mongo\"", "\"interval_seconds\" : 30");
        assertThat(store.load("3130000000000000000000000000000b")).contains(config);
    }

    @Test
    void shouldListAndRemoveStoredConfigs() throws Exception {
        // Given
        store.save(AnalyzerConfig.builder().uuid("b").build());
        store.save(AnalyzerConfig.builder().uuid("a").build());
        Files.writeString(tempDir.resolve("config").resolve("other.json"), "{}");

        // When/Then
        assertThat(store.list()).containsExactly("a", "b");

        assertThat(store.remove("a")).isTrue();
        assertThat(store.remove("a")).isFalse();
        assertThat(store.list()).containsExactly("b");
        assertThat(store.load("a")).isEmpty();
    }

    @Test
    void shouldListNothingBeforeFirstSave() throws Exception {
        assertThat(store.list()).isEmpty();
    }

    @Test
    void shouldRequireUuid() {
        assertThatThrownBy(() -> store.save(AnalyzerConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
