package org.carball.qan.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.qan.fingerprint.Fingerprinter;
import org.carball.qan.worker.SnapshotDiffWorker;
import org.carball.qan.worker.SourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration of the analyzer of one monitored instance. Persisted as JSON.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzerConfig {

    private String uuid;

    @Builder.Default
    private SourceType sourceType = SourceType.PERF_SCHEMA;

    @Builder.Default
    private int intervalSeconds = 60;

    @Builder.Default
    private boolean exampleQueries = true;

    @Builder.Default
    private List<String> keyFilters = new ArrayList<>(Fingerprinter.DEFAULT_KEY_FILTERS);

    @Builder.Default
    private int textCacheSize = SnapshotDiffWorker.DEFAULT_TEXT_CACHE_SIZE;

    @Builder.Default
    private int rowQueueCapacity = SnapshotDiffWorker.DEFAULT_ROW_QUEUE_CAPACITY;

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }

    /**
     * Rejects values the analyzer cannot run with and warns about questionable ones.
     */
    public void validate() {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("interval_seconds must be positive, got " + intervalSeconds);
        }
        if (rowQueueCapacity <= 0) {
            throw new IllegalArgumentException("row_queue_capacity must be positive, got " + rowQueueCapacity);
        }
        if (textCacheSize < 0) {
            throw new IllegalArgumentException("text_cache_size must not be negative, got " + textCacheSize);
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("source_type is required");
        }
        for (String filter : keyFilters == null ? List.<String>of() : keyFilters) {
            try {
                Pattern.compile(filter);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid key filter '" + filter + "': " + e.getDescription(), e);
            }
        }

        if (intervalSeconds < 10) {
            log.warn("Interval of {}s is very short, counters may barely move between snapshots", intervalSeconds);
        }
        if (intervalSeconds > 3600) {
            log.warn("Interval of {}s is longer than an hour, reports will be coarse", intervalSeconds);
        }
        if (textCacheSize == 0) {
            log.warn("Text cache disabled, every class will look up its text again each interval");
        }
        if (uuid == null || uuid.isBlank()) {
            log.warn("No instance uuid configured");
        }

        log.debug("Using config - Source: {}, Interval: {}s, Examples: {}, Filters: {}",
                sourceType, intervalSeconds, exampleQueries, keyFilters);
    }

    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format("uuid=%s, source=%s, interval=%ds, examples=%s, keyFilters=%s, textCache=%d, queue=%d",
                uuid, sourceType == null ? null : sourceType.getLabel(), intervalSeconds, exampleQueries,
                keyFilters, textCacheSize, rowQueueCapacity);
    }
}
