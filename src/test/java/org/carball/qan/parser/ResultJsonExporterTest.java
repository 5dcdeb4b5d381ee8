package org.carball.qan.parser;

import org.carball.qan.analyzer.MetricsAccumulator;
import org.carball.qan.model.interval.Interval;
import org.carball.qan.model.report.QueryClass;
import org.carball.qan.model.report.Result;
import org.carball.qan.model.report.RowMetrics;
import org.carball.qan.model.report.TimeStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultJsonExporterTest {

    @TempDir
    Path tempDir;

    private ResultJsonExporter exporter;
    private Result result;

    @BeforeEach
    void setUp() {
        exporter = new ResultJsonExporter();

        QueryClass queryClass = new QueryClass("fbe070dfb47e4a2401c5be6b5201254e");
        queryClass.setFingerprint("SELECT ? FROM DUAL");
        MetricsAccumulator.fold(queryClass, new RowMetrics(2)
                .timing("Query_time", TimeStats.of(0.5, 2, 0.125, 0.375))
                .counter("Rows_sent", 2));
        QueryClass global = new QueryClass();
        MetricsAccumulator.merge(global, queryClass);

        result = new Result();
        result.setInterval(new Interval(2,
                Instant.parse("2026-10-19T10:00:00Z"), Instant.parse("2026-10-19T10:01:00Z")));
        result.setGlobal(global);
        result.setClasses(List.of(queryClass));
        result.setRunTimeMillis(12);
    }

    @Test
    void shouldRoundTripResultThroughJson() throws Exception {
        String json = exporter.toJson(result);

        assertThat(exporter.fromJson(json)).isEqualTo(result);
    }

    @Test
    void shouldWriteReadableJson() throws Exception {
        String json = exporter.toJson(result);

        assertThat(json)
                .contains("\"start_time\" : \"2026-10-19T10:00:00Z\"")
                .contains("\"total_queries\" : 2")
                .contains("\"avg\" : 0.25")
                .contains("\"run_time_ms\" : 12")
                .doesNotContain("\"example\"");
    }

    @Test
    void shouldWriteAndReadFiles() throws Exception {
        Path jsonFile = tempDir.resolve("out/results.json");
        Path yamlFile = tempDir.resolve("results.yaml");

        exporter.write(List.of(result), jsonFile, ExportFormat.JSON);
        exporter.write(List.of(result), yamlFile, ExportFormat.YAML);

        assertThat(exporter.read(jsonFile, ExportFormat.JSON)).containsExactly(result);
        assertThat(exporter.read(yamlFile, ExportFormat.YAML)).containsExactly(result);
        assertThat(Files.readString(yamlFile)).contains("total_queries: 2");
    }

    @Test
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> exporter.read(tempDir.resolve("missing.json"), ExportFormat.JSON))
                .hasMessageContaining("Result file not found");
    }

    @Test
    void shouldParseFormats() {
        assertThat(ExportFormat.fromString("json")).isEqualTo(ExportFormat.JSON);
        assertThat(ExportFormat.fromString("YML")).isEqualTo(ExportFormat.YAML);
        assertThatThrownBy(() -> ExportFormat.fromString("xml"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
