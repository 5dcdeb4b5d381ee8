package org.carball.qan.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * Where a monitored instance keeps its query statistics.
 */
@Getter
public enum SourceType {
    PERF_SCHEMA("perfschema", "Statement digest summary table"),
    MONGO_PROFILER("mongo", "Database profiler collection");

    @JsonValue
    private final String label;
    private final String description;

    SourceType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    @JsonCreator
    public static SourceType fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown source type: " + label
                        + ". Available: " + Arrays.toString(Arrays.stream(values()).map(t -> t.label).toArray())));
    }
}
