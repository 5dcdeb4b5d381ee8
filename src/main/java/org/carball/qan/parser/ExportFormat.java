package org.carball.qan.parser;

import java.util.Arrays;

public enum ExportFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static ExportFormat fromString(String value) {
        return Arrays.stream(values())
                .filter(format -> format.extension.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)
                        || ("yml".equalsIgnoreCase(value) && format == YAML))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid format: " + value + ". Use json or yaml"));
    }
}
