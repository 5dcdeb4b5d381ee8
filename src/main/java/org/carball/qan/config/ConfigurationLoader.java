package org.carball.qan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qan.worker.SourceType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> env;
    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> env) {
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AnalyzerConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return overlay(AnalyzerConfig.defaults(), args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > JSON file > defaults
     */
    public AnalyzerConfig loadConfiguration(Path configFile, String[] args) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        AnalyzerConfig fromFile = objectMapper.readValue(configFile.toFile(), AnalyzerConfig.class);
        log.debug("Read configuration file {}", configFile);
        return overlay(fromFile, args);
    }

    private AnalyzerConfig overlay(AnalyzerConfig base, String[] args) {
        AnalyzerConfig.AnalyzerConfigBuilder builder = base.toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AnalyzerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(AnalyzerConfig.AnalyzerConfigBuilder builder) {
        if (env.containsKey("QAN_UUID")) {
            builder.uuid(env.get("QAN_UUID"));
        }
        if (env.containsKey("QAN_SOURCE")) {
            builder.sourceType(SourceType.fromLabel(env.get("QAN_SOURCE")));
        }
        if (env.containsKey("QAN_INTERVAL_SECONDS")) {
            parseInt("QAN_INTERVAL_SECONDS", env.get("QAN_INTERVAL_SECONDS"), builder::intervalSeconds);
        }
        if (env.containsKey("QAN_EXAMPLE_QUERIES")) {
            builder.exampleQueries(Boolean.parseBoolean(env.get("QAN_EXAMPLE_QUERIES")));
        }
        if (env.containsKey("QAN_TEXT_CACHE_SIZE")) {
            parseInt("QAN_TEXT_CACHE_SIZE", env.get("QAN_TEXT_CACHE_SIZE"), builder::textCacheSize);
        }
        if (env.containsKey("QAN_ROW_QUEUE_CAPACITY")) {
            parseInt("QAN_ROW_QUEUE_CAPACITY", env.get("QAN_ROW_QUEUE_CAPACITY"), builder::rowQueueCapacity);
        }
        if (env.containsKey("QAN_KEY_FILTERS")) {
            builder.keyFilters(Arrays.stream(env.get("QAN_KEY_FILTERS").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(ArrayList::new)));
        }
    }

    private void applyCLIArguments(AnalyzerConfig.AnalyzerConfigBuilder builder, String[] args) {
        List<String> keyFilters = new ArrayList<>();

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--uuid":
                    builder.uuid(value);
                    break;
                case "--source":
                    builder.sourceType(SourceType.fromLabel(value));
                    break;
                case "--interval":
                    parseInt(arg, value, builder::intervalSeconds);
                    break;
                case "--example-queries":
                    builder.exampleQueries(Boolean.parseBoolean(value));
                    break;
                case "--text-cache-size":
                    parseInt(arg, value, builder::textCacheSize);
                    break;
                case "--row-queue-capacity":
                    parseInt(arg, value, builder::rowQueueCapacity);
                    break;
                case "--key-filter":
                    keyFilters.add(value);
                    break;
                default:
                    break;
            }
        }

        if (!keyFilters.isEmpty()) {
            builder.keyFilters(keyFilters);
        }
    }

    private static void parseInt(String source, String value, IntConsumer target) {
        try {
            target.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --uuid <id>                  Monitored instance id
              --source <perfschema|mongo>  Where query statistics come from
              --interval <seconds>         Sampling interval (default 60)
              --example-queries <bool>     Attach example queries to classes (default true)
              --key-filter <regex>         Field names to ignore in fingerprints, repeatable
              --text-cache-size <num>      Cached class texts (default 1000)
              --row-queue-capacity <num>   Rows buffered during capture (default 1000)

            Environment Variables:
              QAN_UUID, QAN_SOURCE, QAN_INTERVAL_SECONDS, QAN_EXAMPLE_QUERIES,
              QAN_KEY_FILTERS (comma separated), QAN_TEXT_CACHE_SIZE, QAN_ROW_QUEUE_CAPACITY

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
