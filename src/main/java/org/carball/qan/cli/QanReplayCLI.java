package org.carball.qan.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.qan.analyzer.SnapshotReplay;
import org.carball.qan.config.AnalyzerConfig;
import org.carball.qan.config.ConfigurationLoader;
import org.carball.qan.model.report.QueryClass;
import org.carball.qan.model.report.Result;
import org.carball.qan.parser.ExportFormat;
import org.carball.qan.parser.ResultJsonExporter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
public class QanReplayCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║       Query Analytics Snapshot Replay v%s  ║
        ╚═══════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args) || getOption(args, "--dir") == null) {
            printUsage();
            System.exit(isHelpRequested(args) ? 0 : 1);
        }

        try {
            AnalyzerConfig config = loadConfig(args);
            Path directory = Paths.get(getOption(args, "--dir"));
            String output = getOption(args, "--output");
            ExportFormat format = ExportFormat.fromString(defaultIfNull(getOption(args, "--format"), "json"));

            System.out.println("\n🔍 Replaying snapshots...");
            System.out.println("   Directory: " + directory);
            System.out.println("   Source: " + config.getSourceType().getLabel()
                    + " (" + config.getSourceType().getDescription() + ")");
            System.out.println("   Interval: " + config.getIntervalSeconds() + "s");
            System.out.println();

            SnapshotReplay replay = new SnapshotReplay(config, Instant.EPOCH);
            List<Result> results = replay.replay(directory);

            ResultJsonExporter exporter = new ResultJsonExporter();
            if (output != null) {
                System.out.print("📝 Writing results... ");
                exporter.write(results, Paths.get(output), format);
                System.out.println("✓");
            } else {
                for (Result result : results) {
                    System.out.println(exporter.toJson(result));
                }
            }

            printSummary(results, replay.getLastStatus());
            System.out.println("\n✅ Replay complete!");

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        }
    }

    private static AnalyzerConfig loadConfig(String[] args) throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader();
        String configFile = getOption(args, "--config");
        if (configFile != null) {
            return loader.loadConfiguration(Paths.get(configFile), args);
        }
        return loader.loadConfiguration(args);
    }

    private static void printSummary(List<Result> results, Map<String, String> status) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 REPLAY SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("Results: " + results.size());

        for (Result result : results) {
            QueryClass global = result.getGlobal();
            System.out.printf("  Interval %d: %d classes, %,d queries%n",
                    result.getInterval().number(), result.getClasses().size(),
                    global == null ? 0 : global.getTotalQueries());
        }

        System.out.println();
        status.forEach((key, value) -> System.out.println("  " + key + ": " + value));
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h");
    }

    private static String getOption(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (name.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static String defaultIfNull(String value, String fallback) {
        return value == null ? fallback : value;
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar qan-agent.jar --source <perfschema|mongo> --dir <directory> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  --source            Kind of snapshots: perfschema|mongo (default: perfschema)");
        System.out.println("  --dir               Directory with iter*.json snapshot files");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output            File to write results to (default: print to stdout)");
        System.out.println("  --format            Output format: json|yaml (default: json)");
        System.out.println("  --config            JSON analyzer configuration file");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar qan-agent.jar --source perfschema --dir ./snapshots/");
        System.out.println("  java -jar qan-agent.jar --source mongo --dir ./profile/ --output results.yaml --format yaml");
    }
}
