package org.carball.plansampler.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.collector.ExecutionPlanCollector;
import org.carball.plansampler.collector.RunSummary;
import org.carball.plansampler.config.CollectorConfig;
import org.carball.plansampler.config.ConfigurationLoader;
import org.carball.plansampler.emit.JsonLinesPlanEventSink;
import org.carball.plansampler.history.PerformanceSchemaHistorySource;
import org.carball.plansampler.session.JdbcExplainSession;
import org.carball.plansampler.session.PlanCollectionException;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
public class PlanSamplerCLI {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.out.printf("MySQL Execution Plan Sampler v%s%n", VERSION);
        System.exit(execute(args, PlanSamplerCLI::openConnection));
    }

    /**
     * Opens the monitored database connection.
     */
    @FunctionalInterface
    interface ConnectionOpener {
        Connection open(CollectorConfig config) throws SQLException;
    }

    /**
     * Runs the sampler and returns the process exit code. Failures inside a
     * collection loop that are not database errors propagate.
     */
    static int execute(String[] args, ConnectionOpener opener) {
        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }

        CollectorConfig config;
        try {
            config = new ConfigurationLoader().loadConfiguration(args);
            config.requireConnectionSettings();
        } catch (IllegalArgumentException e) {
            System.err.println("\nConfiguration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\nIO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }

        try {
            run(config, opener);
            return 0;
        } catch (SQLException e) {
            System.err.println("\nUnable to connect: " + e.getMessage());
            log.debug("Connection error details", e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("\nInterrupted");
            return 1;
        }
    }

    private static Connection openConnection(CollectorConfig config) throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl(), config.getUsername(), config.getPassword());
    }

    private static void run(CollectorConfig config, ConnectionOpener opener)
            throws SQLException, InterruptedException {
        try (Connection connection = opener.open(config)) {
            ExecutionPlanCollector collector = new ExecutionPlanCollector(
                    config,
                    new PerformanceSchemaHistorySource(connection),
                    new JdbcExplainSession(connection),
                    new JsonLinesPlanEventSink(Paths.get(config.getOutputFile())));

            int runs = 0;
            while (config.getMaxRuns() == 0 || runs < config.getMaxRuns()) {
                runs++;
                try {
                    RunSummary summary = collector.collect(List.of());
                    log.info("Run {}: {} scanned, {} explained, {} truncated, {} incomplete, watermark {}",
                            runs, summary.scanned(), summary.explained(), summary.truncated(),
                            summary.incomplete(), summary.watermark());
                } catch (PlanCollectionException e) {
                    log.error("Collection run {} failed: {}", runs, e.getMessage(), e);
                }
                if (config.getMaxRuns() == 0 || runs < config.getMaxRuns()) {
                    TimeUnit.SECONDS.sleep(config.getCollectionIntervalSeconds());
                }
            }
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar mysql-plan-sampler.jar --jdbc-url <url> [options]");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar mysql-plan-sampler.jar --jdbc-url jdbc:mysql://localhost:3306/ -u datadog -p secret");
        System.out.println("  java -jar mysql-plan-sampler.jar --config collector.yml --runs 1");
    }
}
