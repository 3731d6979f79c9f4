package org.carball.plansampler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > defaults
     */
    public CollectorConfig loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");

        String configFile = extractConfigFile(args);
        CollectorConfig config = configFile != null ? loadFile(Path.of(configFile)) : new CollectorConfig();

        applyEnvironmentVariables(config);
        applyCLIArguments(config, args);

        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML configuration file.
     */
    public CollectorConfig loadFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Configuration file not found: " + path);
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        CollectorConfig config = yamlMapper.readValue(path.toFile(), CollectorConfig.class);
        log.info("Loaded configuration from: {}", path);
        return config != null ? config : new CollectorConfig();
    }

    private void applyEnvironmentVariables(CollectorConfig config) {
        if (environment.containsKey("PLAN_SAMPLER_JDBC_URL")) {
            config.setJdbcUrl(environment.get("PLAN_SAMPLER_JDBC_URL"));
        }
        if (environment.containsKey("PLAN_SAMPLER_USERNAME")) {
            config.setUsername(environment.get("PLAN_SAMPLER_USERNAME"));
        }
        if (environment.containsKey("PLAN_SAMPLER_PASSWORD")) {
            config.setPassword(environment.get("PLAN_SAMPLER_PASSWORD"));
        }
        if (environment.containsKey("PLAN_SAMPLER_DBM_ENABLED")) {
            config.setDbmEnabled(Boolean.parseBoolean(environment.get("PLAN_SAMPLER_DBM_ENABLED")));
        }
        if (environment.containsKey("PLAN_SAMPLER_COLLECT_EXECUTION_PLANS")) {
            config.setCollectExecutionPlans(
                    Boolean.parseBoolean(environment.get("PLAN_SAMPLER_COLLECT_EXECUTION_PLANS")));
        }
        if (environment.containsKey("PLAN_SAMPLER_QUERY_LIMIT")) {
            try {
                config.setQueryLimit(Integer.parseInt(environment.get("PLAN_SAMPLER_QUERY_LIMIT")));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for PLAN_SAMPLER_QUERY_LIMIT: {}",
                        environment.get("PLAN_SAMPLER_QUERY_LIMIT"));
            }
        }
    }

    private void applyCLIArguments(CollectorConfig config, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = i + 1 < args.length ? args[i + 1] : null;

            try {
                switch (arg) {
                    case "--jdbc-url":
                        config.setJdbcUrl(requireValue(arg, value));
                        i++;
                        break;
                    case "--user":
                    case "-u":
                        config.setUsername(requireValue(arg, value));
                        i++;
                        break;
                    case "--password":
                    case "-p":
                        config.setPassword(requireValue(arg, value));
                        i++;
                        break;
                    case "--output":
                    case "-o":
                        config.setOutputFile(requireValue(arg, value));
                        i++;
                        break;
                    case "--limit":
                        i++;
                        config.setQueryLimit(Integer.parseInt(requireValue(arg, value)));
                        break;
                    case "--interval":
                        i++;
                        config.setCollectionIntervalSeconds(Integer.parseInt(requireValue(arg, value)));
                        break;
                    case "--runs":
                        i++;
                        config.setMaxRuns(Integer.parseInt(requireValue(arg, value)));
                        break;
                    case "--tags":
                        config.setTags(new ArrayList<>(Arrays.asList(requireValue(arg, value).split("\\s*,\\s*"))));
                        i++;
                        break;
                    case "--auto-enable-history":
                        config.setAutoEnableEventsStatementsHistoryLong(true);
                        break;
                    case "--no-plans":
                        config.setCollectExecutionPlans(false);
                        break;
                    case "--config":
                    case "-c":
                        // Handled by extractConfigFile()
                        i++;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + arg);
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private static String requireValue(String arg, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value not specified for " + arg);
        }
        return value;
    }

    private static String extractConfigFile(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Options:
              --config, -c <file>        YAML configuration file
              --jdbc-url <url>           JDBC URL of the MySQL instance
              --user, -u <name>          Database user
              --password, -p <secret>    Database password
              --output, -o <file>        File receiving plan events (default: plan-events.jsonl)
              --limit <num>              Statements sampled per run (default: 500)
              --interval <seconds>       Seconds between runs (default: 10)
              --runs <num>               Stop after this many runs (default: 0, run until stopped)
              --tags <a:b,c:d>           Tags attached to every event
              --auto-enable-history      Enable events_statements_history_long when it is off
              --no-plans                 Disable execution plan collection

            Environment Variables:
              PLAN_SAMPLER_JDBC_URL                  Same as --jdbc-url
              PLAN_SAMPLER_USERNAME                  Same as --user
              PLAN_SAMPLER_PASSWORD                  Same as --password
              PLAN_SAMPLER_QUERY_LIMIT               Same as --limit
              PLAN_SAMPLER_DBM_ENABLED               Database monitoring switch (default: true)
              PLAN_SAMPLER_COLLECT_EXECUTION_PLANS   Plan collection switch (default: true)

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
