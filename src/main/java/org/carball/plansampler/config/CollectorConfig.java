package org.carball.plansampler.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectorConfig {

    public static final int DEFAULT_QUERY_LIMIT = 500;

    // Product-wide database monitoring switch
    @JsonProperty("dbm_enabled")
    private boolean dbmEnabled = true;

    @JsonProperty("collect_execution_plans")
    private boolean collectExecutionPlans = true;

    @JsonProperty("auto_enable_events_statements_history_long")
    private boolean autoEnableEventsStatementsHistoryLong = false;

    @JsonProperty("query_limit")
    private int queryLimit = DEFAULT_QUERY_LIMIT;

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    // Connection
    @JsonProperty("jdbc_url")
    private String jdbcUrl;

    @JsonProperty("username")
    private String username;

    @ToString.Exclude
    @JsonProperty("password")
    private String password;

    // Scheduling and output
    @JsonProperty("output_file")
    private String outputFile = "plan-events.jsonl";

    @JsonProperty("collection_interval_seconds")
    private int collectionIntervalSeconds = 10;

    @JsonProperty("max_runs")
    private int maxRuns = 0;

    @JsonIgnore
    public boolean isPlanCollectionEnabled() {
        return dbmEnabled && collectExecutionPlans;
    }

    /**
     * Corrects unusable values, logging a warning for each.
     */
    public void validate() {
        if (queryLimit <= 0) {
            log.warn("Query limit ({}) should be positive, using {}", queryLimit, DEFAULT_QUERY_LIMIT);
            queryLimit = DEFAULT_QUERY_LIMIT;
        }

        if (collectionIntervalSeconds <= 0) {
            log.warn("Collection interval ({}s) should be positive, using 10s", collectionIntervalSeconds);
            collectionIntervalSeconds = 10;
        }

        if (maxRuns < 0) {
            log.warn("Max runs ({}) should not be negative, running until stopped", maxRuns);
            maxRuns = 0;
        }

        if (tags == null) {
            tags = new ArrayList<>();
        }

        if (!isPlanCollectionEnabled()) {
            log.warn("Execution plan collection is disabled (dbm_enabled={}, collect_execution_plans={})",
                    dbmEnabled, collectExecutionPlans);
        }

        log.debug("Using collector configuration - Limit: {}, Interval: {}s, AutoEnable: {}",
                queryLimit, collectionIntervalSeconds, autoEnableEventsStatementsHistoryLong);
    }

    /**
     * Fails when the settings needed to connect are missing.
     */
    public void requireConnectionSettings() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException(
                    "JDBC URL required. Use --jdbc-url, set PLAN_SAMPLER_JDBC_URL or jdbc_url in the config file");
        }
    }

    public String getConfigurationSummary() {
        return String.format("Plans: %s | Auto-enable history: %s | Limit: %d | Interval: %ds | Tags: %s",
                isPlanCollectionEnabled() ? "on" : "off",
                autoEnableEventsStatementsHistoryLong ? "on" : "off",
                queryLimit, collectionIntervalSeconds, tags);
    }
}
