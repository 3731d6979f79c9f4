package org.carball.plansampler.model;

import lombok.Builder;
import lombok.Value;

/**
 * One sampled statement execution read from {@code events_statements_history_long}.
 */
@Value
@Builder(toBuilder = true)
public class HistoryRow {

    /** Suffix performance_schema appends when it cuts {@code SQL_TEXT}. */
    public static final String TRUNCATION_MARKER = "...";

    String schema;
    String sqlText;
    String digestText;
    Watermark timerStart;
    Long durationNs;
    StatementCounters counters;

    /**
     * Whether every required column is populated. The schema may legitimately be null.
     */
    public boolean isComplete() {
        return sqlText != null && !sqlText.isEmpty()
                && digestText != null
                && timerStart != null
                && durationNs != null
                && counters != null && counters.isComplete();
    }

    public boolean isTruncated() {
        return sqlText != null && sqlText.endsWith(TRUNCATION_MARKER);
    }
}
