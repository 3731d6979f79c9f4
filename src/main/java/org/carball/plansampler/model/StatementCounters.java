package org.carball.plansampler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.stream.Stream;

/**
 * Optimizer and execution counters recorded for a sampled statement.
 */
@Value
@Builder(toBuilder = true)
public class StatementCounters {

    @JsonProperty("lock_time")
    Long lockTimeNs;

    @JsonProperty("rows_affected")
    Long rowsAffected;

    @JsonProperty("rows_sent")
    Long rowsSent;

    @JsonProperty("rows_examined")
    Long rowsExamined;

    @JsonProperty("select_full_join")
    Long selectFullJoin;

    @JsonProperty("select_full_range_join")
    Long selectFullRangeJoin;

    @JsonProperty("select_range")
    Long selectRange;

    @JsonProperty("select_range_check")
    Long selectRangeCheck;

    @JsonProperty("select_scan")
    Long selectScan;

    @JsonProperty("sort_merge_passes")
    Long sortMergePasses;

    @JsonProperty("sort_range")
    Long sortRange;

    @JsonProperty("sort_rows")
    Long sortRows;

    @JsonProperty("sort_scan")
    Long sortScan;

    @JsonProperty("no_index_used")
    Long noIndexUsed;

    @JsonProperty("no_good_index_used")
    Long noGoodIndexUsed;

    @JsonIgnore
    public boolean isComplete() {
        return Stream.of(lockTimeNs, rowsAffected, rowsSent, rowsExamined,
                        selectFullJoin, selectFullRangeJoin, selectRange, selectRangeCheck, selectScan,
                        sortMergePasses, sortRange, sortRows, sortScan,
                        noIndexUsed, noGoodIndexUsed)
                .allMatch(value -> value != null);
    }

    /**
     * All counters set to zero, mostly useful for fixtures.
     */
    public static StatementCounters zero() {
        return StatementCounters.builder()
                .lockTimeNs(0L).rowsAffected(0L).rowsSent(0L).rowsExamined(0L)
                .selectFullJoin(0L).selectFullRangeJoin(0L).selectRange(0L).selectRangeCheck(0L).selectScan(0L)
                .sortMergePasses(0L).sortRange(0L).sortRows(0L).sortScan(0L)
                .noIndexUsed(0L).noGoodIndexUsed(0L)
                .build();
    }
}
