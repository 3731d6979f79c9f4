package org.carball.plansampler.history;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.model.HistoryRow;
import org.carball.plansampler.model.StatementCounters;
import org.carball.plansampler.model.Watermark;
import org.carball.plansampler.session.DatabaseException;
import org.carball.plansampler.session.PlanCollectionException;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads sampled statements from {@code performance_schema.events_statements_history_long}.
 */
@Slf4j
public class PerformanceSchemaHistorySource implements HistorySource {

    private static final String MAX_TIMER_START =
            "SELECT MAX(timer_start) FROM performance_schema.events_statements_history_long";

    // Biased towards the statements with the highest wait times
    private static final String RECENT_STATEMENTS = """
        SELECT current_schema AS current_schema,
               sql_text AS sql_text,
               IFNULL(digest_text, sql_text) AS digest_text,
               timer_start AS timer_start,
               MAX(timer_wait) / 1000 AS max_timer_wait_ns,
               lock_time / 1000 AS lock_time_ns,
               rows_affected,
               rows_sent,
               rows_examined,
               select_full_join,
               select_full_range_join,
               select_range,
               select_range_check,
               select_scan,
               sort_merge_passes,
               sort_range,
               sort_rows,
               sort_scan,
               no_index_used,
               no_good_index_used
          FROM performance_schema.events_statements_history_long
         WHERE sql_text IS NOT NULL
           AND event_name LIKE ?
           AND digest_text NOT LIKE ?
           AND timer_start > ?
      GROUP BY digest
      ORDER BY timer_wait DESC
         LIMIT ?
    """;

    private static final String ENABLE_CONSUMER = """
        UPDATE performance_schema.setup_consumers SET enabled = 'YES'
         WHERE name = 'events_statements_history_long'
    """;

    private static final String DISABLE_SQL_NOTES = "SET @@SESSION.sql_notes = 0";

    private final Connection connection;

    public PerformanceSchemaHistorySource(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<Watermark> currentHighWatermark() {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(MAX_TIMER_START)) {
            if (!rs.next()) {
                return Optional.empty();
            }
            String value = rs.getString(1);
            return value == null ? Optional.empty() : Optional.of(Watermark.parse(value));
        } catch (SQLException e) {
            throw new PlanCollectionException("Unable to read the statement history high watermark", e);
        }
    }

    @Override
    public List<HistoryRow> fetchSince(Watermark watermark, int limit) {
        List<HistoryRow> rows = new ArrayList<>();
        try {
            try (PreparedStatement stmt = connection.prepareStatement(RECENT_STATEMENTS)) {
                stmt.setString(1, "statement/%");
                stmt.setString(2, "EXPLAIN %");
                stmt.setBigDecimal(3, watermark.toBigDecimal());
                stmt.setInt(4, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(mapRow(rs));
                    }
                }
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(DISABLE_SQL_NOTES);
            }
        } catch (SQLException e) {
            throw new PlanCollectionException("Unable to read events_statements_history_long", e);
        }
        log.debug("Fetched {} statements after watermark {}", rows.size(), watermark);
        return rows;
    }

    @Override
    public void enableHistoryConsumer() throws DatabaseException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate(ENABLE_CONSUMER);
        } catch (SQLException e) {
            throw DatabaseException.translate(e);
        }
    }

    static HistoryRow mapRow(ResultSet rs) throws SQLException {
        String timerStart = rs.getString("timer_start");
        return HistoryRow.builder()
                .schema(rs.getString("current_schema"))
                .sqlText(rs.getString("sql_text"))
                .digestText(rs.getString("digest_text"))
                .timerStart(timerStart == null ? null : Watermark.parse(timerStart))
                .durationNs(decimalAsLong(rs, "max_timer_wait_ns"))
                .counters(StatementCounters.builder()
                        .lockTimeNs(decimalAsLong(rs, "lock_time_ns"))
                        .rowsAffected(nullableLong(rs, "rows_affected"))
                        .rowsSent(nullableLong(rs, "rows_sent"))
                        .rowsExamined(nullableLong(rs, "rows_examined"))
                        .selectFullJoin(nullableLong(rs, "select_full_join"))
                        .selectFullRangeJoin(nullableLong(rs, "select_full_range_join"))
                        .selectRange(nullableLong(rs, "select_range"))
                        .selectRangeCheck(nullableLong(rs, "select_range_check"))
                        .selectScan(nullableLong(rs, "select_scan"))
                        .sortMergePasses(nullableLong(rs, "sort_merge_passes"))
                        .sortRange(nullableLong(rs, "sort_range"))
                        .sortRows(nullableLong(rs, "sort_rows"))
                        .sortScan(nullableLong(rs, "sort_scan"))
                        .noIndexUsed(nullableLong(rs, "no_index_used"))
                        .noGoodIndexUsed(nullableLong(rs, "no_good_index_used"))
                        .build())
                .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Long decimalAsLong(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value == null ? null : value.longValue();
    }
}
