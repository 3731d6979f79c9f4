package org.carball.plansampler.history;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.model.HistoryRow;
import org.carball.plansampler.model.Watermark;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the statement history incrementally. The watermark starts at the source's
 * high watermark and afterwards only moves forward, so a statement is never
 * returned twice.
 */
@Slf4j
public class CheckpointedHistoryScanner {

    public static final int DEFAULT_LIMIT = 500;

    private final HistorySource source;
    private final HistoryConsumerEnabler consumerEnabler;
    private Watermark watermark;

    public CheckpointedHistoryScanner(HistorySource source, HistoryConsumerEnabler consumerEnabler) {
        this.source = source;
        this.consumerEnabler = consumerEnabler;
    }

    public Optional<Watermark> getWatermark() {
        return Optional.ofNullable(watermark);
    }

    /**
     * Sets the watermark from the source when it is not yet known.
     *
     * @return whether a watermark is now set
     */
    public boolean establishCheckpoint() {
        if (watermark != null) {
            return true;
        }
        Optional<Watermark> high = source.currentHighWatermark();
        if (high.isEmpty()) {
            log.debug("Unable to fetch from performance_schema.events_statements_history_long");
            if (consumerEnabler != null) {
                consumerEnabler.tryEnable();
            }
            return false;
        }
        watermark = high.get();
        log.debug("Statement history watermark established at {}", watermark);
        return true;
    }

    public ScanResult scan() {
        return scan(DEFAULT_LIMIT);
    }

    public ScanResult scan(int limit) {
        if (!establishCheckpoint()) {
            return ScanResult.notReady();
        }

        Watermark previous = watermark;
        List<HistoryRow> fetched = source.fetchSince(previous, limit);
        List<HistoryRow> eligible = new ArrayList<>();
        Watermark next = previous;
        int incomplete = 0;
        int truncated = 0;

        for (HistoryRow row : fetched) {
            if (row == null) {
                incomplete++;
                continue;
            }
            // advance past every row, usable or not, so a bad row cannot stall the scan
            if (row.getTimerStart() != null) {
                next = row.getTimerStart().max(next);
            }
            if (row.getTimerStart() != null && !row.getTimerStart().isAfter(previous)) {
                continue;
            }
            if (!row.isComplete()) {
                log.debug("Row was unexpectedly truncated or events_statements_history_long table is not enabled");
                incomplete++;
                continue;
            }
            // performance_schema keeps 1024 chars of SQL_TEXT by default, plans cannot be taken from cut text
            if (row.isTruncated()) {
                truncated++;
                continue;
            }
            eligible.add(row);
        }

        watermark = next;
        return new ScanResult(true, eligible, watermark, fetched.size(), incomplete, truncated);
    }
}
