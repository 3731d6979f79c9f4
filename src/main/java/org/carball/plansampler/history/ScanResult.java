package org.carball.plansampler.history;

import org.carball.plansampler.model.HistoryRow;
import org.carball.plansampler.model.Watermark;

import java.util.List;

/**
 * Outcome of one scan of the statement history.
 *
 * @param ready      false when no watermark could be established yet
 * @param rows       complete, untruncated rows eligible for explain
 * @param watermark  watermark after the scan, null while not ready
 * @param fetched    rows returned by the source
 * @param incomplete rows dropped for missing columns
 * @param truncated  rows dropped because their SQL text was cut
 */
public record ScanResult(boolean ready, List<HistoryRow> rows, Watermark watermark,
                         int fetched, int incomplete, int truncated) {

    public static ScanResult notReady() {
        return new ScanResult(false, List.of(), null, 0, 0, 0);
    }
}
