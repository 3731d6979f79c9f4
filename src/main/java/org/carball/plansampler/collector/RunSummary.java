package org.carball.plansampler.collector;

import org.carball.plansampler.model.Watermark;

/**
 * Counts from one collection run.
 *
 * @param status    whether the run scanned the history
 * @param scanned   rows returned by the history source
 * @param incomplete rows dropped for missing columns
 * @param truncated rows dropped for truncated SQL text
 * @param explained statements that produced a plan and were emitted
 * @param watermark watermark after the run, null until established
 */
public record RunSummary(Status status, int scanned, int incomplete, int truncated, int explained,
                         Watermark watermark) {

    public enum Status {
        COMPLETED,
        DISABLED,
        NOT_READY
    }

    public static RunSummary disabled() {
        return new RunSummary(Status.DISABLED, 0, 0, 0, 0, null);
    }

    public static RunSummary notReady() {
        return new RunSummary(Status.NOT_READY, 0, 0, 0, 0, null);
    }
}
