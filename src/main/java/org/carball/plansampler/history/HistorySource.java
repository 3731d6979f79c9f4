package org.carball.plansampler.history;

import org.carball.plansampler.model.HistoryRow;
import org.carball.plansampler.model.Watermark;
import org.carball.plansampler.session.DatabaseException;

import java.util.List;
import java.util.Optional;

/**
 * Table of recently executed statements.
 */
public interface HistorySource {

    /**
     * Highest {@code timer_start} currently in the table, empty when the table holds
     * no rows or its consumer is disabled.
     */
    Optional<Watermark> currentHighWatermark();

    /**
     * Statements started strictly after {@code watermark}, one row per digest,
     * most expensive first, excluding statements that are themselves explains.
     */
    List<HistoryRow> fetchSince(Watermark watermark, int limit);

    /**
     * Turns on the consumer that populates the table.
     */
    void enableHistoryConsumer() throws DatabaseException;
}
