package org.carball.plansampler.emit;

import org.carball.plansampler.model.PlanRecord;

import java.util.List;

/**
 * Destination of finished plan records.
 */
public interface PlanEventSink {

    void submit(List<PlanRecord> records, List<String> tags, String source);
}
