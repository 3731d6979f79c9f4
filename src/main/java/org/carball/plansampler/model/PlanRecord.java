package org.carball.plansampler.model;

import lombok.Builder;
import lombok.Value;

/**
 * Execution plan of one sampled statement, enriched with its obfuscated text,
 * signatures and execution counters.
 */
@Value
@Builder
public class PlanRecord {
    long durationNs;
    String schema;
    String statement;
    String querySignature;
    String plan;
    double planCost;
    String planSignature;
    PlanDebug debug;
    StatementCounters counters;
}
