package org.carball.plansampler.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.config.CollectorConfig;
import org.carball.plansampler.emit.PlanEventSink;
import org.carball.plansampler.emit.Signatures;
import org.carball.plansampler.emit.SqlObfuscator;
import org.carball.plansampler.explain.ExecutionPlanAcquirer;
import org.carball.plansampler.explain.PlanCostExtractor;
import org.carball.plansampler.history.CheckpointedHistoryScanner;
import org.carball.plansampler.history.ScanResult;
import org.carball.plansampler.model.HistoryRow;
import org.carball.plansampler.model.PlanDebug;
import org.carball.plansampler.model.PlanRecord;
import org.carball.plansampler.session.ExplainSession;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One pass over the statement history: explains the new statements and submits
 * the resulting plan records as a single batch.
 */
@Slf4j
public class CollectionRun {

    public static final String SOURCE = "mysql";

    private final CollectorConfig config;
    private final CheckpointedHistoryScanner scanner;
    private final ExecutionPlanAcquirer acquirer;
    private final ExplainSession session;
    private final SqlObfuscator obfuscator;
    private final PlanEventSink sink;

    public CollectionRun(CollectorConfig config,
                         CheckpointedHistoryScanner scanner,
                         ExecutionPlanAcquirer acquirer,
                         ExplainSession session,
                         SqlObfuscator obfuscator,
                         PlanEventSink sink) {
        this.config = config;
        this.scanner = scanner;
        this.acquirer = acquirer;
        this.session = session;
        this.obfuscator = obfuscator;
        this.sink = sink;
    }

    public RunSummary execute(List<String> runTags) {
        if (!config.isPlanCollectionEnabled()) {
            return RunSummary.disabled();
        }

        ScanResult scan = scanner.scan(config.getQueryLimit());
        if (!scan.ready()) {
            return RunSummary.notReady();
        }

        List<PlanRecord> records = new ArrayList<>();
        for (HistoryRow row : scan.rows()) {
            Optional<String> plan = acquirer.acquire(session, row.getSqlText(), row.getSchema());
            plan.ifPresent(p -> records.add(buildRecord(row, p)));
        }

        sink.submit(records, mergeTags(runTags), SOURCE);

        if (scan.truncated() > 0) {
            log.warn("Unable to collect {}/{} execution plans due to truncated SQL text. Consider raising "
                            + "`performance_schema_max_sql_text_length` to capture these queries.",
                    scan.truncated(), scan.truncated() + records.size());
        }

        return new RunSummary(RunSummary.Status.COMPLETED, scan.fetched(), scan.incomplete(),
                scan.truncated(), records.size(), scan.watermark());
    }

    private PlanRecord buildRecord(HistoryRow row, String plan) {
        String obfuscatedStatement = obfuscator.obfuscateSql(row.getSqlText());
        String normalizedPlan = obfuscator.obfuscatePlan(plan, true);
        return PlanRecord.builder()
                .durationNs(row.getDurationNs())
                .schema(row.getSchema())
                .statement(obfuscatedStatement)
                .querySignature(Signatures.compute(obfuscatedStatement))
                .plan(plan)
                .planCost(PlanCostExtractor.cost(plan))
                .planSignature(Signatures.compute(normalizedPlan))
                .debug(new PlanDebug(normalizedPlan, obfuscator.obfuscatePlan(plan, false), row.getDigestText()))
                .counters(row.getCounters())
                .build();
    }

    private List<String> mergeTags(List<String> runTags) {
        Set<String> tags = new LinkedHashSet<>(config.getTags());
        if (runTags != null) {
            tags.addAll(runTags);
        }
        return new ArrayList<>(tags);
    }
}
