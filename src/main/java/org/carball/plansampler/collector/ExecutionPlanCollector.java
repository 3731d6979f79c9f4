package org.carball.plansampler.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.config.CollectorConfig;
import org.carball.plansampler.emit.LiteralSqlObfuscator;
import org.carball.plansampler.emit.PlanEventSink;
import org.carball.plansampler.emit.SqlObfuscator;
import org.carball.plansampler.explain.ExecutionPlanAcquirer;
import org.carball.plansampler.explain.SchemaMethodCache;
import org.carball.plansampler.history.CheckpointedHistoryScanner;
import org.carball.plansampler.history.HistoryConsumerEnabler;
import org.carball.plansampler.history.HistorySource;
import org.carball.plansampler.model.Watermark;
import org.carball.plansampler.session.ExplainSession;

import java.util.List;
import java.util.Optional;

/**
 * A collector instance. Owns the watermark and the per-schema explain cache, both
 * of which live as long as the instance. Runs must not overlap.
 */
@Slf4j
public class ExecutionPlanCollector {

    private final SchemaMethodCache schemaMethods;
    private final CheckpointedHistoryScanner scanner;
    private final CollectionRun collectionRun;

    public ExecutionPlanCollector(CollectorConfig config, HistorySource historySource,
                                  ExplainSession session, PlanEventSink sink) {
        this(config, historySource, session, new LiteralSqlObfuscator(), sink);
    }

    public ExecutionPlanCollector(CollectorConfig config, HistorySource historySource,
                                  ExplainSession session, SqlObfuscator obfuscator, PlanEventSink sink) {
        this.schemaMethods = new SchemaMethodCache();
        HistoryConsumerEnabler enabler =
                new HistoryConsumerEnabler(historySource, config.isAutoEnableEventsStatementsHistoryLong());
        this.scanner = new CheckpointedHistoryScanner(historySource, enabler);
        ExecutionPlanAcquirer acquirer = new ExecutionPlanAcquirer(schemaMethods);
        this.collectionRun = new CollectionRun(config, scanner, acquirer, session, obfuscator, sink);

        log.info("Initialized ExecutionPlanCollector with config: {}", config);
    }

    public RunSummary collect(List<String> tags) {
        RunSummary summary = collectionRun.execute(tags);
        log.debug("Collection run finished: {}", summary);
        return summary;
    }

    public Optional<Watermark> getWatermark() {
        return scanner.getWatermark();
    }

    public SchemaMethodCache getSchemaMethods() {
        return schemaMethods;
    }
}
