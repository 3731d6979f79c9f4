package org.carball.plansampler.collector;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.plansampler.config.CollectorConfig;
import org.carball.plansampler.emit.LiteralSqlObfuscator;
import org.carball.plansampler.emit.Signatures;
import org.carball.plansampler.explain.DirectExplainStrategy;
import org.carball.plansampler.explain.ExecutionPlanAcquirer;
import org.carball.plansampler.explain.SchemaMethodCache;
import org.carball.plansampler.history.CheckpointedHistoryScanner;
import org.carball.plansampler.history.HistoryConsumerEnabler;
import org.carball.plansampler.model.PlanRecord;
import org.carball.plansampler.model.Watermark;
import org.carball.plansampler.session.MySqlErrorCodes;
import org.carball.plansampler.session.PlanCollectionException;
import org.carball.plansampler.support.FakeExplainSession;
import org.carball.plansampler.support.FakeHistorySource;
import org.carball.plansampler.support.RecordingPlanEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.plansampler.support.HistoryRows.row;

class CollectionRunTest {

    private CollectorConfig config;
    private FakeHistorySource source;
    private FakeExplainSession session;
    private RecordingPlanEventSink sink;
    private SchemaMethodCache cache;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        config = new CollectorConfig();
        config.setTags(List.of("env:test"));
        source = new FakeHistorySource().withHighWatermark(1_000);
        session = new FakeExplainSession();
        sink = new RecordingPlanEventSink();
        cache = new SchemaMethodCache();

        logger = (Logger) LoggerFactory.getLogger(CollectionRun.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    private CollectionRun newRun() {
        CheckpointedHistoryScanner scanner = new CheckpointedHistoryScanner(source,
                new HistoryConsumerEnabler(source, config.isAutoEnableEventsStatementsHistoryLong()));
        return new CollectionRun(config, scanner, new ExecutionPlanAcquirer(cache), session,
                new LiteralSqlObfuscator(), sink);
    }

    @Test
    void shouldDoNothingWhenPlansAreDisabled() {
        config.setCollectExecutionPlans(false);

        RunSummary summary = newRun().execute(List.of());

        assertThat(summary.status()).isEqualTo(RunSummary.Status.DISABLED);
        assertThat(source.getHighWatermarkCalls()).isZero();
        assertThat(session.getCalls()).isEmpty();
        assertThat(sink.getBatches()).isEmpty();
    }

    @Test
    void shouldDoNothingWhenDatabaseMonitoringIsDisabled() {
        config.setDbmEnabled(false);

        assertThat(newRun().execute(List.of()).status()).isEqualTo(RunSummary.Status.DISABLED);
        assertThat(source.getHighWatermarkCalls()).isZero();
    }

    @Test
    void shouldStopWithoutEmittingWhenCheckpointUnavailable() {
        source.withoutHighWatermark();
        config.setAutoEnableEventsStatementsHistoryLong(true);

        RunSummary summary = newRun().execute(List.of());

        assertThat(summary.status()).isEqualTo(RunSummary.Status.NOT_READY);
        assertThat(source.getEnableCalls()).isEqualTo(1);
        assertThat(sink.getBatches()).isEmpty();
    }

    @Test
    void shouldEmitPlanFromDirectExplainWhenProcedureIsMissing() {
        String sql = "SELECT * FROM orders WHERE id = 7";
        source.enqueue(List.of(row("app", sql, 1_100)));
        session.failProcedure(MySqlErrorCodes.PROCEDURE_DOES_NOT_EXIST, "PROCEDURE app.explain_statement does not exist");

        RunSummary summary = newRun().execute(List.of("run:1"));

        assertThat(cache.get("app").getStrategy()).isInstanceOf(DirectExplainStrategy.class);
        assertThat(summary.explained()).isEqualTo(1);
        assertThat(summary.watermark()).isEqualTo(Watermark.of(1_100));

        PlanRecord record = sink.lastBatch().get(0);
        assertThat(record.getPlan()).isEqualTo(FakeExplainSession.SAMPLE_PLAN);
        assertThat(record.getPlanCost()).isEqualTo(12.5);
        assertThat(record.getSchema()).isEqualTo("app");
        assertThat(record.getStatement()).isEqualTo("SELECT * FROM orders WHERE id = ?");
        assertThat(record.getQuerySignature()).isEqualTo(Signatures.compute("SELECT * FROM orders WHERE id = ?"));
        assertThat(record.getPlanSignature()).isEqualTo(Signatures.compute(record.getDebug().getNormalizedPlan()));
        assertThat(record.getDebug().getDigestText()).isEqualTo(sql);
        assertThat(record.getDurationNs()).isEqualTo(1_500_000L);
        assertThat(record.getCounters().getRowsExamined()).isEqualTo(42L);
        assertThat(sink.getSources()).containsExactly(CollectionRun.SOURCE);
    }

    @Test
    void shouldSkipStatementsWithoutPlan() {
        source.enqueue(List.of(
                row("app", "SELECT 1", 1_100),
                row("app", "CREATE TABLE t (id int)", 1_200),
                row("app", "SHOW STATUS", 1_300)));

        RunSummary summary = newRun().execute(List.of());

        assertThat(sink.lastBatch()).hasSize(1);
        assertThat(summary.explained()).isEqualTo(1);
        assertThat(summary.scanned()).isEqualTo(3);
    }

    @Test
    void shouldCountTruncatedStatementsAndWarnOnce() {
        source.enqueue(List.of(
                row("app", "SELECT 1", 1_100),
                row("app", "SELECT 2", 1_200),
                row("app", "SELECT * FROM orders WHERE id IN (1, 2, 3, ...", 1_300),
                row("app", "SELECT * FROM invoices WHERE note = 'a very long...", 1_400)));

        RunSummary summary = newRun().execute(List.of());

        assertThat(summary.truncated()).isEqualTo(2);
        assertThat(sink.lastBatch()).hasSizeLessThanOrEqualTo(2);

        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getFormattedMessage())
                .startsWith("Unable to collect 2/4 execution plans due to truncated SQL text")
                .contains("performance_schema_max_sql_text_length");
    }

    @Test
    void shouldNotWarnWithoutTruncation() {
        source.enqueue(List.of(row("app", "SELECT 1", 1_100)));

        newRun().execute(List.of());

        assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.WARN);
    }

    @Test
    void shouldSuppressSchemaAfterAccessDenied() {
        session.failSchema("restricted", MySqlErrorCodes.DB_ACCESS_DENIED, "Access denied for user 'dd'@'%' to database 'restricted'");
        source.enqueue(List.of(
                row("restricted", "SELECT 1", 1_100),
                row("restricted", "SELECT 2", 1_200),
                row("restricted", "SELECT 3", 1_300),
                row("app", "SELECT 4", 1_400)));

        RunSummary summary = newRun().execute(List.of());

        assertThat(session.countCalls("use:restricted")).isEqualTo(1);
        assertThat(session.countCalls("procedure:")).isEqualTo(1);
        assertThat(summary.explained()).isEqualTo(1);
        assertThat(cache.get("restricted").isDisabled()).isTrue();
    }

    @Test
    void shouldSubmitEmptyBatchWithMergedTags() {
        config.setTags(List.of("env:test", "service:orders"));

        newRun().execute(List.of("service:orders", "run:2"));

        assertThat(sink.lastBatch()).isEmpty();
        assertThat(sink.lastTags()).containsExactly("env:test", "service:orders", "run:2");
    }

    @Test
    void shouldUseConfiguredQueryLimit() {
        config.setQueryLimit(25);

        newRun().execute(List.of());

        assertThat(source.getRequestedLimits()).containsExactly(25);
    }

    @Test
    void shouldAbortRunOnUnclassifiedError() {
        source.enqueue(List.of(row("app", "SELECT 1", 1_100)));
        session.failProcedure(MySqlErrorCodes.PROCEDURE_DOES_NOT_EXIST, "does not exist")
                .explainThrows(new PlanCollectionException("Unexpected database error: connection reset"));

        assertThatThrownBy(() -> newRun().execute(List.of()))
                .isInstanceOf(PlanCollectionException.class);
        assertThat(sink.getBatches()).isEmpty();
    }
}
