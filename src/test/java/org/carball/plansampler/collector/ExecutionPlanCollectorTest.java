package org.carball.plansampler.collector;

import org.carball.plansampler.config.CollectorConfig;
import org.carball.plansampler.model.Watermark;
import org.carball.plansampler.support.FakeExplainSession;
import org.carball.plansampler.support.FakeHistorySource;
import org.carball.plansampler.support.RecordingPlanEventSink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.plansampler.support.HistoryRows.row;

class ExecutionPlanCollectorTest {

    @Test
    void shouldKeepWatermarkAndSchemaMethodsAcrossRuns() {
        FakeHistorySource source = new FakeHistorySource().withHighWatermark(100)
                .enqueue(List.of(row("app", "SELECT 1", 150)))
                .enqueue(List.of(row("app", "SELECT 2", 175), row("app", "UPDATE t SET a = 1", 210)));
        FakeExplainSession session = new FakeExplainSession();
        RecordingPlanEventSink sink = new RecordingPlanEventSink();
        ExecutionPlanCollector collector = new ExecutionPlanCollector(new CollectorConfig(), source, session, sink);

        RunSummary first = collector.collect(List.of());
        RunSummary second = collector.collect(List.of());

        assertThat(first.explained()).isEqualTo(1);
        assertThat(second.explained()).isEqualTo(2);
        assertThat(collector.getWatermark()).contains(Watermark.of(210));
        assertThat(source.getRequestedWatermarks()).containsExactly(Watermark.of(100), Watermark.of(150));
        assertThat(collector.getSchemaMethods().get("app").isResolved()).isTrue();
        assertThat(sink.getBatches()).hasSize(2);
    }

    @Test
    void shouldEstablishCheckpointOnLaterRun() {
        FakeHistorySource source = new FakeHistorySource().withoutHighWatermark();
        ExecutionPlanCollector collector = new ExecutionPlanCollector(
                new CollectorConfig(), source, new FakeExplainSession(), new RecordingPlanEventSink());

        assertThat(collector.collect(List.of()).status()).isEqualTo(RunSummary.Status.NOT_READY);

        source.withHighWatermark(500);
        RunSummary summary = collector.collect(List.of());

        assertThat(summary.status()).isEqualTo(RunSummary.Status.COMPLETED);
        assertThat(collector.getWatermark()).contains(Watermark.of(500));
    }
}
