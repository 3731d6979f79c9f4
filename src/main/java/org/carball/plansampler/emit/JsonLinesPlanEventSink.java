package org.carball.plansampler.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.model.PlanRecord;
import org.carball.plansampler.session.PlanCollectionException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;

/**
 * Appends plan events to a file, one JSON document per line.
 */
@Slf4j
public class JsonLinesPlanEventSink implements PlanEventSink {

    private final Path outputFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonLinesPlanEventSink(Path outputFile) {
        this(outputFile, Clock.systemUTC());
    }

    public JsonLinesPlanEventSink(Path outputFile, Clock clock) {
        this.outputFile = outputFile;
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
    }

    @Override
    public void submit(List<PlanRecord> records, List<String> tags, String source) {
        if (records.isEmpty()) {
            return;
        }
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (PlanRecord record : records) {
                writer.write(toJson(record, tags, source));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new PlanCollectionException("Unable to write plan events to " + outputFile, e);
        }
        log.debug("Wrote {} plan events to {}", records.size(), outputFile);
    }

    String toJson(PlanRecord record, List<String> tags, String source) throws JsonProcessingException {
        ObjectNode event = objectMapper.createObjectNode();
        event.put("timestamp", clock.millis());
        event.put("ddsource", source);
        event.put("ddtags", String.join(",", tags));
        event.put("duration", record.getDurationNs());

        ObjectNode db = event.putObject("db");
        db.put("instance", record.getSchema());
        db.put("statement", record.getStatement());
        db.put("query_signature", record.getQuerySignature());
        db.put("plan", record.getPlan());
        db.put("plan_cost", record.getPlanCost());
        db.put("plan_signature", record.getPlanSignature());
        db.set("debug", objectMapper.valueToTree(record.getDebug()));
        db.set("mysql", objectMapper.valueToTree(record.getCounters()));

        return objectMapper.writeValueAsString(event);
    }
}
