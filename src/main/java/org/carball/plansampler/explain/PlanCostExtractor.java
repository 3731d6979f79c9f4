package org.carball.plansampler.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the total cost from a JSON execution plan.
 */
@Slf4j
public final class PlanCostExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PlanCostExtractor() {
    }

    /**
     * Returns {@code query_block.cost_info.query_cost}, or {@code 0.0} when the value
     * is missing, not numeric or the plan cannot be parsed.
     */
    public static double cost(String plan) {
        if (plan == null || plan.isBlank()) {
            return 0.0;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(plan);
        } catch (JsonProcessingException e) {
            log.debug("Unable to parse execution plan for cost: {}", e.getOriginalMessage());
            return 0.0;
        }
        JsonNode cost = root.path("query_block").path("cost_info").path("query_cost");
        if (cost.isNumber()) {
            return cost.asDouble();
        }
        if (cost.isTextual()) {
            try {
                double parsed = Double.parseDouble(cost.asText().trim());
                return Double.isFinite(parsed) ? parsed : 0.0;
            } catch (NumberFormatException e) {
                log.debug("Non-numeric query cost in execution plan: {}", cost.asText());
            }
        }
        return 0.0;
    }
}
