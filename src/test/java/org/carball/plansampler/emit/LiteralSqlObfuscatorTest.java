package org.carball.plansampler.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralSqlObfuscatorTest {

    private final LiteralSqlObfuscator obfuscator = new LiteralSqlObfuscator();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldReplaceStringAndNumericLiterals() {
        String result = obfuscator.obfuscateSql("SELECT * FROM orders WHERE email = 'bob@example.com' AND total > 10.5");

        assertThat(result).isEqualTo("SELECT * FROM orders WHERE email = ? AND total > ?");
    }

    @Test
    void shouldKeepNumbersInsideIdentifiers() {
        String result = obfuscator.obfuscateSql("SELECT t1.col_2 FROM t1 WHERE t1.id = 42");

        assertThat(result).isEqualTo("SELECT t1.col_2 FROM t1 WHERE t1.id = ?");
    }

    @Test
    void shouldReplaceHexLiterals() {
        String result = obfuscator.obfuscateSql("SELECT * FROM sessions WHERE token = 0xDEADBEEF");

        assertThat(result).isEqualTo("SELECT * FROM sessions WHERE token = ?");
    }

    @Test
    void shouldReplaceDecimalsWithoutLeadingDigit() {
        String result = obfuscator.obfuscateSql("SELECT * FROM scores WHERE ratio > .75 AND t1.id = 3");

        assertThat(result).isEqualTo("SELECT * FROM scores WHERE ratio > ? AND t1.id = ?");
    }

    @Test
    void shouldCollapseInLists() {
        String result = obfuscator.obfuscateSql("SELECT * FROM t WHERE id IN (1, 2, 3)");

        assertThat(result).isEqualTo("SELECT * FROM t WHERE id IN ( ? )");
    }

    @Test
    void shouldObfuscateTextInPlan() throws Exception {
        String plan = "{\"query_block\":{\"cost_info\":{\"query_cost\":\"1.20\"},"
                + "\"table\":{\"table_name\":\"orders\",\"attached_condition\":\"(`app`.`orders`.`email` = 'bob')\"}}}";

        JsonNode result = objectMapper.readTree(obfuscator.obfuscatePlan(plan, false));

        assertThat(result.at("/query_block/table/attached_condition").asText())
                .isEqualTo("(`app`.`orders`.`email` = ?)");
        assertThat(result.at("/query_block/table/table_name").asText()).isEqualTo("orders");
        assertThat(result.at("/query_block/cost_info/query_cost").asText()).isEqualTo("1.20");
    }

    @Test
    void shouldDropVolatileFieldsWhenNormalizing() throws Exception {
        String plan = "{\"query_block\":{\"cost_info\":{\"query_cost\":\"1.20\"},"
                + "\"table\":{\"table_name\":\"orders\",\"rows_examined_per_scan\":12,\"filtered\":\"10.00\"}}}";

        JsonNode result = objectMapper.readTree(obfuscator.obfuscatePlan(plan, true));

        assertThat(result.at("/query_block/cost_info").isMissingNode()).isTrue();
        assertThat(result.at("/query_block/table/rows_examined_per_scan").isMissingNode()).isTrue();
        assertThat(result.at("/query_block/table/filtered").isMissingNode()).isTrue();
        assertThat(result.at("/query_block/table/table_name").asText()).isEqualTo("orders");
    }

    @Test
    void shouldGiveSameNormalizedPlanForDifferentEstimates() {
        String first = "{\"query_block\":{\"cost_info\":{\"query_cost\":\"1.20\"},\"table\":{\"table_name\":\"t\",\"rows_produced_per_join\":3}}}";
        String second = "{\"query_block\":{\"cost_info\":{\"query_cost\":\"9.75\"},\"table\":{\"table_name\":\"t\",\"rows_produced_per_join\":300}}}";

        assertThat(obfuscator.obfuscatePlan(first, true)).isEqualTo(obfuscator.obfuscatePlan(second, true));
    }

    @Test
    void shouldFallBackToTextObfuscationForInvalidJson() {
        assertThat(obfuscator.obfuscatePlan("not json 'secret'", true)).isEqualTo("not json ?");
        assertThat(obfuscator.obfuscatePlan(null, true)).isNull();
    }
}
