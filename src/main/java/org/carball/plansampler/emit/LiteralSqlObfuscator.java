package org.carball.plansampler.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces quoted strings and numeric literals with {@code ?}. In plans only the
 * fields holding SQL conditions are rewritten.
 */
@Slf4j
public class LiteralSqlObfuscator implements SqlObfuscator {

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.|'')*'|\"(?:[^\"\\\\]|\\\\.|\"\")*\"");

    // Hex, decimal and leading-dot numbers not glued to an identifier such as t1 or col_2
    private static final Pattern NUMERIC_LITERAL = Pattern.compile(
            "(?<![A-Za-z0-9_$`])-?0[xX][0-9A-Fa-f]+(?![A-Za-z0-9_$])"
                    + "|(?<![A-Za-z0-9_$.`])-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?(?![A-Za-z0-9_$])"
                    + "|(?<![A-Za-z0-9_$`])-?\\.\\d+(?:[eE][+-]?\\d+)?(?![A-Za-z0-9_$])");

    private static final Pattern IN_LIST = Pattern.compile("\\(\\s*\\?(?:\\s*,\\s*\\?)+\\s*\\)");

    // Plan fields that embed SQL fragments with literal values
    private static final Set<String> SQL_PLAN_FIELDS = Set.of(
            "attached_condition", "index_condition", "having_condition", "pushed_index_condition",
            "table_condition", "condition", "message");

    // Estimates that vary between executions of the same plan
    private static final Set<String> VOLATILE_PLAN_FIELDS = Set.of(
            "cost_info", "rows_examined_per_scan", "rows_produced_per_join", "filtered", "rows");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String obfuscateSql(String sql) {
        if (sql == null) {
            return null;
        }
        String result = STRING_LITERAL.matcher(sql).replaceAll("?");
        result = NUMERIC_LITERAL.matcher(result).replaceAll("?");
        return IN_LIST.matcher(result).replaceAll("( ? )");
    }

    @Override
    public String obfuscatePlan(String plan, boolean normalize) {
        if (plan == null) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(plan);
            return objectMapper.writeValueAsString(obfuscateNode(root, null, normalize));
        } catch (JsonProcessingException e) {
            log.debug("Execution plan is not valid JSON, obfuscating as text: {}", e.getOriginalMessage());
            return obfuscateSql(plan);
        }
    }

    private JsonNode obfuscateNode(JsonNode node, String fieldName, boolean normalize) {
        if (node.isTextual()) {
            return fieldName != null && SQL_PLAN_FIELDS.contains(fieldName)
                    ? TextNode.valueOf(obfuscateSql(node.asText()))
                    : node;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, obfuscateNode(array.get(i), fieldName, normalize));
            }
            return array;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> volatileFields = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (normalize && VOLATILE_PLAN_FIELDS.contains(field.getKey())) {
                    volatileFields.add(field.getKey());
                } else {
                    field.setValue(obfuscateNode(field.getValue(), field.getKey(), normalize));
                }
            }
            object.remove(volatileFields);
            return object;
        }
        return node;
    }
}
