package org.carball.plansampler.explain;

import java.util.Locale;
import java.util.Set;

/**
 * Decides from the leading keyword whether MySQL can explain a statement.
 */
public final class ExplainableStatements {

    private static final Set<String> EXPLAINABLE_KEYWORDS = Set.of(
            "select", "table", "delete", "insert", "replace", "update");

    private ExplainableStatements() {
    }

    public static boolean canExplain(String statement) {
        if (statement == null) {
            return false;
        }
        String trimmed = statement.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        String keyword = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        return EXPLAINABLE_KEYWORDS.contains(keyword);
    }
}
