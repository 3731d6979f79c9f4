package org.carball.plansampler.explain;

import java.util.HashMap;
import java.util.Map;

/**
 * Remembers per schema which explain strategy works, or that none does. Entries
 * live as long as the owning collector. Statements without a current schema are
 * tracked under the {@code null} key.
 */
public class SchemaMethodCache {

    private final Map<String, SchemaState> states = new HashMap<>();

    public SchemaState get(String schema) {
        return states.getOrDefault(schema, SchemaState.UNRESOLVED);
    }

    public void set(String schema, SchemaState state) {
        states.put(schema, state);
    }

    public int size() {
        return states.size();
    }
}
