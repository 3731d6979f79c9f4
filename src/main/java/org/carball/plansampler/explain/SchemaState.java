package org.carball.plansampler.explain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What is known about explaining statements in one schema.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SchemaState {

    public enum Status {
        UNRESOLVED,
        RESOLVED,
        DISABLED
    }

    public static final SchemaState UNRESOLVED = new SchemaState(Status.UNRESOLVED, null);
    public static final SchemaState DISABLED = new SchemaState(Status.DISABLED, null);

    Status status;
    ExplainStrategy strategy;

    public static SchemaState resolved(ExplainStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("A resolved schema needs a strategy");
        }
        return new SchemaState(Status.RESOLVED, strategy);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public boolean isDisabled() {
        return status == Status.DISABLED;
    }
}
