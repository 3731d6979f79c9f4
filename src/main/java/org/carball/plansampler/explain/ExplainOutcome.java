package org.carball.plansampler.explain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.carball.plansampler.session.DatabaseException;

/**
 * Result of one attempt to explain a statement: either a plan document or a
 * classified failure carrying the server's error code.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExplainOutcome {

    public enum Kind {
        PLAN,
        RETRYABLE_FAILURE,
        NON_RETRYABLE_FAILURE
    }

    /** Error code used when a call succeeded but produced no plan row. */
    public static final int NO_RESULT = 0;

    Kind kind;
    String plan;
    int errorCode;
    String errorMessage;

    public static ExplainOutcome plan(String plan) {
        return new ExplainOutcome(Kind.PLAN, plan, 0, null);
    }

    public static ExplainOutcome retryable(int errorCode, String errorMessage) {
        return new ExplainOutcome(Kind.RETRYABLE_FAILURE, null, errorCode, errorMessage);
    }

    public static ExplainOutcome retryable(DatabaseException e) {
        return retryable(e.getErrorCode(), e.getErrorMessage());
    }

    public static ExplainOutcome nonRetryable(DatabaseException e) {
        return new ExplainOutcome(Kind.NON_RETRYABLE_FAILURE, null, e.getErrorCode(), e.getErrorMessage());
    }

    public static ExplainOutcome noResult(String strategyName) {
        return retryable(NO_RESULT, strategyName + " returned no plan");
    }

    public boolean hasPlan() {
        return kind == Kind.PLAN;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE_FAILURE;
    }

    public boolean isNonRetryable() {
        return kind == Kind.NON_RETRYABLE_FAILURE;
    }
}
