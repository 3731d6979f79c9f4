package org.carball.plansampler.session;

/**
 * Unclassified failure that aborts the current collection run.
 */
public class PlanCollectionException extends RuntimeException {

    public PlanCollectionException(String message) {
        super(message);
    }

    public PlanCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
