package org.carball.plansampler.explain;

import org.carball.plansampler.session.ExplainSession;

/**
 * One way of obtaining a statement's execution plan.
 */
public interface ExplainStrategy {

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Attempts to explain {@code statement} in the session's current schema.
     * Database errors are classified into the returned outcome; errors of an
     * unexpected shape propagate.
     */
    ExplainOutcome attempt(ExplainSession session, String statement);
}
