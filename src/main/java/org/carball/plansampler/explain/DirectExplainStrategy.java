package org.carball.plansampler.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.session.DatabaseException;
import org.carball.plansampler.session.ExplainSession;
import org.carball.plansampler.session.MySqlErrorCodes;

/**
 * Explains by running {@code EXPLAIN FORMAT=json} with the connecting user's privileges.
 */
@Slf4j
public class DirectExplainStrategy implements ExplainStrategy {

    @Override
    public String name() {
        return "EXPLAIN statement";
    }

    @Override
    public ExplainOutcome attempt(ExplainSession session, String statement) {
        String plan;
        try {
            plan = session.explain(statement);
        } catch (DatabaseException e) {
            return classify(e, statement);
        }
        if (plan == null) {
            return ExplainOutcome.noResult(name());
        }
        log.debug("Successfully ran explain using EXPLAIN statement: {}", statement);
        return ExplainOutcome.plan(plan);
    }

    static ExplainOutcome classify(DatabaseException e, String statement) {
        switch (e.getErrorCode()) {
            case MySqlErrorCodes.EXPLAIN_NOT_PERMITTED:
                log.warn("Failed to collect EXPLAIN due to a permissions error: {}, Statement: {}",
                        e.getMessage(), statement);
                return ExplainOutcome.nonRetryable(e);
            case MySqlErrorCodes.PARSE_ERROR:
                // may depend on the statement rather than on the schema
                log.warn("Programming error when collecting EXPLAIN: {}, Statement: {}", e.getMessage(), statement);
                return ExplainOutcome.retryable(e);
            default:
                return ExplainOutcome.retryable(e);
        }
    }
}
