package org.carball.plansampler.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.session.DatabaseException;
import org.carball.plansampler.session.ExplainSession;
import org.carball.plansampler.session.MySqlErrorCodes;

/**
 * Explains through the {@code explain_statement} procedure, which runs with the
 * privileges of its definer.
 */
@Slf4j
public class StoredProcedureExplainStrategy implements ExplainStrategy {

    @Override
    public String name() {
        return "explain_statement procedure";
    }

    @Override
    public ExplainOutcome attempt(ExplainSession session, String statement) {
        String plan;
        try {
            plan = session.callExplainProcedure(statement);
        } catch (DatabaseException e) {
            return classify(e);
        }
        if (plan == null) {
            return ExplainOutcome.noResult(name());
        }
        log.debug("Successfully ran explain using explain_statement procedure: {}", statement);
        return ExplainOutcome.plan(plan);
    }

    static ExplainOutcome classify(DatabaseException e) {
        switch (e.getErrorCode()) {
            case MySqlErrorCodes.PROCEDURE_EXECUTE_DENIED:
            case MySqlErrorCodes.PROCEDURE_DOES_NOT_EXIST:
                return ExplainOutcome.nonRetryable(e);
            default:
                return ExplainOutcome.retryable(e);
        }
    }
}
