package org.carball.plansampler.session;

/**
 * Database session used to explain sampled statements. All calls share the
 * session's active schema.
 */
public interface ExplainSession {

    /**
     * Makes {@code schema} the default database for the following calls.
     */
    void useSchema(String schema) throws DatabaseException;

    /**
     * Calls the privileged {@code explain_statement} procedure with the statement bound as a parameter.
     *
     * @return the JSON plan, or {@code null} when the call returned no row
     */
    String callExplainProcedure(String statement) throws DatabaseException;

    /**
     * Runs {@code EXPLAIN FORMAT=json} on the statement.
     *
     * @return the JSON plan, or {@code null} when the call returned no row
     */
    String explain(String statement) throws DatabaseException;
}
