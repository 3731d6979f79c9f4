package org.carball.plansampler.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.session.DatabaseException;
import org.carball.plansampler.session.ExplainSession;
import org.carball.plansampler.session.MySqlErrorCodes;

import java.util.List;
import java.util.Optional;

/**
 * Tries the available explain strategies for a statement in its schema and
 * remembers the outcome per schema. Once every strategy fails with a
 * non-retryable error, or the schema cannot be selected, statements in that
 * schema are no longer explained.
 */
@Slf4j
public class ExecutionPlanAcquirer {

    private final SchemaMethodCache cache;
    private final List<ExplainStrategy> strategies;

    public ExecutionPlanAcquirer(SchemaMethodCache cache) {
        this(cache, List.of(new StoredProcedureExplainStrategy(), new DirectExplainStrategy()));
    }

    /**
     * @param strategies candidates in priority order
     */
    public ExecutionPlanAcquirer(SchemaMethodCache cache, List<ExplainStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one explain strategy is required");
        }
        this.cache = cache;
        this.strategies = List.copyOf(strategies);
    }

    public Optional<String> acquire(ExplainSession session, String statement, String schema) {
        if (!ExplainableStatements.canExplain(statement)) {
            log.debug("Statement cannot be explained: {}", statement);
            return Optional.empty();
        }

        SchemaState state = cache.get(schema);
        if (state.isDisabled()) {
            return Optional.empty();
        }

        try {
            useSchema(session, schema);
        } catch (DatabaseException e) {
            if (isSchemaUnusable(e)) {
                log.debug("Disabling explain for schema {}: {}", schema, e.getMessage());
                cache.set(schema, SchemaState.DISABLED);
            } else {
                log.debug("Unable to switch to schema {}, will retry later: {}", schema, e.getMessage());
            }
            return Optional.empty();
        }

        if (state.isResolved()) {
            return attemptResolved(session, statement, schema, state.getStrategy());
        }
        return attemptAll(session, statement, schema);
    }

    private Optional<String> attemptResolved(ExplainSession session, String statement, String schema,
                                             ExplainStrategy strategy) {
        ExplainOutcome outcome = strategy.attempt(session, statement);
        if (outcome.hasPlan()) {
            return Optional.of(outcome.getPlan());
        }
        log.debug("{} failed in schema {} with ({}, {})", strategy.name(), schema,
                outcome.getErrorCode(), outcome.getErrorMessage());
        return Optional.empty();
    }

    private Optional<String> attemptAll(ExplainSession session, String statement, String schema) {
        int nonRetryableFailures = 0;
        for (ExplainStrategy strategy : strategies) {
            ExplainOutcome outcome = strategy.attempt(session, statement);
            if (outcome.hasPlan()) {
                cache.set(schema, SchemaState.resolved(strategy));
                return Optional.of(outcome.getPlan());
            }
            if (outcome.isNonRetryable()) {
                nonRetryableFailures++;
            }
            log.debug("{} failed in schema {} with ({}, {})", strategy.name(), schema,
                    outcome.getErrorCode(), outcome.getErrorMessage());
        }
        if (nonRetryableFailures == strategies.size()) {
            log.debug("No explain strategy is usable in schema {}, disabling", schema);
            cache.set(schema, SchemaState.DISABLED);
        }
        return Optional.empty();
    }

    private static void useSchema(ExplainSession session, String schema) throws DatabaseException {
        if (schema != null) {
            session.useSchema(schema);
        }
    }

    private static boolean isSchemaUnusable(DatabaseException e) {
        switch (e.getErrorCode()) {
            case MySqlErrorCodes.UNKNOWN_DATABASE:
            case MySqlErrorCodes.DB_ACCESS_DENIED:
                return true;
            default:
                return false;
        }
    }
}
