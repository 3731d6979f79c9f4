package org.carball.plansampler.history;

import lombok.extern.slf4j.Slf4j;
import org.carball.plansampler.session.DatabaseException;
import org.carball.plansampler.session.MySqlErrorCodes;
import org.carball.plansampler.session.PlanCollectionException;

/**
 * Turns on the {@code events_statements_history_long} consumer when the history is
 * empty. Stops trying for good once the server reports it is read-only.
 */
@Slf4j
public class HistoryConsumerEnabler {

    private final HistorySource source;
    private boolean enabled;

    public HistoryConsumerEnabler(HistorySource source, boolean enabled) {
        this.source = source;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return whether the consumer was switched on
     */
    public boolean tryEnable() {
        if (!enabled) {
            return false;
        }
        try {
            source.enableHistoryConsumer();
        } catch (DatabaseException e) {
            return handleFailure(e);
        }
        log.info("Successfully enabled events_statements_history_long consumers");
        return true;
    }

    private boolean handleFailure(DatabaseException e) {
        switch (e.getErrorCode()) {
            case MySqlErrorCodes.TABLE_ACCESS_DENIED:
                log.error("Unable to create performance_schema consumers: {}", e.getErrorMessage());
                return false;
            case MySqlErrorCodes.READ_ONLY:
                log.warn("Unable to create performance_schema consumers because the instance is read-only");
                enabled = false;
                return false;
            default:
                throw new PlanCollectionException(
                        "Unexpected error enabling performance_schema consumers: " + e.getMessage(), e);
        }
    }
}
