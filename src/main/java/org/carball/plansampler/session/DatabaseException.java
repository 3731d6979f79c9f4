package org.carball.plansampler.session;

import lombok.Getter;

import java.sql.SQLException;

/**
 * A database error with the server's numeric error code and message.
 */
@Getter
public class DatabaseException extends Exception {

    private final int errorCode;
    private final String errorMessage;

    public DatabaseException(int errorCode, String errorMessage) {
        super("(" + errorCode + ", " + errorMessage + ")");
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public DatabaseException(int errorCode, String errorMessage, Throwable cause) {
        super("(" + errorCode + ", " + errorMessage + ")", cause);
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    /**
     * Translates a driver exception. Errors without a vendor code do not have the
     * expected shape and are raised as {@link PlanCollectionException} instead.
     */
    public static DatabaseException translate(SQLException e) {
        if (e.getErrorCode() <= 0) {
            throw new PlanCollectionException("Unexpected database error: " + e.getMessage(), e);
        }
        return new DatabaseException(e.getErrorCode(), e.getMessage(), e);
    }
}
