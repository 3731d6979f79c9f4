package org.carball.plansampler.session;

/**
 * MySQL server error codes the collector reacts to.
 */
public final class MySqlErrorCodes {

    /** ER_DBACCESS_DENIED_ERROR: access denied for user to database. */
    public static final int DB_ACCESS_DENIED = 1044;

    /** No permission to explain the statement. */
    public static final int EXPLAIN_NOT_PERMITTED = 1046;

    /** ER_BAD_DB_ERROR: unknown database. */
    public static final int UNKNOWN_DATABASE = 1049;

    /** ER_PARSE_ERROR: syntax error in the explained statement. */
    public static final int PARSE_ERROR = 1064;

    /** ER_TABLEACCESS_DENIED_ERROR: command denied on a table. */
    public static final int TABLE_ACCESS_DENIED = 1142;

    /** ER_OPTION_PREVENTS_STATEMENT: server runs with --read-only. */
    public static final int READ_ONLY = 1290;

    /** ER_SP_DOES_NOT_EXIST: the stored procedure is not defined. */
    public static final int PROCEDURE_DOES_NOT_EXIST = 1305;

    /** ER_PROCACCESS_DENIED_ERROR: execute command denied on the procedure. */
    public static final int PROCEDURE_EXECUTE_DENIED = 1370;

    private MySqlErrorCodes() {
        // Constants only
    }
}
