package org.carball.plansampler.session;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * {@link ExplainSession} over a single JDBC connection.
 */
@Slf4j
public class JdbcExplainSession implements ExplainSession {

    private static final String EXPLAIN_PROCEDURE_CALL = "CALL explain_statement(?)";
    private static final String EXPLAIN_PREFIX = "EXPLAIN FORMAT=json ";

    private final Connection connection;

    public JdbcExplainSession(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void useSchema(String schema) throws DatabaseException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("USE `" + schema.replace("`", "``") + "`");
        } catch (SQLException e) {
            throw DatabaseException.translate(e);
        }
    }

    @Override
    public String callExplainProcedure(String statement) throws DatabaseException {
        try (PreparedStatement stmt = connection.prepareStatement(EXPLAIN_PROCEDURE_CALL)) {
            stmt.setString(1, statement);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw DatabaseException.translate(e);
        }
    }

    @Override
    public String explain(String statement) throws DatabaseException {
        // EXPLAIN does not accept the statement as a bind parameter
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(EXPLAIN_PREFIX + statement)) {
            return rs.next() ? rs.getString(1) : null;
        } catch (SQLException e) {
            throw DatabaseException.translate(e);
        }
    }
}
