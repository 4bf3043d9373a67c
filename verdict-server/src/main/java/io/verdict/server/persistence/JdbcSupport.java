package io.verdict.server.persistence;

import io.verdict.core.exception.StorageException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Lightweight JDBC helper that removes repeated try-with-resources and
/// {@link SQLException} boilerplate from the repository.
///
/// SQL is always a `static final` constant and parameters are always bound through a
/// {@link StatementPreparer}, so SQL string concatenation has no place to happen.
///
/// ### Contracts
/// - **Precondition**: {@link DataSource} is a valid pooled data source
/// - **Postcondition**: every acquired connection is released via try-with-resources
/// - **Failure**: every {@link SQLException} surfaces as a {@link StorageException} with
///   the original exception as its cause
///
/// @implNote Thread-safe. Stateless beyond the injected {@link DataSource}.
///
/// @see JdbcSessionRepository
final class JdbcSupport {

    /// SQLSTATE for `unique_violation`.
    static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT or UPDATE statement.
    ///
    /// @param sql the SQL statement, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param errorContext message for the {@link StorageException}, not null
    /// @return number of affected rows
    /// @throws StorageException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(errorContext, e);
        }
    }

    /// Executes a SELECT returning zero or one mapped row.
    ///
    /// @throws StorageException if the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException(errorContext, e);
        }
    }

    /// Executes a SELECT returning zero or more mapped rows, in result order.
    ///
    /// @throws StorageException if the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new StorageException(errorContext, e);
        }
    }

    /// Returns whether a failure raised by this helper was a unique-constraint violation.
    ///
    /// @param e failure thrown by {@link #update}, not null
    /// @return true if the database reported SQLSTATE `23505`
    static boolean isUniqueViolation(StorageException e) {
        return e.getCause() instanceof SQLException sql
                && UNIQUE_VIOLATION.equals(sql.getSQLState());
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    @FunctionalInterface
    interface StatementPreparer {

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps a single {@link ResultSet} row to a domain object.
    ///
    /// {@snippet :
    /// RowMapper<String> idMapper = rs -> rs.getString("session_id");
    /// }
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }
}
