package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Base class for backends that issue advisory lock functions over JDBC.
 * The connection is borrowed, never closed here.
 */
public abstract class JdbcAdvisoryLockBackend implements AdvisoryLockBackend {

    protected final Connection connection;

    protected JdbcAdvisoryLockBackend(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        this.connection = connection;
    }

    public Connection getConnection() {
        return connection;
    }

    /**
     * Runs a single-row SELECT and maps its first row.
     *
     * @param sql    the statement
     * @param reader maps the positioned result set; receives null when no row came back
     * @param params positional parameters
     */
    protected <T> T selectOne(String sql, ResultReader<T> reader, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return reader.read(rs.next() ? rs : null);
            }
        } catch (SQLException e) {
            throw new LockBackendException("Advisory lock statement failed: " + sql, e);
        }
    }

    /**
     * Reads a value out of a result row.
     */
    @FunctionalInterface
    protected interface ResultReader<T> {
        T read(ResultSet row) throws SQLException;
    }
}
