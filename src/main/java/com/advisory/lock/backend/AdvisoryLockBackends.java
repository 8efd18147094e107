package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Chooses the advisory lock backend for a JDBC connection.
 */
public final class AdvisoryLockBackends {

    private AdvisoryLockBackends() {
        // Utility class
    }

    /**
     * Returns a backend for the connection's database product.
     *
     * @throws LockConfigurationException if the database has no supported advisory locks
     * @throws LockBackendException       if the connection metadata cannot be read
     */
    public static AdvisoryLockBackend forConnection(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        String product;
        try {
            product = connection.getMetaData().getDatabaseProductName();
        } catch (SQLException e) {
            throw new LockBackendException("Unable to read database product name", e);
        }
        return forProduct(product, connection);
    }

    static AdvisoryLockBackend forProduct(String product, Connection connection) {
        String normalized = product == null ? "" : product.toLowerCase(Locale.ROOT);
        if (normalized.contains("postgres")) {
            return new PostgreSqlAdvisoryLockBackend(connection);
        }
        if (normalized.contains("mysql") || normalized.contains("mariadb")) {
            return new MySqlAdvisoryLockBackend(connection);
        }
        throw new LockConfigurationException("No advisory lock support for database: " + product);
    }
}
