package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AdvisoryLockBackendsTest {

    private static Connection connectionFor(String product) throws SQLException {
        Connection connection = mock(Connection.class);
        DatabaseMetaData metaData = mock(DatabaseMetaData.class);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn(product);
        return connection;
    }

    @Test
    @DisplayName("PostgreSQL connections get the PostgreSQL backend")
    void testPostgres() throws SQLException {
        assertInstanceOf(PostgreSqlAdvisoryLockBackend.class,
                AdvisoryLockBackends.forConnection(connectionFor("PostgreSQL")));
    }

    @Test
    @DisplayName("MySQL and MariaDB connections get the MySQL backend")
    void testMySql() throws SQLException {
        assertInstanceOf(MySqlAdvisoryLockBackend.class,
                AdvisoryLockBackends.forConnection(connectionFor("MySQL")));
        assertInstanceOf(MySqlAdvisoryLockBackend.class,
                AdvisoryLockBackends.forConnection(connectionFor("MariaDB")));
    }

    @Test
    @DisplayName("Unsupported databases are a configuration error")
    void testUnsupported() throws SQLException {
        Connection connection = connectionFor("H2");
        assertThrows(LockConfigurationException.class, () -> AdvisoryLockBackends.forConnection(connection));
    }

    @Test
    @DisplayName("Metadata failures surface as LockBackendException")
    void testMetadataFailure() throws SQLException {
        Connection connection = mock(Connection.class);
        when(connection.getMetaData()).thenThrow(new SQLException("closed"));
        assertThrows(LockBackendException.class, () -> AdvisoryLockBackends.forConnection(connection));
    }
}
