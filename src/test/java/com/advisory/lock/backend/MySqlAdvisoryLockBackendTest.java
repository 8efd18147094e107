package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;
import com.advisory.lock.key.LockName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MySqlAdvisoryLockBackendTest {

    private static final LockName NAME = LockName.resolve("app:", "import");

    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private MySqlAdvisoryLockBackend backend;

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        backend = new MySqlAdvisoryLockBackend(connection);
    }

    @Test
    @DisplayName("Try-lock calls GET_LOCK with a zero timeout")
    void testTryLock() throws SQLException {
        when(resultSet.getInt(1)).thenReturn(1);

        assertTrue(backend.tryLock(NAME, false, false));

        verify(connection).prepareStatement("SELECT GET_LOCK(?, ?)");
        verify(statement).setObject(1, "app:import");
        verify(statement).setObject(2, 0);
    }

    @Test
    @DisplayName("GET_LOCK returning 0 means busy")
    void testBusy() throws SQLException {
        when(resultSet.getInt(1)).thenReturn(0);
        assertFalse(backend.tryLock(NAME, false, false));
    }

    @Test
    @DisplayName("GET_LOCK returning NULL is a backend error")
    void testNullResult() throws SQLException {
        when(resultSet.getInt(1)).thenReturn(0);
        when(resultSet.wasNull()).thenReturn(true);
        assertThrows(LockBackendException.class, () -> backend.tryLock(NAME, false, false));
    }

    @Test
    @DisplayName("Blocking lock waits indefinitely")
    void testBlocking() throws SQLException {
        when(resultSet.getInt(1)).thenReturn(1);

        assertTrue(backend.blockingLock(NAME, false, false));
        verify(statement).setObject(2, -1);
    }

    @Test
    @DisplayName("Release calls RELEASE_LOCK")
    void testRelease() throws SQLException {
        when(resultSet.getInt(1)).thenReturn(1);

        backend.releaseLock(NAME, false, false);

        verify(connection).prepareStatement("SELECT RELEASE_LOCK(?)");
        verify(statement).setObject(1, "app:import");
    }

    @Test
    @DisplayName("Shared and transaction-level modes are rejected")
    void testUnsupportedModes() {
        assertThrows(LockConfigurationException.class, () -> backend.checkSupported(true, false));
        assertThrows(LockConfigurationException.class, () -> backend.checkSupported(false, true));
        assertDoesNotThrow(() -> backend.checkSupported(false, false));
    }

    @Test
    @DisplayName("Long names are replaced by their key")
    void testLongNames() {
        LockName longName = LockName.resolve("", "x".repeat(100));
        assertEquals("lock:" + longName.key(), MySqlAdvisoryLockBackend.serverName(longName));
        assertEquals("app:import", MySqlAdvisoryLockBackend.serverName(NAME));
    }
}
