package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;
import com.advisory.lock.key.LockName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * MySQL and MariaDB named locks ({@code GET_LOCK}/{@code RELEASE_LOCK}),
 * keyed by {@link LockName#value()}.
 *
 * <p>Only exclusive, session-level locks exist. Names longer than
 * {@value #MAX_NAME_LENGTH} characters are replaced by {@code lock:<key>}.</p>
 */
public class MySqlAdvisoryLockBackend extends JdbcAdvisoryLockBackend {
    private static final Logger log = LoggerFactory.getLogger(MySqlAdvisoryLockBackend.class);

    static final int MAX_NAME_LENGTH = 64;

    public MySqlAdvisoryLockBackend(Connection connection) {
        super(connection);
    }

    @Override
    public boolean tryLock(LockName lockName, boolean shared, boolean transactional) {
        return getLock(lockName, 0);
    }

    @Override
    public boolean supportsBlockingLock() {
        return true;
    }

    @Override
    public boolean blockingLock(LockName lockName, boolean shared, boolean transactional) {
        // a negative timeout waits indefinitely
        return getLock(lockName, -1);
    }

    @Override
    public void releaseLock(LockName lockName, boolean shared, boolean transactional) {
        Integer released = selectOne("SELECT RELEASE_LOCK(?)", MySqlAdvisoryLockBackend::nullableInt,
                serverName(lockName));
        if (released == null || released != 1) {
            log.warn("lock.release.not_held lockName={} result={}", serverName(lockName), released);
        }
    }

    @Override
    public void checkSupported(boolean shared, boolean transactional) {
        if (shared) {
            throw new LockConfigurationException("MySQL does not support shared advisory locks");
        }
        if (transactional) {
            throw new LockConfigurationException("MySQL does not support transaction-level advisory locks");
        }
    }

    static String serverName(LockName lockName) {
        String value = lockName.value();
        return value.length() <= MAX_NAME_LENGTH ? value : "lock:" + lockName.key();
    }

    private boolean getLock(LockName lockName, int timeoutSeconds) {
        Integer result = selectOne("SELECT GET_LOCK(?, ?)", MySqlAdvisoryLockBackend::nullableInt,
                serverName(lockName), timeoutSeconds);
        if (result == null) {
            throw new LockBackendException("GET_LOCK returned NULL for " + serverName(lockName), null);
        }
        return result == 1;
    }

    private static Integer nullableInt(ResultSet row) throws SQLException {
        if (row == null) {
            return null;
        }
        int value = row.getInt(1);
        return row.wasNull() ? null : value;
    }
}
