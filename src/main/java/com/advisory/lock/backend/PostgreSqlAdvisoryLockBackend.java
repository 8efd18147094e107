package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;
import com.advisory.lock.key.LockName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * PostgreSQL advisory locks keyed by {@link LockName#key()}.
 *
 * <p>Session-level locks are released with {@code pg_advisory_unlock}.
 * Transaction-level locks ({@code pg_*_xact_lock}) are dropped by the server
 * at commit or rollback, so releasing them is a no-op. They require the
 * connection to be inside a transaction.</p>
 */
public class PostgreSqlAdvisoryLockBackend extends JdbcAdvisoryLockBackend {
    private static final Logger log = LoggerFactory.getLogger(PostgreSqlAdvisoryLockBackend.class);

    public PostgreSqlAdvisoryLockBackend(Connection connection) {
        super(connection);
    }

    @Override
    public boolean tryLock(LockName lockName, boolean shared, boolean transactional) {
        String sql = "SELECT " + functionName("pg_try_advisory", shared, transactional) + "(?)";
        return selectOne(sql, row -> row != null && row.getBoolean(1), lockName.key());
    }

    @Override
    public boolean supportsBlockingLock() {
        return true;
    }

    @Override
    public boolean blockingLock(LockName lockName, boolean shared, boolean transactional) {
        String sql = "SELECT " + functionName("pg_advisory", shared, transactional) + "(?)";
        // pg_advisory_lock returns void; reaching the row means the lock is held
        return selectOne(sql, row -> row != null, lockName.key());
    }

    @Override
    public void releaseLock(LockName lockName, boolean shared, boolean transactional) {
        if (transactional) {
            return;
        }
        String sql = shared ? "SELECT pg_advisory_unlock_shared(?)" : "SELECT pg_advisory_unlock(?)";
        boolean released = selectOne(sql, row -> row != null && row.getBoolean(1), lockName.key());
        if (!released) {
            log.warn("lock.release.not_held lockName={} lockKey={} shared={}",
                    lockName.value(), lockName.key(), shared);
        }
    }

    @Override
    public void checkSupported(boolean shared, boolean transactional) {
        if (!transactional) {
            return;
        }
        try {
            if (connection.getAutoCommit()) {
                throw new LockConfigurationException(
                        "Transaction-level advisory locks require an open transaction (auto-commit is on)");
            }
        } catch (SQLException e) {
            throw new LockBackendException("Unable to read auto-commit state", e);
        }
    }

    static String functionName(String base, boolean shared, boolean transactional) {
        StringBuilder sb = new StringBuilder(base);
        if (transactional) {
            sb.append("_xact");
        }
        sb.append("_lock");
        if (shared) {
            sb.append("_shared");
        }
        return sb.toString();
    }
}
