package net.bookharvest.support.lock;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.support.retry.Sleeper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Month-scoped Postgres session advisory locks.
 *
 * <p>A session lock belongs to the connection that took it, so every held lock keeps its own
 * connection borrowed from the pool until release. If the process dies the connection drops and
 * Postgres frees the lock.</p>
 */
@Slf4j
@Component
public class AdvisoryLockManager {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final DataSource dataSource;
    private final Sleeper sleeper;
    private final Map<Long, Connection> heldLocks = new ConcurrentHashMap<>();

    @Autowired
    public AdvisoryLockManager(DataSource dataSource) {
        this(dataSource, Sleeper.THREAD);
    }

    AdvisoryLockManager(DataSource dataSource, Sleeper sleeper) {
        this.dataSource = dataSource;
        this.sleeper = sleeper;
    }

    /**
     * Polls {@code pg_try_advisory_lock} until acquired or the timeout passes.
     *
     * <p>When another thread of this process holds the month, the call waits for that holder to
     * release within the same timeout. It never reenters a lock it already holds.</p>
     *
     * @return {@code false} when the month is still held by anyone once the timeout passes
     * @throws AdvisoryLockAcquisitionException when no connection can be obtained or the query fails
     */
    public boolean tryAcquire(int year, int month, Duration timeout) {
        long key = MonthLockKey.of(year, month);
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!awaitLocalRelease(key, deadline)) {
            log.info("[LOCK] {}-{} still held by this process after {}ms", year, month, timeout.toMillis());
            return false;
        }
        Connection connection = openConnection(key);
        boolean acquired = false;
        try {
            while (true) {
                if (tryLock(connection, key)) {
                    acquired = true;
                    break;
                }
                if (System.nanoTime() >= deadline) {
                    break;
                }
                sleeper.sleep(POLL_INTERVAL);
            }
        } catch (SQLException e) {
            closeQuietly(connection, key);
            throw new AdvisoryLockAcquisitionException(key, "Advisory lock query failed", e);
        } catch (RuntimeException e) {
            closeQuietly(connection, key);
            throw e;
        }

        if (!acquired) {
            closeQuietly(connection, key);
            log.info("[LOCK] Could not acquire {}-{} within {}ms", year, month, timeout.toMillis());
            return false;
        }
        if (heldLocks.putIfAbsent(key, connection) != null) {
            // Another thread of this process won the same key between the check and the lock call
            unlock(connection, key);
            closeQuietly(connection, key);
            return false;
        }
        log.debug("[LOCK] Acquired {}-{} (key={})", year, month, key);
        return true;
    }

    private boolean awaitLocalRelease(long key, long deadline) {
        while (heldLocks.containsKey(key)) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            sleeper.sleep(POLL_INTERVAL);
        }
        return true;
    }

    public boolean tryAcquire(int year, int month) {
        return tryAcquire(year, month, DEFAULT_TIMEOUT);
    }

    /**
     * @return {@code false} when this process does not hold the lock
     */
    public boolean release(int year, int month) {
        long key = MonthLockKey.of(year, month);
        Connection connection = heldLocks.remove(key);
        if (connection == null) {
            log.warn("[LOCK] Release requested for {}-{} but it is not held here", year, month);
            return false;
        }
        boolean unlocked = unlock(connection, key);
        closeQuietly(connection, key);
        return unlocked;
    }

    /**
     * Whether any session currently holds the month's advisory lock.
     */
    public boolean isLocked(int year, int month) {
        long key = MonthLockKey.of(year, month);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT EXISTS (SELECT 1 FROM pg_locks WHERE locktype = 'advisory'"
                     + " AND classid = 0 AND objid = ?::oid AND objsubid = 1 AND granted)")) {
            statement.setLong(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            throw new AdvisoryLockAcquisitionException(key, "Advisory lock inspection failed", e);
        }
    }

    /**
     * Runs {@code action} while holding the month lock and releases it on every exit path.
     *
     * @return the action's result, or empty when the lock was not acquired
     */
    public <T> Optional<T> withLock(int year, int month, Duration timeout, Supplier<T> action) {
        if (!tryAcquire(year, month, timeout)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            release(year, month);
        }
    }

    public int heldLockCount() {
        return heldLocks.size();
    }

    private Connection openConnection(long key) {
        try {
            Connection connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            return connection;
        } catch (SQLException e) {
            throw new AdvisoryLockAcquisitionException(key, "No connection available for advisory lock", e);
        }
    }

    private static boolean tryLock(Connection connection, long key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            statement.setLong(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static boolean unlock(Connection connection, long key) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                boolean released = rs.next() && rs.getBoolean(1);
                if (!released) {
                    log.warn("[LOCK] pg_advisory_unlock returned false for key {}", key);
                }
                return released;
            }
        } catch (SQLException e) {
            log.error("[LOCK] Failed to unlock key {}; clearing all session advisory locks", key, e);
            unlockAll(connection, key);
            return false;
        }
    }

    private static void unlockAll(Connection connection, long key) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock_all()")) {
            statement.execute();
        } catch (SQLException e) {
            // The pooled connection may still hold the lock until the pool evicts it
            log.error("[LOCK] pg_advisory_unlock_all failed for key {}", key, e);
        }
    }

    private static void closeQuietly(Connection connection, long key) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[LOCK] Failed to close advisory lock connection for key {}: {}", key, e.getMessage());
        }
    }
}
