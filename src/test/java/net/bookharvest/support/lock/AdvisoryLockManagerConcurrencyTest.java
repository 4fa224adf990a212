package net.bookharvest.support.lock;

import net.bookharvest.support.retry.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * In-process contention on one month key, without a database. Every JDBC lock call succeeds, so
 * any waiting observed here comes from the manager's own bookkeeping.
 */
class AdvisoryLockManagerConcurrencyTest {

    private ExecutorService executor;
    private DataSource dataSource;
    private AdvisoryLockManager lockManager;

    @BeforeEach
    void setUp() throws SQLException {
        executor = Executors.newSingleThreadExecutor();
        dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenAnswer(invocation -> grantingConnection());
        lockManager = new AdvisoryLockManager(dataSource, Sleeper.THREAD);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Connection grantingConnection() throws SQLException {
        ResultSet resultSet = mock(ResultSet.class);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean(anyInt())).thenReturn(true);
        PreparedStatement statement = mock(PreparedStatement.class);
        when(statement.executeQuery()).thenReturn(resultSet);
        Connection connection = mock(Connection.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        return connection;
    }

    @Test
    void should_AcquireAfterHolderReleases_When_WaitingWithinTimeout() throws Exception {
        assertThat(lockManager.tryAcquire(2023, 5, Duration.ZERO)).isTrue();

        long startedAt = System.nanoTime();
        Future<Boolean> waiter = executor.submit(() -> lockManager.tryAcquire(2023, 5, Duration.ofSeconds(3)));
        Thread.sleep(300);
        assertThat(waiter.isDone()).isFalse();
        assertThat(lockManager.release(2023, 5)).isTrue();

        assertThat(waiter.get(3, TimeUnit.SECONDS)).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isGreaterThanOrEqualTo(Duration.ofMillis(300));
        assertThat(lockManager.heldLockCount()).isEqualTo(1);
    }

    @Test
    void should_GiveUpAfterTimeout_When_HolderNeverReleases() throws Exception {
        assertThat(lockManager.tryAcquire(2023, 5, Duration.ZERO)).isTrue();

        long startedAt = System.nanoTime();
        boolean acquired = executor.submit(() -> lockManager.tryAcquire(2023, 5, Duration.ofMillis(250)))
            .get(3, TimeUnit.SECONDS);

        assertThat(acquired).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isGreaterThanOrEqualTo(Duration.ofMillis(250));
        assertThat(lockManager.heldLockCount()).isEqualTo(1);
        verify(dataSource, times(1)).getConnection();
    }
}
