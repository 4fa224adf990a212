package net.bookharvest.support.lock;

import net.bookharvest.support.PostgresTestDatabase;
import net.bookharvest.support.retry.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class AdvisoryLockManagerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(PostgresTestDatabase.IMAGE);

    private final List<Duration> waits = new ArrayList<>();
    private AdvisoryLockManager first;
    private AdvisoryLockManager second;

    @BeforeEach
    void setUp() {
        DataSource dataSource = PostgresTestDatabase.dataSource(postgres);
        first = new AdvisoryLockManager(dataSource, waits::add);
        second = new AdvisoryLockManager(dataSource, waits::add);
    }

    @AfterEach
    void tearDown() {
        first.release(2023, 5);
        second.release(2023, 5);
    }

    @Test
    void should_DenySecondHolder_When_MonthAlreadyLocked() {
        assertThat(first.tryAcquire(2023, 5, Duration.ofMillis(50))).isTrue();

        assertThat(second.tryAcquire(2023, 5, Duration.ofMillis(50))).isFalse();
        assertThat(first.isLocked(2023, 5)).isTrue();
        assertThat(waits).isNotEmpty().allMatch(AdvisoryLockManager.POLL_INTERVAL::equals);
    }

    @Test
    void should_AllowOtherHolder_When_LockReleased() {
        assertThat(first.tryAcquire(2023, 5, Duration.ofMillis(50))).isTrue();
        assertThat(first.release(2023, 5)).isTrue();

        assertThat(second.tryAcquire(2023, 5, Duration.ZERO)).isTrue();
        assertThat(first.heldLockCount()).isZero();
        assertThat(second.heldLockCount()).isEqualTo(1);
    }

    @Test
    void should_LockMonthsIndependently_When_MonthsDiffer() {
        assertThat(first.tryAcquire(2023, 5, Duration.ZERO)).isTrue();

        assertThat(second.tryAcquire(2023, 6, Duration.ZERO)).isTrue();
        assertThat(second.release(2023, 6)).isTrue();
    }

    @Test
    void should_NotReenter_When_SameProcessAlreadyHoldsMonth() {
        assertThat(first.tryAcquire(2023, 5, Duration.ZERO)).isTrue();

        assertThat(first.tryAcquire(2023, 5, Duration.ZERO)).isFalse();
        assertThat(first.heldLockCount()).isEqualTo(1);
    }

    @Test
    void should_ReleaseAfterAction_When_RunningWithLock() {
        Optional<String> result = first.withLock(2023, 5, Duration.ZERO, () -> {
            assertThat(second.tryAcquire(2023, 5, Duration.ZERO)).isFalse();
            return "done";
        });

        assertThat(result).contains("done");
        assertThat(first.isLocked(2023, 5)).isFalse();
    }

    @Test
    void should_GrantExactlyOneThenHandOver_When_TwoRunnersRaceForSameMonth() throws Exception {
        DataSource dataSource = PostgresTestDatabase.dataSource(postgres);
        AdvisoryLockManager runnerA = new AdvisoryLockManager(dataSource, Sleeper.THREAD);
        AdvisoryLockManager runnerB = new AdvisoryLockManager(dataSource, Sleeper.THREAD);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> a = executor.submit(() -> {
                start.await();
                return runnerA.tryAcquire(2023, 7, Duration.ofMillis(200));
            });
            Future<Boolean> b = executor.submit(() -> {
                start.await();
                return runnerB.tryAcquire(2023, 7, Duration.ofMillis(200));
            });
            start.countDown();

            boolean aWon = a.get(5, TimeUnit.SECONDS);
            boolean bWon = b.get(5, TimeUnit.SECONDS);
            assertThat(aWon ^ bWon).isTrue();

            AdvisoryLockManager winner = aWon ? runnerA : runnerB;
            AdvisoryLockManager loser = aWon ? runnerB : runnerA;
            Future<Boolean> retry = executor.submit(() -> loser.tryAcquire(2023, 7, Duration.ofSeconds(3)));
            Thread.sleep(300);
            assertThat(retry.isDone()).isFalse();
            assertThat(winner.release(2023, 7)).isTrue();

            assertThat(retry.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(loser.release(2023, 7)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void should_ReportFalse_When_ReleasingUnheldLock() {
        assertThat(first.release(2023, 8)).isFalse();
    }

    @Test
    void should_ThrowAcquisitionException_When_DatabaseUnreachable() {
        DriverManagerDataSource unreachable = new DriverManagerDataSource(
            "jdbc:postgresql://127.0.0.1:1/missing", "nobody", "nothing");
        AdvisoryLockManager broken = new AdvisoryLockManager(unreachable, waits::add);

        assertThatThrownBy(() -> broken.tryAcquire(2023, 5, Duration.ZERO))
            .isInstanceOf(AdvisoryLockAcquisitionException.class)
            .hasMessageContaining("lockKey=202305");
    }
}
