package net.bookharvest.repository;

import net.bookharvest.domain.backfill.BackfillCompletion;
import net.bookharvest.domain.backfill.BackfillMonthRecord;
import net.bookharvest.domain.backfill.BackfillStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Postgres adapter for the {@code backfill_log} state machine.
 *
 * <p>Every transition is a single guarded UPDATE that writes {@code status} and {@code completed_at}
 * together, so {@code completed_at} is set exactly when the status is terminal. The table's CHECK
 * constraints enforce the same rule. Rows are created only by {@link #seed(int, int)} and never
 * deleted.</p>
 */
@Repository
public class BackfillLogRepository {

    private static final Logger log = LoggerFactory.getLogger(BackfillLogRepository.class);

    public static final int MAX_RETRIES = 5;
    public static final int DEFAULT_MONTH_BATCH_SIZE = 20;
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private static final String SELECT_COLUMNS = """
        SELECT year, month, status, retry_count, started_at, completed_at, last_retry_at, error_message,
               books_generated, isbns_resolved, resolution_rate, isbns_queued, synthetic_created,
               prompt_variant, batch_size, gemini_calls, xai_calls, isbndb_calls, total_api_calls
        FROM backfill_log
        """;

    private static final RowMapper<BackfillMonthRecord> ROW_MAPPER = BackfillLogRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public BackfillLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a pending row for every month of the range. Existing months are left untouched.
     *
     * @return number of rows inserted; zero when the range is already seeded
     */
    public int seed(int yearStart, int yearEnd) {
        if (yearStart > yearEnd) {
            throw new IllegalArgumentException("yearStart must not be after yearEnd: " + yearStart + " > " + yearEnd);
        }
        String sql = """
            INSERT INTO backfill_log (year, month, status, prompt_variant, batch_size)
            SELECT y, m, 'pending',
                   CASE WHEN y >= 2020 THEN 'contemporary-notable' ELSE 'baseline' END,
                   ?
            FROM generate_series(?, ?) AS y
            CROSS JOIN generate_series(1, 12) AS m
            ON CONFLICT (year, month) DO NOTHING
            """;
        int inserted = execute("seed " + yearStart + ".." + yearEnd,
            () -> jdbcTemplate.update(sql, DEFAULT_MONTH_BATCH_SIZE, yearStart, yearEnd));
        log.info("[BACKFILL] Seeded {} months for {}..{}", inserted, yearStart, yearEnd);
        return inserted;
    }

    /**
     * Months ready to run, most recent first. Force retry also returns {@code failed} months
     * whatever their retry count.
     */
    public List<BackfillMonthRecord> findEligible(int batchSize, int yearStart, int yearEnd, boolean forceRetry) {
        String sql = SELECT_COLUMNS + """
            WHERE year BETWEEN ? AND ?
              AND ((status IN ('pending', 'retry') AND retry_count < ?)
                   OR (? AND status = 'failed'))
            ORDER BY year DESC, month DESC
            LIMIT ?
            """;
        return execute("find eligible",
            () -> jdbcTemplate.query(sql, ROW_MAPPER, yearStart, yearEnd, MAX_RETRIES, forceRetry, batchSize));
    }

    /**
     * Moves a month to {@code processing}.
     *
     * @return {@code false} when the row was not in a startable status
     */
    public boolean markProcessing(int year, int month, boolean forceRetry) {
        String sql = """
            UPDATE backfill_log
            SET status = 'processing',
                started_at = now(),
                completed_at = NULL,
                error_message = NULL,
                last_retry_at = CASE WHEN status IN ('retry', 'failed') THEN now() ELSE last_retry_at END,
                updated_at = now()
            WHERE year = ? AND month = ?
              AND (status IN ('pending', 'retry') OR (? AND status = 'failed'))
            """;
        return execute("mark processing " + year + "-" + month,
            () -> jdbcTemplate.update(sql, year, month, forceRetry)) == 1;
    }

    /**
     * @return {@code false} when the month was not processing
     */
    public boolean markCompleted(int year, int month, BackfillCompletion completion) {
        String sql = """
            UPDATE backfill_log
            SET status = 'completed',
                completed_at = now(),
                error_message = NULL,
                books_generated = ?,
                isbns_resolved = ?,
                resolution_rate = ?,
                isbns_queued = ?,
                synthetic_created = ?,
                gemini_calls = ?,
                xai_calls = ?,
                isbndb_calls = ?,
                total_api_calls = ?,
                updated_at = now()
            WHERE year = ? AND month = ? AND status = 'processing'
            """;
        return execute("mark completed " + year + "-" + month, () -> jdbcTemplate.update(sql,
            completion.booksGenerated(),
            completion.isbnsResolved(),
            completion.resolutionRate(),
            completion.isbnsQueued(),
            completion.syntheticCreated(),
            completion.geminiCalls(),
            completion.xaiCalls(),
            completion.isbndbCalls(),
            completion.totalApiCalls(),
            year,
            month)) == 1;
    }

    /**
     * Records a failed attempt. The fifth failure is terminal.
     *
     * @return the resulting status, or empty when the month was not processing
     */
    public Optional<BackfillStatus> markFailedAttempt(int year, int month, String errorMessage) {
        String sql = """
            UPDATE backfill_log
            SET retry_count = retry_count + 1,
                status = CASE WHEN retry_count + 1 >= ? THEN 'failed' ELSE 'retry' END,
                completed_at = CASE WHEN retry_count + 1 >= ? THEN now() ELSE NULL END,
                last_retry_at = now(),
                error_message = ?,
                updated_at = now()
            WHERE year = ? AND month = ? AND status = 'processing'
            RETURNING status
            """;
        String truncated = truncate(errorMessage);
        return execute("mark failed " + year + "-" + month, () -> jdbcTemplate.query(sql,
            rs -> rs.next() ? Optional.of(BackfillStatus.fromDbValue(rs.getString("status"))) : Optional.<BackfillStatus>empty(),
            MAX_RETRIES, MAX_RETRIES, truncated, year, month));
    }

    /**
     * Returns months stuck in {@code processing} longer than {@code olderThan} to {@code pending}
     * (never retried) or {@code retry}.
     *
     * @return number of months reclaimed
     */
    public int resetStaleProcessing(Duration olderThan) {
        String sql = """
            UPDATE backfill_log
            SET status = CASE WHEN retry_count > 0 THEN 'retry' ELSE 'pending' END,
                started_at = NULL,
                completed_at = NULL,
                error_message = ?,
                updated_at = now()
            WHERE status = 'processing'
              AND started_at < now() - make_interval(secs => ?)
            """;
        String note = "Reclaimed after processing for more than " + olderThan.toMinutes() + " minutes";
        int reclaimed = execute("reset stale processing",
            () -> jdbcTemplate.update(sql, note, (double) olderThan.toSeconds()));
        if (reclaimed > 0) {
            log.warn("[BACKFILL] Reclaimed {} stale processing months (older than {})", reclaimed, olderThan);
        }
        return reclaimed;
    }

    public Optional<BackfillMonthRecord> find(int year, int month) {
        List<BackfillMonthRecord> rows = execute("find " + year + "-" + month,
            () -> jdbcTemplate.query(SELECT_COLUMNS + " WHERE year = ? AND month = ?", ROW_MAPPER, year, month));
        return rows.stream().findFirst();
    }

    public Map<BackfillStatus, Long> countByStatus() {
        Map<BackfillStatus, Long> counts = new EnumMap<>(BackfillStatus.class);
        for (BackfillStatus status : BackfillStatus.values()) {
            counts.put(status, 0L);
        }
        execute("count by status", () -> {
            jdbcTemplate.query("SELECT status, count(*) AS total FROM backfill_log GROUP BY status",
                rs -> {
                    counts.put(BackfillStatus.fromDbValue(rs.getString("status")), rs.getLong("total"));
                });
            return counts;
        });
        return counts;
    }

    public BackfillTotals totals() {
        String sql = """
            SELECT count(*) AS months,
                   COALESCE(sum(books_generated), 0) AS books_generated,
                   COALESCE(sum(isbns_resolved), 0) AS isbns_resolved,
                   COALESCE(sum(isbns_queued), 0) AS isbns_queued,
                   COALESCE(sum(synthetic_created), 0) AS synthetic_created,
                   COALESCE(sum(total_api_calls), 0) AS total_api_calls
            FROM backfill_log
            """;
        return execute("totals", () -> jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new BackfillTotals(
            rs.getLong("months"),
            rs.getLong("books_generated"),
            rs.getLong("isbns_resolved"),
            rs.getLong("isbns_queued"),
            rs.getLong("synthetic_created"),
            rs.getLong("total_api_calls"))));
    }

    public List<BackfillMonthRecord> findRecentlyCompleted(int limit) {
        return execute("recent", () -> jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE completed_at IS NOT NULL ORDER BY completed_at DESC LIMIT ?", ROW_MAPPER, limit));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[BACKFILL] Database operation '{}' failed", operation, e);
            throw new BackfillPersistenceException("backfill_log " + operation + " failed", e);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    private static BackfillMonthRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new BackfillMonthRecord(
            rs.getInt("year"),
            rs.getInt("month"),
            BackfillStatus.fromDbValue(rs.getString("status")),
            rs.getInt("retry_count"),
            instant(rs, "started_at"),
            instant(rs, "completed_at"),
            instant(rs, "last_retry_at"),
            rs.getString("error_message"),
            rs.getInt("books_generated"),
            rs.getInt("isbns_resolved"),
            rs.getBigDecimal("resolution_rate"),
            rs.getInt("isbns_queued"),
            rs.getInt("synthetic_created"),
            rs.getString("prompt_variant"),
            rs.getInt("batch_size"),
            rs.getInt("gemini_calls"),
            rs.getInt("xai_calls"),
            rs.getInt("isbndb_calls"),
            rs.getInt("total_api_calls"));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /**
     * Sums across all months.
     */
    public record BackfillTotals(long months,
                                 long booksGenerated,
                                 long isbnsResolved,
                                 long isbnsQueued,
                                 long syntheticCreated,
                                 long totalApiCalls) {
    }
}
