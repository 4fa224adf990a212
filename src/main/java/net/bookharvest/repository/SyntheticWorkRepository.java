package net.bookharvest.repository;

import net.bookharvest.application.dedup.StringSimilarity;
import net.bookharvest.domain.backfill.CandidateBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

/**
 * Writes placeholder works for generated books that no provider could resolve to an ISBN, and
 * promotes them once a later lookup succeeds.
 *
 * <p>Synthetic works start at completeness 30 and are tagged {@code gemini-backfill}. They are
 * keyed by normalized title and author so the same book generated twice maps to one row.</p>
 */
@Repository
public class SyntheticWorkRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyntheticWorkRepository.class);

    public static final String SYNTHETIC_PROVIDER = "gemini-backfill";
    public static final int SYNTHETIC_COMPLETENESS = 30;
    public static final int ENHANCED_COMPLETENESS = 80;
    static final int ENHANCEMENT_THRESHOLD = 50;
    static final Duration SYNC_COOLDOWN = Duration.ofDays(7);

    private static final int TITLE_KEY_LENGTH = 50;
    private static final int AUTHOR_KEY_LENGTH = 30;

    private final JdbcTemplate jdbcTemplate;

    public SyntheticWorkRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Stable key for a synthetic work: {@code synthetic:<title>:<author>} with both parts normalized,
     * spaces turned into hyphens and truncated.
     */
    public static String workKey(String title, String author) {
        return "synthetic:" + keyPart(title, TITLE_KEY_LENGTH) + ":" + keyPart(author, AUTHOR_KEY_LENGTH);
    }

    /**
     * @return {@code true} when a new row was written, {@code false} when the work already existed
     */
    public boolean insertSynthetic(CandidateBook book, String jobId) {
        String sql = """
            INSERT INTO works (work_key, title, author, publication_year, publisher, format, significance,
                               synthetic, completeness_score, primary_provider, source_job_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, true, ?, ?, ?)
            ON CONFLICT (work_key) DO NOTHING
            """;
        String key = workKey(book.title(), book.author());
        try {
            int inserted = jdbcTemplate.update(sql,
                key,
                book.title(),
                blankToNull(book.author()),
                book.year(),
                blankToNull(book.publisher()),
                blankToNull(book.format()),
                blankToNull(book.significance()),
                SYNTHETIC_COMPLETENESS,
                SYNTHETIC_PROVIDER,
                jobId);
            return inserted == 1;
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Failed to insert synthetic work " + key, e);
        }
    }

    /**
     * Synthetic works below the enhancement threshold whose last ISBN lookup is missing or older than
     * a week, oldest first.
     */
    public List<SyntheticWork> findEnhancementCandidates(int limit) {
        String sql = """
            SELECT work_key, title, author, publication_year
            FROM works
            WHERE synthetic
              AND completeness_score < ?
              AND (last_isbndb_sync IS NULL OR last_isbndb_sync < now() - make_interval(days => ?))
            ORDER BY created_at ASC
            LIMIT ?
            """;
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> new SyntheticWork(
                rs.getString("work_key"),
                rs.getString("title"),
                rs.getString("author"),
                (Integer) rs.getObject("publication_year")),
                ENHANCEMENT_THRESHOLD, (int) SYNC_COOLDOWN.toDays(), limit);
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Failed to load synthetic enhancement candidates", e);
        }
    }

    /**
     * Attaches a resolved edition and raises the work's completeness. When the ISBN is already an
     * edition of another work, the work stays synthetic and only the lookup is stamped.
     *
     * @return {@code true} when this work now owns an edition with the ISBN
     */
    @Transactional
    public boolean markEnhanced(String workKey, String isbn, String provider, int confidence) {
        try {
            jdbcTemplate.update("""
                INSERT INTO editions (isbn, work_key, title, primary_provider, confidence)
                SELECT ?, work_key, title, ?, ? FROM works WHERE work_key = ?
                ON CONFLICT (isbn) DO NOTHING
                """, isbn, provider, confidence, workKey);
            int promoted = jdbcTemplate.update("""
                UPDATE works
                SET completeness_score = GREATEST(completeness_score, ?),
                    primary_provider = ?,
                    last_isbndb_sync = now(),
                    updated_at = now()
                WHERE work_key = ?
                  AND EXISTS (SELECT 1 FROM editions e WHERE e.isbn = ? AND e.work_key = works.work_key)
                """, ENHANCED_COMPLETENESS, provider, workKey, isbn);
            if (promoted == 0) {
                jdbcTemplate.update("UPDATE works SET last_isbndb_sync = now(), updated_at = now() WHERE work_key = ?",
                    workKey);
                LOGGER.warn("ISBN {} already belongs to another work; {} left synthetic", isbn, workKey);
                return false;
            }
            LOGGER.info("Enhanced synthetic work {} with ISBN {} from {}", workKey, isbn, provider);
            return true;
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Failed to enhance synthetic work " + workKey, e);
        }
    }

    /**
     * Stamps a lookup that found nothing so the work is not retried before the cooldown ends.
     */
    public void markSyncAttempt(String workKey) {
        try {
            jdbcTemplate.update("UPDATE works SET last_isbndb_sync = now(), updated_at = now() WHERE work_key = ?", workKey);
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Failed to stamp sync attempt for " + workKey, e);
        }
    }

    public long countSynthetic() {
        try {
            Long count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM works WHERE synthetic AND completeness_score < ?", Long.class, ENHANCEMENT_THRESHOLD);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Failed to count synthetic works", e);
        }
    }

    private static String keyPart(String value, int maxLength) {
        String normalized = StringSimilarity.normalize(value).replace(' ', '-');
        if (normalized.isEmpty()) {
            return "unknown";
        }
        return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * A synthetic work awaiting ISBN enhancement.
     */
    public record SyntheticWork(String workKey, String title, String author, Integer publicationYear) {
    }
}
