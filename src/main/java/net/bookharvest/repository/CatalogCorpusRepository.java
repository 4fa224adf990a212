package net.bookharvest.repository;

import net.bookharvest.application.dedup.CorpusLookup;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Corpus checks against the stored catalog. Fuzzy matches use {@code pg_trgm} similarity over the
 * lower-cased title and author.
 */
@Repository
public class CatalogCorpusRepository implements CorpusLookup {

    private final JdbcTemplate jdbcTemplate;

    public CatalogCorpusRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean existsByIsbn(String isbn) {
        if (isbn == null || isbn.isBlank()) {
            return false;
        }
        try {
            Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM editions WHERE isbn = ?)", Boolean.class, isbn.trim());
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("ISBN corpus lookup failed for " + isbn, e);
        }
    }

    @Override
    public boolean existsSimilar(String title, String author, double threshold) {
        if (title == null || title.isBlank()) {
            return false;
        }
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM works
                WHERE lower(title) % lower(?)
                  AND similarity(lower(title), lower(?)) >= ?
                  AND similarity(lower(title || ' ' || coalesce(author, '')), lower(?)) >= ?
            )
            """;
        String titleAuthorKey = title + " " + (author == null ? "" : author);
        try {
            Boolean exists = jdbcTemplate.queryForObject(sql, Boolean.class, title, title, threshold,
                titleAuthorKey, threshold);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new BackfillPersistenceException("Fuzzy corpus lookup failed for '" + title + "'", e);
        }
    }
}
