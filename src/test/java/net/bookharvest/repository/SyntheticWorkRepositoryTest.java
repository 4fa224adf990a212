package net.bookharvest.repository;

import net.bookharvest.domain.backfill.CandidateBook;
import net.bookharvest.support.PostgresTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class SyntheticWorkRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(PostgresTestDatabase.IMAGE);

    private JdbcTemplate jdbcTemplate;
    private SyntheticWorkRepository repository;
    private CatalogCorpusRepository corpus;

    @BeforeEach
    void setUp() {
        jdbcTemplate = PostgresTestDatabase.initialize(PostgresTestDatabase.dataSource(postgres));
        repository = new SyntheticWorkRepository(jdbcTemplate);
        corpus = new CatalogCorpusRepository(jdbcTemplate);
    }

    private static CandidateBook book(String title, String author) {
        return new CandidateBook(title, author, 2023, "Hardcover", "Knopf", null, "gemini", "Booker shortlist", 70);
    }

    @Test
    void should_BuildNormalizedKey_When_TitleAndAuthorGiven() {
        assertThat(SyntheticWorkRepository.workKey("The Bee Sting!", "Paul Murray"))
            .isEqualTo("synthetic:bee-sting:paul-murray");
        assertThat(SyntheticWorkRepository.workKey("Untitled", " ")).isEqualTo("synthetic:untitled:unknown");
        assertThat(SyntheticWorkRepository.workKey("x".repeat(80), "y".repeat(40)))
            .isEqualTo("synthetic:" + "x".repeat(50) + ":" + "y".repeat(30));
    }

    @Test
    void should_InsertOnce_When_SameBookGeneratedTwice() {
        assertThat(repository.insertSynthetic(book("The Bee Sting", "Paul Murray"), "job-1")).isTrue();
        assertThat(repository.insertSynthetic(book("The Bee Sting", "Paul Murray"), "job-2")).isFalse();

        Integer completeness = jdbcTemplate.queryForObject(
            "SELECT completeness_score FROM works WHERE work_key = ?", Integer.class, "synthetic:bee-sting:paul-murray");
        assertThat(completeness).isEqualTo(SyntheticWorkRepository.SYNTHETIC_COMPLETENESS);
        assertThat(repository.countSynthetic()).isEqualTo(1);
    }

    @Test
    void should_PromoteWorkAndExposeEdition_When_Enhanced() {
        repository.insertSynthetic(book("Prophet Song", "Paul Lynch"), "job-1");
        String key = SyntheticWorkRepository.workKey("Prophet Song", "Paul Lynch");
        assertThat(repository.findEnhancementCandidates(10)).extracting(SyntheticWorkRepository.SyntheticWork::workKey)
            .containsExactly(key);

        assertThat(repository.markEnhanced(key, "9780802163004", "isbndb", 90)).isTrue();

        assertThat(repository.findEnhancementCandidates(10)).isEmpty();
        assertThat(repository.countSynthetic()).isZero();
        assertThat(corpus.existsByIsbn("9780802163004")).isTrue();
        Integer completeness = jdbcTemplate.queryForObject(
            "SELECT completeness_score FROM works WHERE work_key = ?", Integer.class, key);
        assertThat(completeness).isEqualTo(SyntheticWorkRepository.ENHANCED_COMPLETENESS);
    }

    @Test
    void should_LeaveWorkSynthetic_When_IsbnAlreadyBelongsToAnotherWork() {
        repository.insertSynthetic(book("Prophet Song", "Paul Lynch"), "job-1");
        repository.insertSynthetic(book("Prophet Song: A Novel", "Paul Lynch"), "job-2");
        String owner = SyntheticWorkRepository.workKey("Prophet Song", "Paul Lynch");
        String duplicate = SyntheticWorkRepository.workKey("Prophet Song: A Novel", "Paul Lynch");
        assertThat(repository.markEnhanced(owner, "9780802163004", "isbndb", 90)).isTrue();

        assertThat(repository.markEnhanced(duplicate, "9780802163004", "isbndb", 90)).isFalse();

        Integer completeness = jdbcTemplate.queryForObject(
            "SELECT completeness_score FROM works WHERE work_key = ?", Integer.class, duplicate);
        assertThat(completeness).isEqualTo(SyntheticWorkRepository.SYNTHETIC_COMPLETENESS);
        String editionOwner = jdbcTemplate.queryForObject(
            "SELECT work_key FROM editions WHERE isbn = ?", String.class, "9780802163004");
        assertThat(editionOwner).isEqualTo(owner);
        assertThat(repository.countSynthetic()).isEqualTo(1);
        assertThat(repository.findEnhancementCandidates(10)).isEmpty();
    }

    @Test
    void should_SkipUntilCooldownEnds_When_LookupFoundNothing() {
        repository.insertSynthetic(book("Western Lane", "Chetna Maroo"), "job-1");
        String key = SyntheticWorkRepository.workKey("Western Lane", "Chetna Maroo");

        repository.markSyncAttempt(key);
        assertThat(repository.findEnhancementCandidates(10)).isEmpty();

        jdbcTemplate.update("UPDATE works SET last_isbndb_sync = now() - interval '8 days' WHERE work_key = ?", key);
        assertThat(repository.findEnhancementCandidates(10)).hasSize(1);
    }

    @Test
    void should_FindSimilarStoredWork_When_TitleSlightlyDiffers() {
        repository.insertSynthetic(book("The Bee Sting", "Paul Murray"), "job-1");

        assertThat(corpus.existsSimilar("The Bee Sting", "Paul Murray", 0.6)).isTrue();
        assertThat(corpus.existsSimilar("Bee Sting", "Paul Murray", 0.6)).isTrue();
        assertThat(corpus.existsSimilar("Study for Obedience", "Sarah Bernstein", 0.6)).isFalse();
        assertThat(corpus.existsByIsbn("9780000000000")).isFalse();
        assertThat(corpus.existsByIsbn(" ")).isFalse();
    }
}
