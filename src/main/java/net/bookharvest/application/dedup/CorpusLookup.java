package net.bookharvest.application.dedup;

/**
 * Read access to the stored book corpus for duplicate checks.
 */
public interface CorpusLookup {

    boolean existsByIsbn(String isbn);

    /**
     * Whether a stored work has a title and author similar to the given pair at or above the threshold.
     */
    boolean existsSimilar(String title, String author, double threshold);
}
