package net.bookharvest.application.dedup;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Title and author normalization plus Levenshtein similarity used to spot duplicate books.
 */
public final class StringSimilarity {

    /** Pairs at or above this score are treated as the same book. */
    public static final double DEFAULT_THRESHOLD = 0.6;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern ARTICLES = Pattern.compile("\\b(a|an|the)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SUBTITLE_SEPARATOR = Pattern.compile(":|\\s-\\s");

    private StringSimilarity() {}

    /**
     * Lowercase, strip accents and punctuation, drop English articles, collapse whitespace.
     * Example: "The Hobbit: There and Back Again" becomes "hobbit there and back again".
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(value.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        stripped = NON_ALPHANUMERIC.matcher(stripped).replaceAll("");
        stripped = ARTICLES.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Title text before the first {@code :} or {@code " - "}.
     */
    public static String primaryTitle(String title) {
        if (title == null) {
            return "";
        }
        return SUBTITLE_SEPARATOR.split(title, 2)[0];
    }

    public static int levenshteinDistance(String left, String right) {
        if (left.isEmpty()) {
            return right.length();
        }
        if (right.isEmpty()) {
            return left.length();
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 0; i < left.length(); i++) {
            current[0] = i + 1;
            for (int j = 0; j < right.length(); j++) {
                int substitution = previous[j] + (left.charAt(i) == right.charAt(j) ? 0 : 1);
                current[j + 1] = Math.min(Math.min(current[j] + 1, previous[j + 1] + 1), substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /**
     * {@code 1 - distance / maxLength}; two empty strings are identical.
     */
    public static double ratio(String left, String right) {
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshteinDistance(left, right) / maxLength;
    }

    /**
     * Similarity of two books: the better of the full "title author" key and the primary-title key,
     * so subtitle variants of one book score as near-identical. The score is capped by the title-only
     * similarity, so different titles by one author stay apart.
     */
    public static double bookSimilarity(String titleA, String authorA, String titleB, String authorB) {
        String normalizedAuthorA = normalize(authorA);
        String normalizedAuthorB = normalize(authorB);
        String fullTitleA = normalize(titleA);
        String fullTitleB = normalize(titleB);
        String primaryTitleA = normalize(primaryTitle(titleA));
        String primaryTitleB = normalize(primaryTitle(titleB));

        double keyScore = Math.max(
            ratio(key(fullTitleA, normalizedAuthorA), key(fullTitleB, normalizedAuthorB)),
            ratio(key(primaryTitleA, normalizedAuthorA), key(primaryTitleB, normalizedAuthorB)));
        double titleScore = Math.max(ratio(fullTitleA, fullTitleB), ratio(primaryTitleA, primaryTitleB));
        return Math.min(keyScore, titleScore);
    }

    private static String key(String title, String author) {
        return author.isEmpty() ? title : title + " " + author;
    }
}
