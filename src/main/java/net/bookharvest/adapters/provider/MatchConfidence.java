package net.bookharvest.adapters.provider;

import java.util.Collection;
import java.util.Locale;

/**
 * Title/author containment scoring shared by the HTTP resolvers.
 */
final class MatchConfidence {

    private MatchConfidence() {
    }

    static int score(int base, String foundTitle, Collection<String> foundAuthors, String title, String author) {
        int confidence = base;
        if (contains(foundTitle, title)) {
            confidence += 20;
        }
        if (author != null && !author.isBlank() && foundAuthors.stream().anyMatch(found -> contains(found, author))) {
            confidence += 20;
        }
        return Math.min(confidence, 100);
    }

    private static boolean contains(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isBlank()) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT).trim());
    }
}
