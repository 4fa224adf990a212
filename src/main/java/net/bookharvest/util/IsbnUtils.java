package net.bookharvest.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shared helpers for normalizing ISBN input before lookups or persistence.
 */
public final class IsbnUtils {

    private static final Pattern NON_ISBN_CHARACTERS = Pattern.compile("[^0-9Xx]");
    private static final Pattern ISBN_13 = Pattern.compile("\\d{13}");
    private static final Pattern ISBN_10 = Pattern.compile("\\d{9}[\\dX]");

    private IsbnUtils() {
    }

    /**
     * Removes everything except digits and the X check digit, uppercased.
     *
     * @return cleaned ISBN string, or {@code null} if nothing usable remains
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NON_ISBN_CHARACTERS.matcher(raw).replaceAll("");
        if (cleaned.isBlank()) {
            return null;
        }
        return cleaned.toUpperCase(Locale.ROOT);
    }

    public static boolean isValidIsbn13(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null && ISBN_13.matcher(cleaned).matches();
    }

    public static boolean isValidIsbn10(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null && ISBN_10.matcher(cleaned).matches();
    }

    /**
     * Normalizes to ISBN-13, converting a valid ISBN-10 with the 978 prefix.
     */
    public static Optional<String> toIsbn13(String raw) {
        String cleaned = sanitize(raw);
        if (cleaned == null) {
            return Optional.empty();
        }
        if (ISBN_13.matcher(cleaned).matches()) {
            return Optional.of(cleaned);
        }
        if (!ISBN_10.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        String body = "978" + cleaned.substring(0, 9);
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            int digit = body.charAt(i) - '0';
            sum += (i % 2 == 0) ? digit : digit * 3;
        }
        int check = (10 - (sum % 10)) % 10;
        return Optional.of(body + check);
    }
}
