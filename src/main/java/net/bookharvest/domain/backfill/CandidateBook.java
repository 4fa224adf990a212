package net.bookharvest.domain.backfill;

import java.util.Objects;

/**
 * A book proposed by a generative provider, before ISBN resolution.
 *
 * @param title        title as generated
 * @param author       primary author
 * @param year         publication year, or {@code null} when unknown
 * @param format       format hint such as {@code hardcover}; may be blank
 * @param publisher    publisher hint; may be blank
 * @param isbn         ISBN-13 or ISBN-10 once resolved, otherwise {@code null}
 * @param source       provider id that proposed or resolved the book
 * @param significance short note on why the book matters
 * @param confidence   0..100
 */
public record CandidateBook(String title,
                            String author,
                            Integer year,
                            String format,
                            String publisher,
                            String isbn,
                            String source,
                            String significance,
                            int confidence) {

    public CandidateBook {
        Objects.requireNonNull(title, "title");
        author = author == null ? "" : author;
        format = format == null ? "" : format;
        publisher = publisher == null ? "" : publisher;
        significance = significance == null ? "" : significance;
        confidence = Math.max(0, Math.min(100, confidence));
    }

    public boolean hasIsbn() {
        return isbn != null && !isbn.isBlank();
    }

    public CandidateBook withIsbn(String resolvedIsbn, String resolvedBy) {
        return new CandidateBook(title, author, year, format, publisher, resolvedIsbn, resolvedBy, significance, confidence);
    }
}
