package net.bookharvest.application.provider;

/**
 * One ISBN hit returned by a resolver.
 *
 * @param isbn       ISBN-13 preferred, ISBN-10 otherwise
 * @param title      title reported by the provider
 * @param author     first author reported by the provider, may be blank
 * @param publisher  publisher reported by the provider, may be blank
 * @param format     binding or format, may be blank
 * @param confidence 0..100
 */
public record IsbnMatch(String isbn, String title, String author, String publisher, String format, int confidence) {

    public IsbnMatch {
        title = title == null ? "" : title;
        author = author == null ? "" : author;
        publisher = publisher == null ? "" : publisher;
        format = format == null ? "" : format;
    }
}
