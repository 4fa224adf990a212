package net.bookharvest.application.provider;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Provider-agnostic prompts for book generation.
 *
 * <p>Only the registered variants can be requested; an unknown name is rejected rather than passed to
 * a model.</p>
 */
public final class BookGenerationPrompts {

    public static final String SYSTEM_PROMPT = """
        You are a bibliographic archivist producing book metadata.
        Only include books you can identify with confidence; never invent publishers or formats.
        Every book needs a title, an author, a format and a publication year.
        Return ONLY a strict JSON array of objects with this exact shape:
        {
          "title": string,
          "author": string,
          "publisher": string,
          "format": "Hardcover" | "Paperback" | "eBook" | "Audiobook" | "Unknown",
          "publication_year": number,
          "significance": string
        }
        No markdown, no prose outside JSON, no extra keys.
        """;

    private static final List<String> GENRES = List.of("literary fiction", "mystery", "science fiction",
        "fantasy", "romance", "thriller", "historical fiction", "non-fiction", "biography", "science",
        "self-help", "history");

    private BookGenerationPrompts() {}

    /**
     * Registered prompt variants.
     */
    public enum Variant {
        BASELINE("baseline"),
        CONTEMPORARY_NOTABLE("contemporary-notable"),
        ANNUAL("annual"),
        DIVERSITY_EMPHASIS("diversity-emphasis"),
        OVERLOOKED_SIGNIFICANCE("overlooked-significance"),
        GENRE_ROTATION("genre-rotation"),
        ERA_CONTEXTUALIZED("era-contextualized");

        private final String wireName;

        Variant(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /**
         * @throws IllegalArgumentException for unregistered names
         */
        public static Variant fromWireName(String name) {
            if (name == null || name.isBlank()) {
                return BASELINE;
            }
            for (Variant variant : values()) {
                if (variant.wireName.equals(name.trim())) {
                    return variant;
                }
            }
            String valid = Arrays.stream(values()).map(Variant::wireName).collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid prompt variant: \"" + name + "\". Valid variants: " + valid);
        }

        /**
         * Default variant for a backfill month: recent years favour books that are notable now.
         */
        public static Variant forYear(int year) {
            return year >= 2020 ? CONTEMPORARY_NOTABLE : BASELINE;
        }
    }

    /**
     * Builds the user prompt for a request.
     *
     * @throws IllegalArgumentException when the variant is unknown or a monthly variant has no month
     */
    public static String userPrompt(BookGenerationRequest request) {
        Variant variant = Variant.fromWireName(request.promptVariant());
        int year = request.year();
        int limit = request.limit();
        if (variant == Variant.ANNUAL) {
            return annual(year, limit);
        }
        if (request.month() == null) {
            throw new IllegalArgumentException("Prompt variant " + variant.wireName() + " requires a month");
        }
        String monthName = Month.of(request.month()).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        return switch (variant) {
            case BASELINE -> baseline(monthName, year, limit);
            case CONTEMPORARY_NOTABLE -> contemporaryNotable(monthName, year, limit);
            case DIVERSITY_EMPHASIS -> diversity(monthName, year, limit);
            case OVERLOOKED_SIGNIFICANCE -> overlooked(monthName, year, limit);
            case GENRE_ROTATION -> genre(monthName, year, limit, GENRES.get(request.month() % GENRES.size()));
            case ERA_CONTEXTUALIZED -> era(monthName, year, limit);
            case ANNUAL -> annual(year, limit);
        };
    }

    private static String baseline(String monthName, int year, int limit) {
        return """
            List exactly %d historically significant books first published in %s %d.

            Prefer, in no particular order:
            - NYT bestsellers, fiction and non-fiction
            - Winners of major literary awards (Pulitzer, Booker, Hugo, National Book Award)
            - Breakthrough debuts and high-selling genre fiction
            - Influential memoir, history, science and politics

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, monthName, year, year);
    }

    private static String contemporaryNotable(String monthName, int year, int limit) {
        return """
            List exactly %d notable books first published in %s %d.

            These are recent releases, so favour books with verifiable signals already:
            - Bestseller list appearances or strong first-year sales
            - Award shortlists and major review coverage
            - Adaptations announced or widely discussed debuts

            Skip books whose publication month you cannot confirm.
            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, monthName, year, year);
    }

    private static String annual(int year, int limit) {
        return """
            List the %d most culturally significant books first published in %d.

            Cover a mix of literary fiction, commercial bestsellers, genre fiction and non-fiction.
            Favour award winners, genre-defining works and breakout authors.

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, year, year);
    }

    private static String diversity(String monthName, int year, int limit) {
        return """
            List exactly %d culturally significant books first published in %s %d.

            Prioritize non-English editions, small and independent publishers, regional presses and
            translated works. Avoid mainstream bestsellers from the largest publishing groups.
            Aim for at least a third non-US/UK titles.

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, monthName, year, year);
    }

    private static String overlooked(String monthName, int year, int limit) {
        return """
            List exactly %d books first published in %s %d that mattered but were not bestsellers.

            Think critical darlings, award nominees, cult classics and academic works with lasting influence.
            Avoid NYT bestseller list books, celebrity books and movie tie-ins.

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, monthName, year, year);
    }

    private static String genre(String monthName, int year, int limit, String genre) {
        return """
            List exactly %d of the most significant %s books first published in %s %d.

            Include genre award winners and nominees, breakout hits and critically acclaimed works.

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, genre, monthName, year, year);
    }

    private static String era(String monthName, int year, int limit) {
        String context;
        if (year >= 2020) {
            context = "responded to the pandemic, social justice movements or digital transformation";
        } else if (year >= 2010) {
            context = "engaged with social media culture or economic uncertainty";
        } else if (year >= 2000) {
            context = "addressed post-9/11 concerns or early internet culture";
        } else if (year >= 1990) {
            context = "reflected the end of the Cold War or the tech boom";
        } else {
            context = "captured the cultural and political landscape of the " + (year / 10 * 10) + "s";
        }
        return """
            List exactly %d books first published in %s %d that %s.

            Favour books that now read as documents of their era.

            Use %d as publication_year for every book.
            Return ONLY the JSON array.
            """.formatted(limit, monthName, year, context, year);
    }
}
