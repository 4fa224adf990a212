package net.bookharvest.domain.provider;

/**
 * Named kinds of work a provider can perform.
 */
public enum ProviderCapability {
    ISBN_RESOLUTION,
    METADATA_ENRICHMENT,
    COVER_IMAGES,
    AUTHOR_BIOGRAPHY,
    SUBJECT_ENRICHMENT,
    BOOK_GENERATION
}
