package net.bookharvest.application.provider;

import net.bookharvest.domain.provider.ServiceContext;

import java.util.Optional;

/**
 * Provider capable of {@code ISBN_RESOLUTION}.
 */
public interface IsbnResolver extends BookProvider {

    /**
     * @return the best match, or empty when the provider has no match
     * @throws net.bookharvest.domain.provider.ProviderException on any failure other than "no match"
     */
    Optional<IsbnMatch> resolveIsbn(String title, String author, ServiceContext context);
}
