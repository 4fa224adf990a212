package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.JsonNode;
import net.bookharvest.application.provider.IsbnMatch;
import net.bookharvest.application.provider.IsbnResolver;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderDescriptor;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.support.http.ProviderHttpClient;
import net.bookharvest.support.http.ProviderHttpClientConfig;
import net.bookharvest.support.http.ProviderHttpClientFactory;
import net.bookharvest.util.IsbnUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Open Library search API. Free, but its documented limit is slow, so calls are spaced 3 seconds apart.
 */
@Component
public class OpenLibraryProvider implements IsbnResolver {

    public static final String PROVIDER_ID = "open-library";
    static final String DEFAULT_BASE_URL = "https://openlibrary.org/search.json";
    static final Duration DEFAULT_MIN_SPACING = Duration.ofMillis(3000);
    private static final String SEARCH_FIELDS = "key,title,author_name,first_publish_year,isbn,edition_count,publisher";
    private static final int BASE_CONFIDENCE = 50;

    private final ProviderDescriptor descriptor;
    private final ProviderHttpClient httpClient;
    private final String baseUrl;

    @Autowired
    public OpenLibraryProvider(ProviderProperties properties, ProviderHttpClientFactory clientFactory) {
        this(properties.settingsFor(PROVIDER_ID), settings -> clientFactory.create(
            ProviderHttpClientConfig.forDescriptor(descriptorFor(settings), "ISBN resolution"),
            settings.getBurstLimitPerSecond()));
    }

    OpenLibraryProvider(ProviderProperties.Settings settings, Function<ProviderProperties.Settings, ProviderHttpClient> clientSupplier) {
        this.descriptor = descriptorFor(settings);
        this.baseUrl = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl().trim() : DEFAULT_BASE_URL;
        this.httpClient = clientSupplier.apply(settings);
    }

    static ProviderDescriptor descriptorFor(ProviderProperties.Settings settings) {
        Duration spacing = settings.getMinSpacing().isZero() ? DEFAULT_MIN_SPACING : settings.getMinSpacing();
        return new ProviderDescriptor(PROVIDER_ID, ProviderType.FREE,
            Set.of(ProviderCapability.ISBN_RESOLUTION, ProviderCapability.METADATA_ENRICHMENT,
                ProviderCapability.COVER_IMAGES, ProviderCapability.AUTHOR_BIOGRAPHY),
            settings.getPriority() == 0 ? 60 : settings.getPriority(),
            Map.of(), Duration.ofSeconds(15), settings.getCacheTtl(), spacing);
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<IsbnMatch> resolveIsbn(String title, String author, ServiceContext context) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl)
            .queryParam("title", title)
            .queryParam("fields", SEARCH_FIELDS)
            .queryParam("limit", 5);
        if (StringUtils.hasText(author)) {
            uri.queryParam("author", author);
        }
        String url = uri.encode().build().toUriString();

        JsonNode doc = httpClient.getJson(url, Map.of(), context)
            .map(body -> body.path("docs").path(0))
            .orElse(null);
        if (doc == null || doc.isMissingNode()) {
            return Optional.empty();
        }
        Optional<String> isbn = IsbnUtils.toIsbn13(doc.path("isbn").path(0).asText(null));
        if (isbn.isEmpty()) {
            return Optional.empty();
        }
        List<String> authors = new ArrayList<>();
        doc.path("author_name").forEach(node -> authors.add(node.asText()));
        String foundTitle = doc.path("title").asText();
        int confidence = MatchConfidence.score(BASE_CONFIDENCE, foundTitle, authors, title, author);
        if (doc.path("edition_count").asInt(0) > 1) {
            confidence = Math.min(100, confidence + 5);
        }
        return Optional.of(new IsbnMatch(isbn.get(), foundTitle, authors.isEmpty() ? "" : authors.get(0),
            doc.path("publisher").path(0).asText(""), "", confidence));
    }
}
