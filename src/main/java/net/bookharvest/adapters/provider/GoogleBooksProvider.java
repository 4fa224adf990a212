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
 * Google Books volumes search. Free; an API key raises the anonymous limits but is optional.
 */
@Component
public class GoogleBooksProvider implements IsbnResolver {

    public static final String PROVIDER_ID = "google-books";
    static final String DEFAULT_BASE_URL = "https://www.googleapis.com/books/v1/volumes";
    static final Duration DEFAULT_MIN_SPACING = Duration.ofMillis(1000);
    private static final int BASE_CONFIDENCE = 50;

    private final ProviderDescriptor descriptor;
    private final ProviderHttpClient httpClient;
    private final String apiKey;
    private final String baseUrl;

    @Autowired
    public GoogleBooksProvider(ProviderProperties properties, ProviderHttpClientFactory clientFactory) {
        this(properties.settingsFor(PROVIDER_ID), settings -> clientFactory.create(
            ProviderHttpClientConfig.forDescriptor(descriptorFor(settings), "ISBN resolution"),
            settings.getBurstLimitPerSecond()));
    }

    GoogleBooksProvider(ProviderProperties.Settings settings, Function<ProviderProperties.Settings, ProviderHttpClient> clientSupplier) {
        this.descriptor = descriptorFor(settings);
        this.apiKey = settings.getApiKey() == null ? "" : settings.getApiKey().trim();
        this.baseUrl = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl().trim() : DEFAULT_BASE_URL;
        this.httpClient = clientSupplier.apply(settings);
    }

    static ProviderDescriptor descriptorFor(ProviderProperties.Settings settings) {
        Duration spacing = settings.getMinSpacing().isZero() ? DEFAULT_MIN_SPACING : settings.getMinSpacing();
        return new ProviderDescriptor(PROVIDER_ID, ProviderType.FREE,
            Set.of(ProviderCapability.ISBN_RESOLUTION, ProviderCapability.METADATA_ENRICHMENT,
                ProviderCapability.COVER_IMAGES, ProviderCapability.SUBJECT_ENRICHMENT),
            settings.getPriority() == 0 ? 80 : settings.getPriority(),
            Map.of(), Duration.ofSeconds(10), settings.getCacheTtl(), spacing);
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
        StringBuilder query = new StringBuilder("intitle:").append(title);
        if (StringUtils.hasText(author)) {
            query.append("+inauthor:").append(author);
        }
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl)
            .queryParam("q", query)
            .queryParam("maxResults", 1);
        if (StringUtils.hasText(apiKey)) {
            uri.queryParam("key", apiKey);
        }
        String url = uri.encode().build().toUriString();

        JsonNode volumeInfo = httpClient.getJson(url, Map.of(), context)
            .map(body -> body.path("items").path(0).path("volumeInfo"))
            .orElse(null);
        if (volumeInfo == null || volumeInfo.isMissingNode()) {
            return Optional.empty();
        }

        String isbn13 = null;
        String isbn10 = null;
        for (JsonNode identifier : volumeInfo.path("industryIdentifiers")) {
            String type = identifier.path("type").asText();
            if ("ISBN_13".equals(type)) {
                isbn13 = identifier.path("identifier").asText();
            } else if ("ISBN_10".equals(type)) {
                isbn10 = identifier.path("identifier").asText();
            }
        }
        Optional<String> isbn = IsbnUtils.toIsbn13(isbn13 != null ? isbn13 : isbn10);
        if (isbn.isEmpty()) {
            return Optional.empty();
        }
        List<String> authors = new ArrayList<>();
        volumeInfo.path("authors").forEach(node -> authors.add(node.asText()));
        String foundTitle = volumeInfo.path("title").asText();
        int confidence = MatchConfidence.score(BASE_CONFIDENCE, foundTitle, authors, title, author);
        return Optional.of(new IsbnMatch(isbn.get(), foundTitle, authors.isEmpty() ? "" : authors.get(0),
            volumeInfo.path("publisher").asText(""), volumeInfo.path("printType").asText(""), confidence));
    }
}
