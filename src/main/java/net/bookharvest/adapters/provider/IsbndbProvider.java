package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.application.provider.IsbnMatch;
import net.bookharvest.application.provider.IsbnResolver;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderDescriptor;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderFailureKind;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.service.QuotaManager;
import net.bookharvest.service.QuotaReservation;
import net.bookharvest.support.http.ProviderHttpClient;
import net.bookharvest.support.http.ProviderHttpClientConfig;
import net.bookharvest.support.http.ProviderHttpClientFactory;
import net.bookharvest.util.IsbnUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * ISBNdb premium API. Paid and quota-limited: every request counts against the daily budget,
 * including failed ones, so a unit is reserved before the call and committed after it.
 */
@Slf4j
@Component
public class IsbndbProvider implements IsbnResolver {

    public static final String PROVIDER_ID = "isbndb";
    static final String DEFAULT_BASE_URL = "https://api.premium.isbndb.com";
    static final Duration DEFAULT_MIN_SPACING = Duration.ofMillis(333);
    private static final int BASE_CONFIDENCE = 60;

    private final ProviderDescriptor descriptor;
    private final ProviderHttpClient httpClient;
    private final QuotaManager quotaManager;
    private final String apiKey;
    private final String baseUrl;

    @Autowired
    public IsbndbProvider(ProviderProperties properties, ProviderHttpClientFactory clientFactory, QuotaManager quotaManager) {
        this(properties.settingsFor(PROVIDER_ID), quotaManager, settings -> clientFactory.create(
            clientConfigFor(settings), settings.getBurstLimitPerSecond()));
    }

    IsbndbProvider(ProviderProperties.Settings settings,
                   QuotaManager quotaManager,
                   Function<ProviderProperties.Settings, ProviderHttpClient> clientSupplier) {
        this.descriptor = descriptorFor(settings);
        this.quotaManager = quotaManager;
        this.apiKey = settings.getApiKey() == null ? "" : settings.getApiKey().trim();
        this.baseUrl = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl().trim() : DEFAULT_BASE_URL;
        this.httpClient = clientSupplier.apply(settings);
    }

    /**
     * One reserved quota unit pays for exactly one upstream request, so the client never resends.
     */
    static ProviderHttpClientConfig clientConfigFor(ProviderProperties.Settings settings) {
        return ProviderHttpClientConfig.forDescriptor(descriptorFor(settings), "ISBN resolution").withoutRetries();
    }

    static ProviderDescriptor descriptorFor(ProviderProperties.Settings settings) {
        Duration spacing = settings.getMinSpacing().isZero() ? DEFAULT_MIN_SPACING : settings.getMinSpacing();
        return new ProviderDescriptor(PROVIDER_ID, ProviderType.PAID,
            Set.of(ProviderCapability.ISBN_RESOLUTION, ProviderCapability.METADATA_ENRICHMENT, ProviderCapability.COVER_IMAGES),
            settings.getPriority() == 0 ? 100 : settings.getPriority(),
            Map.of(ProviderCapability.ISBN_RESOLUTION, Duration.ofSeconds(15)),
            Duration.ofSeconds(10), settings.getCacheTtl(), spacing);
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isAvailable() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public Optional<IsbnMatch> resolveIsbn(String title, String author, ServiceContext context) {
        if (!isAvailable()) {
            throw new ProviderException(PROVIDER_ID, ProviderFailureKind.CONFIGURATION, "ISBNDB_API_KEY not configured");
        }
        boolean prepaid = context.metadata(QuotaManager.PREPAID_CONTEXT_KEY).map(Boolean::parseBoolean).orElse(false);
        QuotaReservation reservation = null;
        if (!prepaid) {
            reservation = quotaManager.reserve(1).orElseThrow(() -> new ProviderException(PROVIDER_ID,
                ProviderFailureKind.QUOTA_EXHAUSTED, "Daily ISBNdb quota exhausted"));
        }

        String query = (title + " " + (author == null ? "" : author)).trim();
        String url = baseUrl + "/books/" + UriUtils.encodePathSegment(query, StandardCharsets.UTF_8) + "?page=1&pageSize=5";
        Optional<JsonNode> response;
        try {
            response = httpClient.getJson(url, Map.of(HttpHeaders.AUTHORIZATION, apiKey), context);
        } finally {
            if (reservation != null) {
                quotaManager.commit(reservation);
            }
        }

        JsonNode first = response.map(body -> body.path("books").path(0)).orElse(null);
        if (first == null || first.isMissingNode()) {
            return Optional.empty();
        }
        String rawIsbn = StringUtils.hasText(first.path("isbn13").asText()) ? first.path("isbn13").asText() : first.path("isbn").asText();
        Optional<String> isbn = IsbnUtils.toIsbn13(rawIsbn);
        if (isbn.isEmpty()) {
            log.debug("[ISBNDB] First result for '{}' had no usable ISBN", query);
            return Optional.empty();
        }
        List<String> authors = new ArrayList<>();
        first.path("authors").forEach(node -> authors.add(node.asText()));
        String foundTitle = first.path("title").asText();
        int confidence = MatchConfidence.score(BASE_CONFIDENCE, foundTitle, authors, title, author);
        return Optional.of(new IsbnMatch(isbn.get(), foundTitle, authors.isEmpty() ? "" : authors.get(0),
            first.path("publisher").asText(""), first.path("binding").asText(""), confidence));
    }
}
