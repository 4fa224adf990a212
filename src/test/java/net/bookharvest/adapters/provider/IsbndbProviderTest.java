package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.bookharvest.application.provider.IsbnMatch;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderFailureKind;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.service.QuotaManager;
import net.bookharvest.support.MutableClock;
import net.bookharvest.service.DistributedRateLimiter;
import net.bookharvest.support.http.ProviderHttpClient;
import net.bookharvest.support.http.ProviderHttpClientConfig;
import net.bookharvest.support.kv.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IsbndbProviderTest {

    private static final String RESPONSE = """
        {"total": 1, "books": [{
          "title": "Tomorrow, and Tomorrow, and Tomorrow: A novel",
          "isbn13": "9780593321201",
          "isbn": "0593321200",
          "authors": ["Zevin, Gabrielle", "Gabrielle Zevin"],
          "publisher": "Knopf",
          "binding": "Hardcover"
        }]}
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProviderHttpClient httpClient;
    private QuotaManager quotaManager;
    private ProviderProperties.Settings settings;

    @BeforeEach
    void setUp() {
        httpClient = mock(ProviderHttpClient.class);
        quotaManager = new QuotaManager(new InMemoryKeyValueStore(), new MutableClock(Instant.parse("2024-05-01T12:00:00Z")),
            new SimpleMeterRegistry(), 10, 2, 5);
        settings = new ProviderProperties.Settings();
        settings.setApiKey("test-key");
    }

    private IsbndbProvider provider() {
        return new IsbndbProvider(settings, quotaManager, ignored -> httpClient);
    }

    @Test
    void should_ScoreMatchAndChargeQuota_When_FirstResultHasIsbn() throws Exception {
        when(httpClient.getJson(startsWith(IsbndbProvider.DEFAULT_BASE_URL + "/books/"), anyMap(), any()))
            .thenReturn(Optional.of(objectMapper.readTree(RESPONSE)));

        Optional<IsbnMatch> match = provider().resolveIsbn("Tomorrow, and Tomorrow, and Tomorrow", "Gabrielle Zevin",
            ServiceContext.defaults());

        assertThat(match).get().satisfies(found -> {
            assertThat(found.isbn()).isEqualTo("9780593321201");
            assertThat(found.publisher()).isEqualTo("Knopf");
            assertThat(found.format()).isEqualTo("Hardcover");
            assertThat(found.confidence()).isEqualTo(100);
        });
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(1);
    }

    @Test
    void should_SkipOwnReservation_When_CallerPrepaidQuota() {
        when(httpClient.getJson(anyString(), anyMap(), any())).thenReturn(Optional.empty());
        ServiceContext prepaid = ServiceContext.defaults().withMetadata(QuotaManager.PREPAID_CONTEXT_KEY, "true");

        assertThat(provider().resolveIsbn("Trust", "Hernan Diaz", prepaid)).isEmpty();
        assertThat(quotaManager.getStatus().usedToday()).isZero();
    }

    @Test
    void should_ThrowQuotaExhausted_When_ReservationRejected() {
        for (int i = 0; i < 8; i++) {
            assertThat(quotaManager.reserve(1)).isPresent();
        }

        assertThatThrownBy(() -> provider().resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults()))
            .isInstanceOfSatisfying(ProviderException.class,
                failure -> assertThat(failure.kind()).isEqualTo(ProviderFailureKind.QUOTA_EXHAUSTED));
        verifyNoInteractions(httpClient);
    }

    @Test
    void should_StillChargeQuota_When_RequestFails() {
        when(httpClient.getJson(anyString(), anyMap(), any()))
            .thenThrow(new ProviderException("isbndb", ProviderFailureKind.UPSTREAM, "502"));

        assertThatThrownBy(() -> provider().resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class);
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(1);
    }

    @Test
    void should_ReturnEmpty_When_NoBooksReturned() throws Exception {
        when(httpClient.getJson(anyString(), anyMap(), any()))
            .thenReturn(Optional.of(objectMapper.readTree("{\"total\": 0, \"books\": []}")));

        assertThat(provider().resolveIsbn("Unknown Title", "", ServiceContext.defaults())).isEmpty();
    }

    @Test
    void should_ReportUnavailableAndFailFatally_When_ApiKeyMissing() {
        settings.setApiKey("  ");
        IsbndbProvider provider = provider();

        assertThat(provider.isAvailable()).isFalse();
        assertThatThrownBy(() -> provider.resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults()))
            .isInstanceOfSatisfying(ProviderException.class, failure -> assertThat(failure.isFatal()).isTrue());
    }

    @Test
    void should_SendApiKeyHeader_When_Calling() {
        when(httpClient.getJson(anyString(), anyMap(), any())).thenReturn(Optional.empty());

        provider().resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults());

        verify(httpClient).getJson(startsWith("https://api.premium.isbndb.com/books/Trust%20Hernan%20Diaz"),
            eq(Map.of("Authorization", "test-key")), any());
    }

    @Test
    void should_DisableRetries_When_BuildingHttpClientConfig() {
        ProviderHttpClientConfig config = IsbndbProvider.clientConfigFor(settings);

        assertThat(config.providerName()).isEqualTo(IsbndbProvider.PROVIDER_ID);
        assertThat(config.maxRetries()).isZero();
    }

    @Test
    void should_SendSingleRequestPerQuotaUnit_When_UpstreamAnswers503() {
        Deque<ClientResponse> responses = new ArrayDeque<>();
        for (int i = 0; i < 3; i++) {
            responses.add(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
        }
        responses.add(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(RESPONSE)
            .build());
        AtomicInteger requests = new AtomicInteger();
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.incrementAndGet();
                return Mono.just(responses.poll());
            })
            .build();
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        IsbndbProvider provider = new IsbndbProvider(settings, quotaManager, clientSettings -> new ProviderHttpClient(
            IsbndbProvider.clientConfigFor(clientSettings), webClient, store,
            new DistributedRateLimiter(store, Clock.systemUTC()), objectMapper, new SimpleMeterRegistry(), null, null));

        assertThatThrownBy(() -> provider.resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class);
        assertThat(requests).hasValue(1);
        assertThat(quotaManager.getStatus().usedToday()).isEqualTo(1);
    }
}
