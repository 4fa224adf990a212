package net.bookharvest.support.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.bookharvest.domain.provider.CacheStrategy;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderFailureKind;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.service.DistributedRateLimiter;
import net.bookharvest.support.kv.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderHttpClientTest {

    private static final String URL = "https://api.example.test/books/hobbit";

    private InMemoryKeyValueStore store;
    private Deque<ClientResponse> responses;
    private List<ClientRequest> requests;
    private ProviderHttpClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        responses = new ArrayDeque<>();
        requests = new ArrayList<>();
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(responses.isEmpty() ? json(HttpStatus.OK, "{}") : responses.poll());
            })
            .build();
        ProviderHttpClientConfig config = new ProviderHttpClientConfig("isbndb", Duration.ZERO, Duration.ofHours(1),
            "Test lookups", 2, ProviderHttpClientConfig.DEFAULT_RETRYABLE_STATUSES);
        client = new ProviderHttpClient(config, webClient, store, new DistributedRateLimiter(store, Clock.systemUTC()),
            new ObjectMapper(), new SimpleMeterRegistry(), null, null, Duration.ofMillis(1));
    }

    @Test
    void should_ServeFromCache_When_SameRequestRepeated() {
        responses.add(json(HttpStatus.OK, "{\"total\":1}"));

        Optional<JsonNode> first = client.getJson(URL, Map.of(), ServiceContext.defaults());
        Optional<JsonNode> second = client.getJson(URL, Map.of(), ServiceContext.defaults());

        assertThat(first).isPresent();
        assertThat(second).map(node -> node.path("total").asInt()).contains(1);
        assertThat(requests).hasSize(1);
    }

    @Test
    void should_CallNetworkEachTime_When_CachingDisabledForContext() {
        ServiceContext uncached = ServiceContext.defaults().withCacheStrategy(CacheStrategy.DISABLED);

        client.getJson(URL, Map.of(), uncached);
        client.getJson(URL, Map.of(), uncached);

        assertThat(requests).hasSize(2);
    }

    @Test
    void should_ReturnEmpty_When_UpstreamAnswers404() {
        responses.add(json(HttpStatus.NOT_FOUND, "{\"errorMessage\":\"Not Found\"}"));

        assertThat(client.getJson(URL, Map.of(), ServiceContext.defaults())).isEmpty();
    }

    @Test
    void should_ClassifyAuthenticationFailure_When_Upstream401() {
        responses.add(json(HttpStatus.UNAUTHORIZED, "{}"));

        assertThatThrownBy(() -> client.getJson(URL, Map.of(), ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class)
            .satisfies(error -> assertThat(((ProviderException) error).kind()).isEqualTo(ProviderFailureKind.AUTHENTICATION));
        assertThat(requests).hasSize(1);
    }

    @Test
    void should_RetryAndSucceed_When_FirstAttemptIs503() {
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, ""));
        responses.add(json(HttpStatus.OK, "{\"ok\":true}"));

        Optional<JsonNode> result = client.getJson(URL, Map.of(), ServiceContext.defaults());

        assertThat(result).map(node -> node.path("ok").asBoolean()).contains(true);
        assertThat(requests).hasSize(2);
    }

    @Test
    void should_SendOnce_When_RetriesDisabled() {
        ProviderHttpClientConfig noRetries = new ProviderHttpClientConfig("isbndb", Duration.ZERO, Duration.ZERO,
            "Test lookups", 2, ProviderHttpClientConfig.DEFAULT_RETRYABLE_STATUSES).withoutRetries();
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(responses.poll());
            })
            .build();
        ProviderHttpClient singleShot = new ProviderHttpClient(noRetries, webClient, store,
            new DistributedRateLimiter(store, Clock.systemUTC()), new ObjectMapper(), new SimpleMeterRegistry(),
            null, null, Duration.ofMillis(1));
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, ""));
        responses.add(json(HttpStatus.OK, "{\"ok\":true}"));

        assertThatThrownBy(() -> singleShot.getJson(URL, Map.of(), ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class);
        assertThat(requests).hasSize(1);
        assertThat(responses).hasSize(1);
    }

    @Test
    void should_ReportRateLimited_When_429PersistsThroughRetries() {
        responses.add(json(HttpStatus.TOO_MANY_REQUESTS, ""));
        responses.add(json(HttpStatus.TOO_MANY_REQUESTS, ""));
        responses.add(json(HttpStatus.TOO_MANY_REQUESTS, ""));

        assertThatThrownBy(() -> client.getJson(URL, Map.of(), ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class)
            .satisfies(error -> assertThat(((ProviderException) error).kind()).isEqualTo(ProviderFailureKind.RATE_LIMITED));
        assertThat(requests).hasSize(3);
    }

    @Test
    void should_RejectBody_When_ResponseIsNotJson() {
        responses.add(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
            .body("<html>maintenance</html>")
            .build());

        assertThatThrownBy(() -> client.getJson(URL, Map.of(), ServiceContext.defaults()))
            .isInstanceOf(ProviderException.class)
            .satisfies(error -> assertThat(((ProviderException) error).kind()).isEqualTo(ProviderFailureKind.INVALID_RESPONSE));
    }

    @Test
    void should_StillCallUpstream_When_CacheStoreUnavailable() {
        store.setAvailable(false);
        responses.add(json(HttpStatus.OK, "{\"total\":2}"));

        Optional<JsonNode> result = client.getJson(URL, Map.of(), ServiceContext.defaults());

        assertThat(result).map(node -> node.path("total").asInt()).contains(2);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
