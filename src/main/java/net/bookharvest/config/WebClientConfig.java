/**
 * Configuration for WebClient
 * - Defines the shared builder used by every HTTP-backed provider
 * - Sets up default timeouts and connection settings
 */
package net.bookharvest.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Per-request timeouts are applied by {@code ProviderHttpClient}; these are the outer bounds
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     *
     * @param connectTimeoutMillis TCP connect timeout
     * @param ioTimeoutSeconds read, write and response timeout
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${app.http.connect-timeout-ms:5000}") int connectTimeoutMillis,
            @Value("${app.http.io-timeout-seconds:20}") int ioTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(ioTimeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(ioTimeoutSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(ioTimeoutSeconds));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
