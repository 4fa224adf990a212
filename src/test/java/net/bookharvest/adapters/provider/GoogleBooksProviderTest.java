package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bookharvest.application.provider.IsbnMatch;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.support.http.ProviderHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GoogleBooksProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProviderHttpClient httpClient;
    private ProviderProperties.Settings settings;

    @BeforeEach
    void setUp() {
        httpClient = mock(ProviderHttpClient.class);
        settings = new ProviderProperties.Settings();
    }

    private GoogleBooksProvider provider() {
        return new GoogleBooksProvider(settings, ignored -> httpClient);
    }

    @Test
    void should_ConvertIsbn10AndScore_When_OnlyIsbn10Listed() throws Exception {
        when(httpClient.getJson(anyString(), anyMap(), any())).thenReturn(Optional.of(objectMapper.readTree("""
            {"items": [{"volumeInfo": {
              "title": "Tomorrow, and Tomorrow, and Tomorrow",
              "authors": ["Gabrielle Zevin"],
              "publisher": "Knopf",
              "printType": "BOOK",
              "industryIdentifiers": [{"type": "ISBN_10", "identifier": "0593321200"}]
            }}]}
            """)));

        Optional<IsbnMatch> match = provider().resolveIsbn("Tomorrow, and Tomorrow, and Tomorrow", "Gabrielle Zevin",
            ServiceContext.defaults());

        assertThat(match).get().satisfies(found -> {
            assertThat(found.isbn()).isEqualTo("9780593321201");
            assertThat(found.confidence()).isEqualTo(90);
            assertThat(found.publisher()).isEqualTo("Knopf");
        });
    }

    @Test
    void should_ReturnEmpty_When_NoItemsOrNoIdentifiers() throws Exception {
        when(httpClient.getJson(anyString(), anyMap(), any()))
            .thenReturn(Optional.of(objectMapper.readTree("{\"totalItems\": 0}")))
            .thenReturn(Optional.of(objectMapper.readTree("{\"items\": [{\"volumeInfo\": {\"title\": \"Trust\"}}]}")))
            .thenReturn(Optional.empty());

        GoogleBooksProvider provider = provider();

        assertThat(provider.resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults())).isEmpty();
        assertThat(provider.resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults())).isEmpty();
        assertThat(provider.resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults())).isEmpty();
    }

    @Test
    void should_AppendKeyAndAuthorQualifier_When_Configured() {
        settings.setApiKey("g-key");
        when(httpClient.getJson(anyString(), anyMap(), any())).thenReturn(Optional.empty());

        provider().resolveIsbn("Trust", "Hernan Diaz", ServiceContext.defaults());

        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(httpClient).getJson(url.capture(), anyMap(), any());
        assertThat(url.getValue())
            .startsWith(GoogleBooksProvider.DEFAULT_BASE_URL)
            .contains("inauthor")
            .contains("key=g-key")
            .contains("maxResults=1");
    }

    @Test
    void should_DescribeFreeResolver_When_PriorityUnset() {
        GoogleBooksProvider provider = provider();

        assertThat(provider.descriptor().type()).isEqualTo(ProviderType.FREE);
        assertThat(provider.descriptor().priorityWeight()).isEqualTo(80);
        assertThat(provider.descriptor().minCallSpacing()).isEqualTo(GoogleBooksProvider.DEFAULT_MIN_SPACING);
    }
}
