package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import net.bookharvest.application.provider.BookGenerationPrompts;
import net.bookharvest.application.provider.BookGenerationRequest;
import net.bookharvest.application.provider.BookGenerator;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.backfill.CandidateBook;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderDescriptor;
import net.bookharvest.domain.provider.ProviderFailureKind;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Book generator backed by an OpenAI-compatible chat completions endpoint.
 *
 * <p>Subclasses only supply identity and defaults; the SDK client, prompt assembly and response
 * parsing live here. The SDK's own retries are disabled so the orchestrator timeout is the only bound.</p>
 */
public abstract class OpenAiCompatibleBookGenerator implements BookGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBookGenerator.class);
    private static final long MAX_COMPLETION_TOKENS = 16_384L;
    private static final Duration GENERATION_TIMEOUT = Duration.ofSeconds(60);

    private final ProviderDescriptor descriptor;
    private final OpenAIClient client;
    private final String model;
    private final double temperature;
    private final GeneratedBookParser parser;

    protected OpenAiCompatibleBookGenerator(String providerId,
                                            ProviderProperties properties,
                                            ObjectMapper objectMapper,
                                            String defaultBaseUrl,
                                            String defaultModel,
                                            double temperature) {
        this(providerId, properties.settingsFor(providerId), objectMapper, defaultBaseUrl, defaultModel,
            temperature, null);
    }

    OpenAiCompatibleBookGenerator(String providerId,
                                  ProviderProperties.Settings settings,
                                  ObjectMapper objectMapper,
                                  String defaultBaseUrl,
                                  String defaultModel,
                                  double temperature,
                                  OpenAIClient clientOverride) {
        this.descriptor = new ProviderDescriptor(providerId, ProviderType.AI, Set.of(ProviderCapability.BOOK_GENERATION),
            settings.getPriority(), Map.of(ProviderCapability.BOOK_GENERATION, GENERATION_TIMEOUT), GENERATION_TIMEOUT,
            Duration.ZERO, settings.getMinSpacing());
        this.model = StringUtils.hasText(settings.getModel()) ? settings.getModel().trim() : defaultModel;
        this.temperature = temperature;
        this.parser = new GeneratedBookParser(objectMapper);
        String apiKey = settings.getApiKey();
        if (clientOverride != null) {
            this.client = clientOverride;
        } else if (StringUtils.hasText(apiKey)) {
            String baseUrl = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl().trim() : defaultBaseUrl;
            this.client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(baseUrl)
                .maxRetries(0)
                .build();
        } else {
            log.warn("[{}] No API key configured; book generation provider is unavailable", providerId);
            this.client = null;
        }
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public List<CandidateBook> generate(BookGenerationRequest request, ServiceContext context) {
        if (client == null) {
            throw new BookGenerationException(id(), ProviderFailureKind.CONFIGURATION, "API key not configured");
        }
        String prompt = BookGenerationPrompts.userPrompt(request);
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder()
                    .content(BookGenerationPrompts.SYSTEM_PROMPT)
                    .build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder()
                    .content(prompt)
                    .build())))
            .maxCompletionTokens(MAX_COMPLETION_TOKENS)
            .temperature(temperature)
            .build();
        Duration timeout = context.timeout();
        RequestOptions requestOptions = RequestOptions.builder()
            .timeout(Timeout.builder().request(timeout).read(timeout).build())
            .build();

        String target = request.year() + "-" + request.month() + " (" + request.promptVariant() + ")";
        ExternalApiLogger.logApiCallAttempt(log, id(), "generate", target);
        ChatCompletion completion;
        try {
            completion = client.chat().completions().create(params, requestOptions);
        } catch (OpenAIException e) {
            ExternalApiLogger.logApiCallFailure(log, id(), "generate", target, BookGenerationException.describeApiError(e));
            throw BookGenerationException.fromSdk(id(), e);
        }

        String content = completion.choices().isEmpty()
            ? ""
            : completion.choices().get(0).message().content().orElse("");
        List<CandidateBook> books;
        try {
            books = parser.parse(content, id(), request.year());
        } catch (IllegalStateException e) {
            ExternalApiLogger.logApiCallFailure(log, id(), "generate", target, e.getMessage());
            throw new BookGenerationException(id(), ProviderFailureKind.INVALID_RESPONSE, e.getMessage(), e);
        }
        ExternalApiLogger.logApiCallSuccess(log, id(), "generate", target, books.size());
        return books;
    }

    String model() {
        return model;
    }
}
