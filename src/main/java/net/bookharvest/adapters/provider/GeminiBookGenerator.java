package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bookharvest.config.ProviderProperties;
import org.springframework.stereotype.Component;

/**
 * Google Gemini through its OpenAI-compatible endpoint.
 */
@Component
public class GeminiBookGenerator extends OpenAiCompatibleBookGenerator {

    public static final String PROVIDER_ID = "gemini";
    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai/";
    static final String DEFAULT_MODEL = "gemini-2.5-flash";

    public GeminiBookGenerator(ProviderProperties properties, ObjectMapper objectMapper) {
        super(PROVIDER_ID, properties, objectMapper, DEFAULT_BASE_URL, DEFAULT_MODEL, 0.1);
    }
}
