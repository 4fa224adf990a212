package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bookharvest.config.ProviderProperties;
import org.springframework.stereotype.Component;

/**
 * xAI Grok through the OpenAI-compatible API.
 */
@Component
public class XaiBookGenerator extends OpenAiCompatibleBookGenerator {

    public static final String PROVIDER_ID = "xai";
    static final String DEFAULT_BASE_URL = "https://api.x.ai/v1";
    static final String DEFAULT_MODEL = "grok-4-1-fast-non-reasoning";

    public XaiBookGenerator(ProviderProperties properties, ObjectMapper objectMapper) {
        super(PROVIDER_ID, properties, objectMapper, DEFAULT_BASE_URL, DEFAULT_MODEL, 0.2);
    }
}
