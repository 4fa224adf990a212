package net.bookharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed configuration for external providers and their orchestration order.
 */
@Component
@ConfigurationProperties(prefix = "app.providers")
public class ProviderProperties {

    /**
     * Custom ISBN resolution order. Empty means paid providers first, then by priority weight.
     */
    private List<String> isbnResolutionOrder = new ArrayList<>();

    /**
     * Priority order for generative providers.
     */
    private List<String> generationOrder = new ArrayList<>(List.of("gemini", "xai"));

    /**
     * Upper bound for a single availability check.
     */
    private Duration availabilityTimeout = Duration.ofSeconds(5);

    /**
     * How long availability check results are reused.
     */
    private Duration availabilityCacheTtl = Duration.ofSeconds(30);

    /**
     * Per-attempt timeout in the ISBN fallback chain.
     */
    private Duration resolutionTimeout = Duration.ofSeconds(15);

    /**
     * Per-provider timeout in the generation fan-out.
     */
    private Duration generationTimeout = Duration.ofSeconds(60);

    /**
     * Whether the fallback chain stops at the first provider that finds an ISBN.
     */
    private boolean stopOnFirstSuccess = true;

    /**
     * Whether generation tries providers one at a time in priority order instead of fanning out.
     */
    private boolean generationSequential = false;

    /**
     * Settings keyed by provider id (isbndb, google-books, open-library, gemini, xai).
     */
    private Map<String, Settings> registry = new LinkedHashMap<>();

    public Settings settingsFor(String providerId) {
        return registry.getOrDefault(providerId, new Settings());
    }

    public List<String> getIsbnResolutionOrder() {
        return isbnResolutionOrder;
    }

    public void setIsbnResolutionOrder(List<String> isbnResolutionOrder) {
        this.isbnResolutionOrder = isbnResolutionOrder;
    }

    public List<String> getGenerationOrder() {
        return generationOrder;
    }

    public void setGenerationOrder(List<String> generationOrder) {
        this.generationOrder = generationOrder;
    }

    public Duration getAvailabilityTimeout() {
        return availabilityTimeout;
    }

    public void setAvailabilityTimeout(Duration availabilityTimeout) {
        this.availabilityTimeout = availabilityTimeout;
    }

    public Duration getAvailabilityCacheTtl() {
        return availabilityCacheTtl;
    }

    public void setAvailabilityCacheTtl(Duration availabilityCacheTtl) {
        this.availabilityCacheTtl = availabilityCacheTtl;
    }

    public Duration getResolutionTimeout() {
        return resolutionTimeout;
    }

    public void setResolutionTimeout(Duration resolutionTimeout) {
        this.resolutionTimeout = resolutionTimeout;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public boolean isStopOnFirstSuccess() {
        return stopOnFirstSuccess;
    }

    public void setStopOnFirstSuccess(boolean stopOnFirstSuccess) {
        this.stopOnFirstSuccess = stopOnFirstSuccess;
    }

    public boolean isGenerationSequential() {
        return generationSequential;
    }

    public void setGenerationSequential(boolean generationSequential) {
        this.generationSequential = generationSequential;
    }

    public Map<String, Settings> getRegistry() {
        return registry;
    }

    public void setRegistry(Map<String, Settings> registry) {
        this.registry = registry;
    }

    /**
     * Settings for one provider.
     */
    public static class Settings {

        private boolean enabled = true;
        private String apiKey = "";
        private String baseUrl = "";
        private String model = "";
        private int priority = 0;
        private Duration minSpacing = Duration.ZERO;
        private Duration cacheTtl = Duration.ZERO;
        private int burstLimitPerSecond = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public Duration getMinSpacing() {
            return minSpacing;
        }

        public void setMinSpacing(Duration minSpacing) {
            this.minSpacing = minSpacing;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public int getBurstLimitPerSecond() {
            return burstLimitPerSecond;
        }

        public void setBurstLimitPerSecond(int burstLimitPerSecond) {
            this.burstLimitPerSecond = burstLimitPerSecond;
        }
    }
}
