package net.bookharvest.application.provider;

import net.bookharvest.domain.provider.ProviderDescriptor;

/**
 * Base contract for everything the {@link ProviderRegistry} manages.
 */
public interface BookProvider {

    ProviderDescriptor descriptor();

    /**
     * Cheap readiness check. Implementations report {@code false} when credentials are missing;
     * they must not spend paid quota here.
     */
    boolean isAvailable();

    default String id() {
        return descriptor().id();
    }
}
