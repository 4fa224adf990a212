package net.bookharvest.domain.provider;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a registered provider.
 *
 * @param id                  unique provider identifier, for example {@code isbndb}
 * @param type                billing class
 * @param capabilities        capabilities the provider implements
 * @param priorityWeight      higher runs earlier within one capability
 * @param capabilityTimeouts  per-capability attempt timeout; missing entries use {@code defaultTimeout}
 * @param defaultTimeout      timeout used when no capability-specific entry exists
 * @param cacheTtl            response cache TTL, {@link Duration#ZERO} disables caching
 * @param minCallSpacing      minimum delay between two calls across all instances
 */
public record ProviderDescriptor(String id,
                                 ProviderType type,
                                 Set<ProviderCapability> capabilities,
                                 int priorityWeight,
                                 Map<ProviderCapability, Duration> capabilityTimeouts,
                                 Duration defaultTimeout,
                                 Duration cacheTtl,
                                 Duration minCallSpacing) {

    public ProviderDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("Provider " + id + " must declare at least one capability");
        }
        capabilities = Set.copyOf(EnumSet.copyOf(capabilities));
        capabilityTimeouts = capabilityTimeouts == null ? Map.of() : Map.copyOf(capabilityTimeouts);
        defaultTimeout = defaultTimeout == null ? Duration.ofSeconds(15) : defaultTimeout;
        cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        minCallSpacing = minCallSpacing == null ? Duration.ZERO : minCallSpacing;
    }

    public boolean supports(ProviderCapability capability) {
        return capabilities.contains(capability);
    }

    public Duration timeoutFor(ProviderCapability capability) {
        return capabilityTimeouts.getOrDefault(capability, defaultTimeout);
    }
}
