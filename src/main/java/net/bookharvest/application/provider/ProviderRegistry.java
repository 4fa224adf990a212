package net.bookharvest.application.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process registry of book providers keyed by id.
 *
 * <p>Providers are registered once at startup from the Spring context; disabled providers
 * ({@code app.providers.registry.<id>.enabled=false}) are skipped. Lookups by capability are
 * ordered by priority weight (highest first) and then by registration order.</p>
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, Registration> providers = new ConcurrentHashMap<>();
    private final AtomicLong registrationSequence = new AtomicLong();
    private final Executor executor;
    private final Duration availabilityTimeout;
    private final Cache<String, Boolean> availabilityCache;

    @Autowired
    public ProviderRegistry(ProviderProperties properties,
                            @Qualifier("providerExecutor") Executor executor,
                            List<BookProvider> discovered) {
        this(executor, properties.getAvailabilityTimeout(), properties.getAvailabilityCacheTtl());
        for (BookProvider provider : discovered) {
            if (!properties.settingsFor(provider.id()).isEnabled()) {
                log.info("[PROVIDERS] {} disabled by configuration; not registering", provider.id());
                continue;
            }
            register(provider);
        }
    }

    public ProviderRegistry(Executor executor, Duration availabilityTimeout, Duration availabilityCacheTtl) {
        this.executor = executor;
        this.availabilityTimeout = availabilityTimeout;
        this.availabilityCache = Caffeine.newBuilder()
            .maximumSize(256)
            .expireAfterWrite(availabilityCacheTtl)
            .build();
    }

    /**
     * @throws IllegalArgumentException when a provider with the same id is already registered
     */
    public void register(BookProvider provider) {
        String id = provider.id();
        Registration registration = new Registration(provider, registrationSequence.getAndIncrement());
        if (providers.putIfAbsent(id, registration) != null) {
            throw new IllegalArgumentException("Provider already registered: " + id);
        }
        log.info("[PROVIDERS] Registered {} (type={}, capabilities={}, priority={})",
            id, provider.descriptor().type(), provider.descriptor().capabilities(), provider.descriptor().priorityWeight());
    }

    public boolean unregister(String id) {
        availabilityCache.invalidate(id);
        return providers.remove(id) != null;
    }

    public Optional<BookProvider> get(String id) {
        Registration registration = providers.get(id);
        return registration == null ? Optional.empty() : Optional.of(registration.provider());
    }

    public List<BookProvider> all() {
        return providers.values().stream()
            .sorted(Comparator.comparingLong(Registration::sequence))
            .map(Registration::provider)
            .toList();
    }

    public List<BookProvider> byCapability(ProviderCapability capability) {
        return providers.values().stream()
            .filter(registration -> registration.provider().descriptor().supports(capability))
            .sorted(Comparator.<Registration>comparingInt(r -> r.provider().descriptor().priorityWeight()).reversed()
                .thenComparingLong(Registration::sequence))
            .map(Registration::provider)
            .toList();
    }

    public List<BookProvider> byType(ProviderType type) {
        return all().stream()
            .filter(provider -> provider.descriptor().type() == type)
            .toList();
    }

    public boolean hasCapability(String id, ProviderCapability capability) {
        return get(id).map(provider -> provider.descriptor().supports(capability)).orElse(false);
    }

    /**
     * Providers with the capability whose availability check passed within the timeout.
     * A check that throws or runs late counts as unavailable. Order matches {@link #byCapability}.
     */
    public List<BookProvider> availableProviders(ProviderCapability capability) {
        List<BookProvider> candidates = byCapability(capability);
        Map<BookProvider, CompletableFuture<Boolean>> checks = new LinkedHashMap<>();
        for (BookProvider provider : candidates) {
            Boolean cached = availabilityCache.getIfPresent(provider.id());
            CompletableFuture<Boolean> check = cached != null
                ? CompletableFuture.completedFuture(cached)
                : CompletableFuture.supplyAsync(() -> checkAvailability(provider), executor)
                    .completeOnTimeout(Boolean.FALSE, availabilityTimeout.toMillis(), TimeUnit.MILLISECONDS);
            checks.put(provider, check);
        }

        List<BookProvider> available = new ArrayList<>();
        checks.forEach((provider, check) -> {
            boolean up = check.join();
            availabilityCache.put(provider.id(), up);
            if (up) {
                available.add(provider);
            } else {
                log.debug("[PROVIDERS] {} unavailable for {}", provider.id(), capability);
            }
        });
        return available;
    }

    public RegistryStats stats() {
        Map<ProviderType, Integer> byType = new EnumMap<>(ProviderType.class);
        Map<ProviderCapability, Integer> byCapability = new EnumMap<>(ProviderCapability.class);
        for (BookProvider provider : all()) {
            byType.merge(provider.descriptor().type(), 1, Integer::sum);
            provider.descriptor().capabilities().forEach(capability -> byCapability.merge(capability, 1, Integer::sum));
        }
        return new RegistryStats(providers.size(), byType, byCapability);
    }

    private boolean checkAvailability(BookProvider provider) {
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            log.warn("[PROVIDERS] Availability check for {} threw: {}", provider.id(), e.getMessage());
            return false;
        }
    }

    private record Registration(BookProvider provider, long sequence) {
    }

    /**
     * Registry counts for the admin surface.
     */
    public record RegistryStats(int totalProviders,
                                Map<ProviderType, Integer> byType,
                                Map<ProviderCapability, Integer> byCapability) {
    }
}
