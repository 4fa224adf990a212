package net.bookharvest.application.provider;

import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderDescriptor;
import net.bookharvest.domain.provider.ProviderType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static net.bookharvest.application.provider.FakeProviders.resolver;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private ExecutorService executor;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new ProviderRegistry(executor, Duration.ofMillis(200), Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void should_RejectRegistration_When_IdAlreadyRegistered() {
        registry.register(resolver("isbndb", ProviderType.PAID, 100, Optional::empty));

        assertThatThrownBy(() -> registry.register(resolver("isbndb", ProviderType.FREE, 10, Optional::empty)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("isbndb");
        assertThat(registry.get("isbndb")).get()
            .extracting(provider -> provider.descriptor().type())
            .isEqualTo(ProviderType.PAID);
    }

    @Test
    void should_OrderByPriorityThenRegistration_When_ListingByCapability() {
        registry.register(resolver("open-library", ProviderType.FREE, 60, Optional::empty));
        registry.register(resolver("google-books", ProviderType.FREE, 80, Optional::empty));
        registry.register(resolver("second-free", ProviderType.FREE, 60, Optional::empty));
        registry.register(resolver("isbndb", ProviderType.PAID, 100, Optional::empty));

        assertThat(registry.byCapability(ProviderCapability.ISBN_RESOLUTION))
            .extracting(BookProvider::id)
            .containsExactly("isbndb", "google-books", "open-library", "second-free");
        assertThat(registry.byCapability(ProviderCapability.BOOK_GENERATION)).isEmpty();
    }

    @Test
    void should_ExcludeProvider_When_AvailabilityCheckFailsThrowsOrRunsLate() {
        registry.register(resolver("up", ProviderType.FREE, 90, Optional::empty));
        registry.register(resolver("down", ProviderType.FREE, 80, Optional::empty).unavailable());
        registry.register(withAvailability("throws", () -> {
            throw new IllegalStateException("no credentials");
        }));
        registry.register(withAvailability("slow", () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        }));

        assertThat(registry.availableProviders(ProviderCapability.ISBN_RESOLUTION))
            .extracting(BookProvider::id)
            .containsExactly("up");
    }

    @Test
    void should_ReuseCachedAvailability_When_CheckedTwiceWithinTtl() {
        AtomicInteger checks = new AtomicInteger();
        registry.register(withAvailability("counted", () -> {
            checks.incrementAndGet();
            return true;
        }));

        registry.availableProviders(ProviderCapability.ISBN_RESOLUTION);
        registry.availableProviders(ProviderCapability.ISBN_RESOLUTION);

        assertThat(checks).hasValue(1);
    }

    @Test
    void should_ForgetProvider_When_Unregistered() {
        registry.register(resolver("isbndb", ProviderType.PAID, 100, Optional::empty));

        assertThat(registry.unregister("isbndb")).isTrue();
        assertThat(registry.unregister("isbndb")).isFalse();
        assertThat(registry.get("isbndb")).isEmpty();
        assertThat(registry.hasCapability("isbndb", ProviderCapability.ISBN_RESOLUTION)).isFalse();
    }

    @Test
    void should_CountProvidersByTypeAndCapability_When_StatsRequested() {
        registry.register(resolver("isbndb", ProviderType.PAID, 100, Optional::empty));
        registry.register(resolver("google-books", ProviderType.FREE, 80, Optional::empty));
        registry.register(FakeProviders.generator("gemini", List::of));

        ProviderRegistry.RegistryStats stats = registry.stats();

        assertThat(stats.totalProviders()).isEqualTo(3);
        assertThat(stats.byType())
            .containsEntry(ProviderType.PAID, 1)
            .containsEntry(ProviderType.FREE, 1)
            .containsEntry(ProviderType.AI, 1);
        assertThat(stats.byCapability())
            .containsEntry(ProviderCapability.ISBN_RESOLUTION, 2)
            .containsEntry(ProviderCapability.BOOK_GENERATION, 1);
        assertThat(registry.byType(ProviderType.PAID)).extracting(BookProvider::id).containsExactly("isbndb");
    }

    private static BookProvider withAvailability(String id, BooleanSupplier availability) {
        ProviderDescriptor descriptor = FakeProviders.descriptor(id, ProviderType.FREE, 10, ProviderCapability.ISBN_RESOLUTION);
        return new BookProvider() {
            @Override
            public ProviderDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public boolean isAvailable() {
                return availability.getAsBoolean();
            }
        };
    }
}
