package net.bookharvest.application.backfill;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.application.provider.BookProvider;
import net.bookharvest.application.provider.IsbnResolution;
import net.bookharvest.application.provider.IsbnResolutionOrchestrator;
import net.bookharvest.application.provider.ProviderAttempt;
import net.bookharvest.application.provider.ProviderRegistry;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.service.QuotaManager;
import net.bookharvest.service.QuotaReservation;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one ISBN fallback chain under a single unit of paid quota.
 *
 * <p>The unit is reserved before the chain starts. It is committed when a paid provider was
 * actually called and released otherwise. Extra paid calls beyond the first are metered
 * separately.</p>
 */
@Component
@Slf4j
public class QuotaGuardedIsbnResolver {

    private final QuotaManager quotaManager;
    private final IsbnResolutionOrchestrator orchestrator;
    private final ProviderRegistry registry;

    public QuotaGuardedIsbnResolver(QuotaManager quotaManager,
                                    IsbnResolutionOrchestrator orchestrator,
                                    ProviderRegistry registry) {
        this.quotaManager = quotaManager;
        this.orchestrator = orchestrator;
        this.registry = registry;
    }

    /**
     * @return empty when the reservation was rejected and nothing was called
     */
    public Optional<GuardedResolution> resolve(String title, String author, ServiceContext context) {
        Optional<QuotaReservation> reservation = quotaManager.reserve(1);
        if (reservation.isEmpty()) {
            log.debug("[QUOTA] No unit available for '{}' by '{}'", title, author);
            return Optional.empty();
        }
        IsbnResolution resolution;
        try {
            resolution = orchestrator.resolve(title, author, context.withMetadata(QuotaManager.PREPAID_CONTEXT_KEY, "true"));
        } catch (RuntimeException e) {
            quotaManager.release(reservation.get());
            throw e;
        }

        int paidCalls = countPaidCalls(resolution);
        if (paidCalls > 0) {
            quotaManager.commit(reservation.get());
            if (paidCalls > 1) {
                quotaManager.recordApiCall(paidCalls - 1);
            }
        } else {
            quotaManager.release(reservation.get());
        }
        return Optional.of(new GuardedResolution(resolution, paidCalls));
    }

    private int countPaidCalls(IsbnResolution resolution) {
        Set<String> paidIds = registry.byType(ProviderType.PAID).stream()
            .map(BookProvider::id)
            .collect(Collectors.toSet());
        return (int) resolution.attempts().stream()
            .filter(attempt -> paidIds.contains(attempt.provider()))
            .map(ProviderAttempt::outcome)
            .filter(outcome -> !outcome.isBudgetSignal())
            .count();
    }

    /**
     * @param paidCalls paid provider calls made during the chain
     */
    public record GuardedResolution(IsbnResolution resolution, int paidCalls) {
    }
}
