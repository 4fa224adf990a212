package net.bookharvest.application.backfill;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bookharvest.application.provider.IsbnMatch;
import net.bookharvest.application.provider.IsbnResolution;
import net.bookharvest.repository.SyntheticWorkRepository;
import net.bookharvest.repository.SyntheticWorkRepository.SyntheticWork;
import net.bookharvest.support.kv.InMemoryKeyValueStore;
import net.bookharvest.support.queue.EnrichmentQueuePublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyntheticEnhancementServiceTest {

    @Mock
    private SyntheticWorkRepository repository;

    @Mock
    private QuotaGuardedIsbnResolver isbnResolver;

    private InMemoryKeyValueStore store;
    private SyntheticEnhancementService service;

    private static final SyntheticWork BEE_STING = new SyntheticWork("synthetic:bee-sting:paul-murray", "The Bee Sting", "Paul Murray", 2023);
    private static final SyntheticWork WESTERN_LANE = new SyntheticWork("synthetic:western-lane:chetna-maroo", "Western Lane", "Chetna Maroo", 2023);
    private static final SyntheticWork PROPHET_SONG = new SyntheticWork("synthetic:prophet-song:paul-lynch", "Prophet Song", "Paul Lynch", 2023);

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        service = new SyntheticEnhancementService(repository, isbnResolver,
            new EnrichmentQueuePublisher(store, new ObjectMapper()), 500);
    }

    private static Optional<QuotaGuardedIsbnResolver.GuardedResolution> found(String isbn) {
        return Optional.of(new QuotaGuardedIsbnResolver.GuardedResolution(
            new IsbnResolution(new IsbnMatch(isbn, "", "", "", "", 85), "isbndb", List.of()), 1));
    }

    private static Optional<QuotaGuardedIsbnResolver.GuardedResolution> missing(String source) {
        return Optional.of(new QuotaGuardedIsbnResolver.GuardedResolution(new IsbnResolution(null, source, List.of()), 1));
    }

    @Test
    void should_PromoteFoundAndStampMissing_When_ResolvingCandidates() {
        when(repository.findEnhancementCandidates(500)).thenReturn(List.of(BEE_STING, WESTERN_LANE));
        when(isbnResolver.resolve(eq("The Bee Sting"), anyString(), any())).thenReturn(found("9780802160751"));
        when(isbnResolver.resolve(eq("Western Lane"), anyString(), any())).thenReturn(missing(IsbnResolution.SOURCE_NONE));
        when(repository.markEnhanced(BEE_STING.workKey(), "9780802160751", "isbndb", 85)).thenReturn(true);

        SyntheticEnhancementResult result = service.enhance();

        assertThat(result).isEqualTo(new SyntheticEnhancementResult(2, 2, 1, 1, 0, false));
        verify(repository).markEnhanced(BEE_STING.workKey(), "9780802160751", "isbndb", 85);
        verify(repository).markSyncAttempt(WESTERN_LANE.workKey());
        assertThat(store.listContents(EnrichmentQueuePublisher.QUEUE_KEY)).singleElement().asString()
            .contains("synthetic-enhancement")
            .contains("9780802160751");
    }

    @Test
    void should_NotCountAsEnhanced_When_IsbnAlreadyBelongsToAnotherWork() {
        when(repository.findEnhancementCandidates(500)).thenReturn(List.of(PROPHET_SONG));
        when(isbnResolver.resolve(eq("Prophet Song"), anyString(), any())).thenReturn(found("9780802163004"));
        when(repository.markEnhanced(PROPHET_SONG.workKey(), "9780802163004", "isbndb", 85)).thenReturn(false);

        SyntheticEnhancementResult result = service.enhance();

        assertThat(result).isEqualTo(new SyntheticEnhancementResult(1, 1, 0, 1, 0, false));
    }

    @Test
    void should_StopEarly_When_QuotaRunsOut() {
        when(repository.findEnhancementCandidates(3)).thenReturn(List.of(BEE_STING, WESTERN_LANE, PROPHET_SONG));
        when(isbnResolver.resolve(eq("The Bee Sting"), anyString(), any())).thenReturn(missing(IsbnResolution.SOURCE_NONE));
        when(isbnResolver.resolve(eq("Western Lane"), anyString(), any())).thenReturn(Optional.empty());

        SyntheticEnhancementResult result = service.enhance(3);

        assertThat(result.quotaStopped()).isTrue();
        assertThat(result.attempted()).isEqualTo(1);
        verify(isbnResolver, never()).resolve(eq("Prophet Song"), anyString(), any());
    }

    @Test
    void should_StopWithoutStamping_When_ProvidersReportQuotaExhausted() {
        when(repository.findEnhancementCandidates(500)).thenReturn(List.of(BEE_STING, WESTERN_LANE));
        when(isbnResolver.resolve(eq("The Bee Sting"), anyString(), any()))
            .thenReturn(missing(IsbnResolution.SOURCE_QUOTA_EXHAUSTED));

        SyntheticEnhancementResult result = service.enhance();

        assertThat(result.quotaStopped()).isTrue();
        verify(repository, never()).markSyncAttempt(any());
    }

    @Test
    void should_LeaveWorkSynthetic_When_EnrichmentQueueUnavailable() {
        when(repository.findEnhancementCandidates(500)).thenReturn(List.of(BEE_STING));
        when(isbnResolver.resolve(eq("The Bee Sting"), anyString(), any())).thenReturn(found("9780802160751"));
        store.setAvailable(false);

        SyntheticEnhancementResult result = service.enhance();

        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.enhanced()).isZero();
        verify(repository, never()).markEnhanced(any(), any(), any(), anyInt());
        verify(repository).markSyncAttempt(BEE_STING.workKey());
    }

    @Test
    void should_RejectLimit_When_NotPositive() {
        assertThatThrownBy(() -> service.enhance(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
