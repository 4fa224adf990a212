package net.bookharvest.application.backfill;

import net.bookharvest.domain.backfill.BackfillStatus;
import net.bookharvest.repository.BackfillLogRepository;
import net.bookharvest.repository.SyntheticWorkRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackfillStatsServiceTest {

    @Mock
    private BackfillLogRepository backfillLogRepository;

    @Mock
    private SyntheticWorkRepository syntheticWorkRepository;

    @InjectMocks
    private BackfillStatsService statsService;

    @Test
    void should_AggregateTotalsWithWireStatusNames_When_Requested() {
        Map<BackfillStatus, Long> counts = new EnumMap<>(BackfillStatus.class);
        counts.put(BackfillStatus.PENDING, 20L);
        counts.put(BackfillStatus.COMPLETED, 3L);
        counts.put(BackfillStatus.FAILED, 1L);
        when(backfillLogRepository.totals()).thenReturn(new BackfillLogRepository.BackfillTotals(24, 60, 41, 41, 19, 75));
        when(backfillLogRepository.countByStatus()).thenReturn(counts);
        when(backfillLogRepository.findRecentlyCompleted(BackfillStatsService.RECENT_LIMIT))
            .thenReturn(List.of(BackfillSchedulerServiceTest.month(2023, 12, BackfillStatus.COMPLETED, 0)));
        when(syntheticWorkRepository.countSynthetic()).thenReturn(19L);

        BackfillStats stats = statsService.stats();

        assertThat(stats.totalMonths()).isEqualTo(24);
        assertThat(stats.byStatus()).containsEntry("pending", 20L).containsEntry("completed", 3L).containsEntry("failed", 1L);
        assertThat(stats.overallResolutionRate()).isEqualByComparingTo("68.33");
        assertThat(stats.pendingSyntheticWorks()).isEqualTo(19);
        assertThat(stats.recent()).hasSize(1);
    }

    @Test
    void should_ReportZeroRate_When_NothingGenerated() {
        assertThat(BackfillStatsService.resolutionRate(0, 0)).isEqualTo(new BigDecimal("0.00"));
        assertThat(BackfillStatsService.resolutionRate(3, 4)).isEqualTo(new BigDecimal("75.00"));
    }
}
