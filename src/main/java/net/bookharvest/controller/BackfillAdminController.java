package net.bookharvest.controller;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import net.bookharvest.application.backfill.BackfillJobStatus;
import net.bookharvest.application.backfill.BackfillJobStatusStore;
import net.bookharvest.application.backfill.BackfillScheduleRequest;
import net.bookharvest.application.backfill.BackfillScheduleResponse;
import net.bookharvest.application.backfill.BackfillSchedulerService;
import net.bookharvest.application.backfill.BackfillStats;
import net.bookharvest.application.backfill.BackfillStatsService;
import net.bookharvest.application.backfill.SyntheticEnhancementResult;
import net.bookharvest.application.backfill.SyntheticEnhancementService;
import net.bookharvest.application.provider.ProviderRegistry;
import net.bookharvest.repository.BackfillPersistenceException;
import net.bookharvest.service.QuotaManager;
import net.bookharvest.service.QuotaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Operator endpoints for month backfill: scheduling, seeding, progress, quota and maintenance passes.
 *
 * <p>All routes sit under {@code /admin/**} and require the ADMIN role.</p>
 */
@RestController
@RequestMapping("/admin/backfill")
public class BackfillAdminController {

    private static final Logger log = LoggerFactory.getLogger(BackfillAdminController.class);

    static final int MAX_ENHANCEMENT_LIMIT = 5_000;

    private final BackfillSchedulerService schedulerService;
    private final BackfillStatsService statsService;
    private final BackfillJobStatusStore jobStatusStore;
    private final SyntheticEnhancementService enhancementService;
    private final QuotaManager quotaManager;
    private final ProviderRegistry providerRegistry;

    public BackfillAdminController(BackfillSchedulerService schedulerService,
                                   BackfillStatsService statsService,
                                   BackfillJobStatusStore jobStatusStore,
                                   SyntheticEnhancementService enhancementService,
                                   QuotaManager quotaManager,
                                   ProviderRegistry providerRegistry) {
        this.schedulerService = schedulerService;
        this.statsService = statsService;
        this.jobStatusStore = jobStatusStore;
        this.enhancementService = enhancementService;
        this.quotaManager = quotaManager;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Selects eligible months and queues a job for each. An empty body uses the defaults.
     */
    @PostMapping(value = "/schedule", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BackfillScheduleResponse> schedule(@RequestBody(required = false) BackfillScheduleRequest request) {
        BackfillScheduleRequest normalized;
        try {
            normalized = request == null ? BackfillScheduleRequest.defaults() : request.normalized();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        BackfillScheduleResponse response = withPersistence(() -> schedulerService.schedule(normalized));
        return normalized.dryRun() ? ResponseEntity.ok(response) : ResponseEntity.accepted().body(response);
    }

    @PostMapping(value = "/seed", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> seed(
            @RequestParam(name = "yearStart", defaultValue = "2000") int yearStart,
            @RequestParam(name = "yearEnd", defaultValue = "2024") int yearEnd) {
        if (yearStart > yearEnd) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "yearStart must not be after yearEnd: " + yearStart + " > " + yearEnd);
        }
        int inserted;
        try {
            inserted = withPersistence(() -> schedulerService.seed(yearStart, yearEnd));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        log.info("Seeded backfill_log for {}..{}: {} new months", yearStart, yearEnd, inserted);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("year_start", yearStart);
        body.put("year_end", yearEnd);
        body.put("inserted", inserted);
        return ResponseEntity.ok(body);
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BackfillStats> stats() {
        return ResponseEntity.ok(withPersistence(statsService::stats));
    }

    @GetMapping(value = "/jobs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BackfillJobStatus> jobStatus(@PathVariable("jobId") String jobId) {
        return jobStatusStore.find(jobId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                "No status for job " + jobId + " (unknown or expired)"));
    }

    @GetMapping(value = "/quota", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QuotaStatus> quota() {
        return ResponseEntity.ok(quotaManager.getStatus());
    }

    @PostMapping(value = "/quota/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QuotaStatus> resetQuota() {
        if (!quotaManager.resetQuota()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Quota store unavailable; counter not reset");
        }
        return ResponseEntity.ok(quotaManager.getStatus());
    }

    @GetMapping(value = "/providers", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProviderRegistry.RegistryStats> providers() {
        return ResponseEntity.ok(providerRegistry.stats());
    }

    @PostMapping(value = "/enhance-synthetic", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyntheticEnhancementResult> enhanceSynthetic(
            @RequestParam(name = "limit", defaultValue = "500") int limit) {
        if (limit < 1 || limit > MAX_ENHANCEMENT_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "limit must be between 1 and " + MAX_ENHANCEMENT_LIMIT + ": " + limit);
        }
        return ResponseEntity.ok(withPersistence(() -> enhancementService.enhance(limit)));
    }

    @PostMapping(value = "/reclaim-stale", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> reclaimStale(
            @RequestParam(name = "olderThanMinutes", defaultValue = "60") long olderThanMinutes) {
        if (olderThanMinutes < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "olderThanMinutes must be positive");
        }
        int reclaimed = withPersistence(() -> schedulerService.reclaimStale(Duration.ofMinutes(olderThanMinutes)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("older_than_minutes", olderThanMinutes);
        body.put("reclaimed", reclaimed);
        return ResponseEntity.ok(body);
    }

    private static <T> T withPersistence(Supplier<T> action) {
        try {
            return action.get();
        } catch (BackfillPersistenceException e) {
            log.error("Backfill admin request failed at the database", e);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }
}
