package net.bookharvest.application.backfill;

/**
 * Outcome of processing one month job.
 *
 * @param attempted candidates that went through ISBN resolution or were parked as synthetic
 * @param resolved  candidates that received an ISBN
 * @param skipped   candidates dropped as duplicates of each other or of the stored corpus
 * @param degraded  whether resolution stopped early because the paid budget ran out
 */
public record BackfillJobResult(Outcome outcome,
                                String jobId,
                                int year,
                                int month,
                                int attempted,
                                int resolved,
                                int skipped,
                                boolean degraded,
                                int syntheticCreated,
                                int isbnsQueued,
                                String summary) {

    public enum Outcome {
        COMPLETED,
        SKIPPED,
        FAILED
    }

    static BackfillJobResult skipped(String jobId, int year, int month, String reason) {
        return new BackfillJobResult(Outcome.SKIPPED, jobId, year, month, 0, 0, 0, false, 0, 0, reason);
    }

    static BackfillJobResult failed(String jobId, int year, int month, String reason) {
        return new BackfillJobResult(Outcome.FAILED, jobId, year, month, 0, 0, 0, false, 0, 0, reason);
    }
}
