package net.bookharvest.service;

/**
 * Outcome of {@link QuotaManager#shouldAllowOperation(QuotaManager.OperationKind, int)}.
 */
public record QuotaDecision(boolean allowed, String reason, QuotaStatus status) {
}
