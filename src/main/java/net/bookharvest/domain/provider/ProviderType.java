package net.bookharvest.domain.provider;

/**
 * Billing class of a provider. Paid providers draw from the daily quota budget.
 */
public enum ProviderType {
    FREE,
    PAID,
    AI
}
