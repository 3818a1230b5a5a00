package com.signalbot.backend.dto;

public enum ErrorKind {
    /** Malformed indicator config or insufficient data; resolved locally as hold. */
    VALIDATION,
    /** A limit, temperature, cooldown or pending-order rule refused the trade. */
    SAFETY_REJECTION,
    /** The per-bot lock was busy. Retry on the next cycle. */
    CONCURRENCY_CONFLICT,
    /** Broker or price feed failure. Safe to retry on the next cycle. */
    EXTERNAL_API,
    /** Duplicate fill ingestion; deduplicated silently. */
    DATA_INTEGRITY;

    public boolean isRetryable() {
        return this == CONCURRENCY_CONFLICT || this == EXTERNAL_API;
    }
}
