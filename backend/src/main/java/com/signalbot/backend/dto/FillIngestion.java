package com.signalbot.backend.dto;

import java.math.BigDecimal;

/**
 * Result of ingesting one fill. {@code realizedPnl} is set for applied sells only;
 * {@code unmatchedQuantity} is the part of a sell that found no open lot.
 */
public record FillIngestion(boolean applied, BigDecimal realizedPnl, BigDecimal unmatchedQuantity) {

    public static FillIngestion duplicate() {
        return new FillIngestion(false, null, BigDecimal.ZERO);
    }
}
