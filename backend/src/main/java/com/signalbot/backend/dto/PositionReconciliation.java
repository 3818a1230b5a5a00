package com.signalbot.backend.dto;

import java.math.BigDecimal;

/**
 * A bot's tracked position against the position rebuilt from its completed trades.
 */
public record PositionReconciliation(
        Long botId,
        String pair,
        int tradeCount,
        BigDecimal calculatedPositionUsd,
        BigDecimal calculatedBaseQuantity,
        BigDecimal trackedPositionUsd,
        BigDecimal differenceUsd,
        boolean drifted,
        boolean corrected
) {

    public PositionReconciliation asCorrected() {
        return new PositionReconciliation(botId, pair, tradeCount, calculatedPositionUsd, calculatedBaseQuantity,
                trackedPositionUsd, differenceUsd, drifted, true);
    }
}
