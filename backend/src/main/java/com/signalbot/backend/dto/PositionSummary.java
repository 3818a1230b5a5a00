package com.signalbot.backend.dto;

import java.math.BigDecimal;

public record PositionSummary(
        String pair,
        BigDecimal currentQuantity,
        BigDecimal averageCostBasis,
        BigDecimal realizedPnl,
        BigDecimal unrealizedPnl,
        BigDecimal totalFees,
        int openLots
) {}
