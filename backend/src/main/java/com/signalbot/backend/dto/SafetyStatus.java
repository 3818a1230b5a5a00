package com.signalbot.backend.dto;

import java.math.BigDecimal;

public record SafetyStatus(
        SafetyLimits limits,
        long tradesToday,
        long remainingTrades,
        BigDecimal dailyLossUsd,
        long activePositions,
        boolean tradingAllowed
) {}
