package com.signalbot.backend.dto;

import com.signalbot.backend.model.Temperature;

import java.math.BigDecimal;
import java.time.Duration;

public record SafetyLimits(
        BigDecimal maxPositionUsd,
        BigDecimal minPositionUsd,
        int maxDailyTrades,
        int maxTradesPerBotDaily,
        int maxActivePositions,
        BigDecimal maxDailyLossUsd,
        Temperature minTemperature,
        int maxConsecutiveLosses,
        BigDecimal emergencyStopLossUsd,
        Duration emergencyLookback
) {}
