package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.MarketRegime;

import java.math.BigDecimal;

public record SizingResult(
        BigDecimal baseSizeUsd,
        MarketRegime regime,
        Double blendedVolatility,
        double regimeMultiplier,
        double volatilityMultiplier,
        double confidenceMultiplier,
        double rawMultiplier,
        double multiplier,
        BigDecimal finalSizeUsd,
        boolean limitedBySafety
) {}
