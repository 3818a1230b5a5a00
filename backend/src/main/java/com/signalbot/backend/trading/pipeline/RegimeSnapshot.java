package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.MarketRegime;

import java.util.List;

/**
 * Trend and volatility reading for a pair. Volatilities are ordered short, medium, long and
 * may hold fewer entries when history is short.
 */
public record RegimeSnapshot(
        MarketRegime regime,
        double trendStrength,
        double confidence,
        List<Double> volatilities
) {

    public RegimeSnapshot {
        volatilities = volatilities == null ? List.of() : List.copyOf(volatilities);
    }

    public static RegimeSnapshot unknown() {
        return new RegimeSnapshot(MarketRegime.UNKNOWN, 0.0, 0.0, List.of());
    }
}
