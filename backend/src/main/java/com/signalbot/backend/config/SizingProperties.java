package com.signalbot.backend.config;

import com.signalbot.backend.model.MarketRegime;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "sizing")
@Data
@Validated
public class SizingProperties {

    @Positive
    private double minMultiplier = 0.2;

    @Positive
    private double maxMultiplier = 3.0;

    private Map<MarketRegime, Double> regimeMultipliers = defaultRegimeMultipliers();

    // upper bounds, checked in order; anything above the last uses highVolatilityMultiplier
    private List<Band> volatilityBands = new ArrayList<>(List.of(
            new Band(0.01, 1.2),
            new Band(0.03, 1.0),
            new Band(0.05, 0.8)));

    private double highVolatilityMultiplier = 0.6;

    // lower bounds, checked in order; anything below the last uses lowConfidenceMultiplier
    private List<Band> confidenceBands = new ArrayList<>(List.of(
            new Band(0.8, 1.1),
            new Band(0.6, 1.0),
            new Band(0.4, 0.8)));

    private double lowConfidenceMultiplier = 0.6;

    // short / medium / long timeframe weights for the blended volatility
    private List<Double> timeframeWeights = new ArrayList<>(List.of(0.3, 0.5, 0.2));

    private Regime regime = new Regime();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        private double threshold;
        private double multiplier;
    }

    @Data
    public static class Regime {
        private double strongTrendThreshold = 0.4;
        private double trendThreshold = 0.15;
        private double rangingThreshold = 0.05;

        @Positive
        private int fastPeriod = 10;

        @Positive
        private int slowPeriod = 20;

        // close-to-close return windows for short / medium / long volatility
        private List<Integer> volatilityWindows = new ArrayList<>(List.of(12, 24, 72));
    }

    private static Map<MarketRegime, Double> defaultRegimeMultipliers() {
        Map<MarketRegime, Double> multipliers = new EnumMap<>(MarketRegime.class);
        multipliers.put(MarketRegime.STRONG_TRENDING, 1.5);
        multipliers.put(MarketRegime.TRENDING, 1.2);
        multipliers.put(MarketRegime.RANGING, 0.8);
        multipliers.put(MarketRegime.CHOPPY, 0.5);
        multipliers.put(MarketRegime.UNKNOWN, 1.0);
        return multipliers;
    }
}
