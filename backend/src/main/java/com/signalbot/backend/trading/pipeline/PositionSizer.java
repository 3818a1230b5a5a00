package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.config.SizingProperties;
import com.signalbot.backend.dto.SafetyLimits;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Scales a bot's base order size by regime, volatility and signal confidence.
 * Stateless: the same inputs always produce the same size.
 */
@Component
@RequiredArgsConstructor
public class PositionSizer {

    private final SizingProperties sizingProperties;

    public SizingResult size(BigDecimal baseSizeUsd, double confidence, RegimeSnapshot regime, SafetyLimits limits) {
        RegimeSnapshot snapshot = regime == null ? RegimeSnapshot.unknown() : regime;
        double regimeMultiplier = sizingProperties.getRegimeMultipliers()
                .getOrDefault(snapshot.regime(), 1.0);
        Double blendedVolatility = blendVolatility(snapshot.volatilities());
        double volatilityMultiplier = blendedVolatility == null ? 1.0 : volatilityMultiplier(blendedVolatility);
        double confidenceMultiplier = confidenceMultiplier(confidence);

        double rawMultiplier = regimeMultiplier * volatilityMultiplier * confidenceMultiplier;
        double multiplier = clamp(rawMultiplier, sizingProperties.getMinMultiplier(), sizingProperties.getMaxMultiplier());

        BigDecimal sized = MoneyUtils.scale(MoneyUtils.orZero(baseSizeUsd).multiply(BigDecimal.valueOf(multiplier)));
        BigDecimal finalSize = sized;
        if (limits != null) {
            finalSize = MoneyUtils.max(limits.minPositionUsd(), MoneyUtils.min(limits.maxPositionUsd(), sized));
            finalSize = MoneyUtils.scale(finalSize);
        }
        return new SizingResult(
                MoneyUtils.scale(baseSizeUsd),
                snapshot.regime(),
                blendedVolatility,
                regimeMultiplier,
                volatilityMultiplier,
                confidenceMultiplier,
                rawMultiplier,
                multiplier,
                finalSize,
                finalSize.compareTo(sized) != 0
        );
    }

    Double blendVolatility(List<Double> volatilities) {
        if (volatilities == null || volatilities.isEmpty()) {
            return null;
        }
        List<Double> weights = sizingProperties.getTimeframeWeights();
        if (weights != null && weights.size() == volatilities.size()) {
            double weighted = 0.0;
            double totalWeight = 0.0;
            for (int i = 0; i < volatilities.size(); i++) {
                weighted += volatilities.get(i) * weights.get(i);
                totalWeight += weights.get(i);
            }
            if (totalWeight > 0) {
                return weighted / totalWeight;
            }
        }
        return volatilities.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    double volatilityMultiplier(double volatility) {
        for (SizingProperties.Band band : sizingProperties.getVolatilityBands()) {
            if (volatility < band.getThreshold()) {
                return band.getMultiplier();
            }
        }
        return sizingProperties.getHighVolatilityMultiplier();
    }

    double confidenceMultiplier(double confidence) {
        for (SizingProperties.Band band : sizingProperties.getConfidenceBands()) {
            if (confidence >= band.getThreshold()) {
                return band.getMultiplier();
            }
        }
        return sizingProperties.getLowConfidenceMultiplier();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
