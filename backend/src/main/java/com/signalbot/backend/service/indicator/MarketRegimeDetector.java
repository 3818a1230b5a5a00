package com.signalbot.backend.service.indicator;

import com.signalbot.backend.config.SizingProperties;
import com.signalbot.backend.model.Candle;
import com.signalbot.backend.model.MarketRegime;
import com.signalbot.backend.trading.pipeline.RegimeSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the trend regime of a candle series and measures close-to-close volatility
 * over the configured windows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketRegimeDetector {

    private final SizingProperties sizingProperties;

    public RegimeSnapshot detect(List<Candle> candles) {
        SizingProperties.Regime config = sizingProperties.getRegime();
        if (candles == null || candles.size() < config.getSlowPeriod() + 1) {
            return RegimeSnapshot.unknown();
        }
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> returns = returns(closes);

        double strength = trendStrength(closes, config.getFastPeriod(), config.getSlowPeriod());
        double confidence = trendConfidence(closes, returns, strength, config.getSlowPeriod());
        MarketRegime regime = classify(strength, confidence, config);

        List<Double> volatilities = new ArrayList<>();
        for (Integer window : config.getVolatilityWindows()) {
            if (window != null && window > 1 && returns.size() >= window) {
                volatilities.add(standardDeviation(returns.subList(returns.size() - window, returns.size())));
            }
        }
        log.debug("Regime detected regime={} strength={} confidence={} volatilities={}",
                regime, strength, confidence, volatilities);
        return new RegimeSnapshot(regime, strength, confidence, volatilities);
    }

    MarketRegime classify(double strength, double confidence, SizingProperties.Regime config) {
        double weighted = Math.abs(strength) * confidence;
        if (weighted >= config.getStrongTrendThreshold()) {
            return MarketRegime.STRONG_TRENDING;
        }
        if (weighted >= config.getTrendThreshold()) {
            return MarketRegime.TRENDING;
        }
        if (weighted >= config.getRangingThreshold()) {
            return MarketRegime.RANGING;
        }
        return MarketRegime.CHOPPY;
    }

    // Positive for an uptrend, negative for a downtrend, in [-1, 1]
    private double trendStrength(List<Double> closes, int fastPeriod, int slowPeriod) {
        double fast = average(closes.subList(closes.size() - fastPeriod, closes.size()));
        double slow = average(closes.subList(closes.size() - slowPeriod, closes.size()));
        double separation = slow == 0 ? 0.0 : (fast - slow) / slow;
        double first = closes.get(closes.size() - slowPeriod - 1);
        double change = first == 0 ? 0.0 : (closes.get(closes.size() - 1) - first) / first;
        double composite = 0.6 * Math.tanh(separation * 20) + 0.4 * Math.tanh(change * 10);
        return Math.max(-1.0, Math.min(1.0, composite));
    }

    // Share of recent returns agreeing with the trend direction, plus a bonus when price sits on the trend side of the slow average
    private double trendConfidence(List<Double> closes, List<Double> returns, double strength, int slowPeriod) {
        if (strength == 0.0) {
            return 0.0;
        }
        List<Double> recent = returns.subList(Math.max(0, returns.size() - slowPeriod), returns.size());
        long agreeing = recent.stream().filter(r -> Math.signum(r) == Math.signum(strength)).count();
        double confidence = recent.isEmpty() ? 0.0 : (double) agreeing / recent.size();
        double slow = average(closes.subList(closes.size() - slowPeriod, closes.size()));
        double last = closes.get(closes.size() - 1);
        if (Math.signum(last - slow) == Math.signum(strength)) {
            confidence += 0.15;
        }
        return Math.min(1.0, confidence);
    }

    private static List<Double> returns(List<Double> closes) {
        List<Double> returns = new ArrayList<>(closes.size());
        for (int i = 1; i < closes.size(); i++) {
            double previous = closes.get(i - 1);
            returns.add(previous == 0 ? 0.0 : (closes.get(i) - previous) / previous);
        }
        return returns;
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double standardDeviation(List<Double> values) {
        double mean = average(values);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / (values.size() - 1);
        return Math.sqrt(variance);
    }
}
