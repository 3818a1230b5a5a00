package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.exception.InvalidSignalConfigException;
import com.signalbot.backend.model.Candle;
import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.service.indicator.Indicator;
import com.signalbot.backend.service.indicator.IndicatorConfig;
import com.signalbot.backend.service.indicator.IndicatorFactory;
import com.signalbot.backend.service.indicator.SignalConfig;
import com.signalbot.backend.service.indicator.SignalConfigParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combines enabled indicators into one score:
 * {@code sum(score_i * weight_i) / sum(weight_i)}. Confidence uses the same weights.
 * <p>
 * Indicators short of history stay in the normalization with a zero score and zero
 * confidence, so a partially warmed-up config reads weaker rather than louder.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalAggregator {

    private final SignalConfigParser signalConfigParser;
    private final IndicatorFactory indicatorFactory;

    public AggregatedSignal aggregate(String rawSignalConfig, List<Candle> candles) {
        SignalConfig config;
        try {
            config = signalConfigParser.parse(rawSignalConfig);
        } catch (InvalidSignalConfigException e) {
            log.warn("Invalid signal configuration: {}", e.getMessage());
            return AggregatedSignal.error("Invalid signal configuration: " + e.getMessage());
        }
        return aggregate(config, candles);
    }

    public AggregatedSignal aggregate(SignalConfig config, List<Candle> candles) {
        List<IndicatorConfig> enabled = config.enabledIndicators();
        if (enabled.isEmpty()) {
            return AggregatedSignal.error("No enabled indicators");
        }
        double totalWeight = config.totalEnabledWeight();
        if (totalWeight <= 0) {
            return AggregatedSignal.error("No enabled indicators with positive weight");
        }

        List<AggregatedSignal.WeightedSignal> signals = new ArrayList<>(enabled.size());
        double weightedScore = 0.0;
        double weightedConfidence = 0.0;
        for (IndicatorConfig indicatorConfig : enabled) {
            SignalResult result = calculate(indicatorConfig, candles);
            signals.add(new AggregatedSignal.WeightedSignal(indicatorConfig.getType(), indicatorConfig.getWeight(), result));
            weightedScore += result.score() * indicatorConfig.getWeight();
            weightedConfidence += result.confidence() * indicatorConfig.getWeight();
        }
        double score = Math.max(-1.0, Math.min(1.0, weightedScore / totalWeight));
        double confidence = Math.max(0.0, Math.min(1.0, weightedConfidence / totalWeight));
        return new AggregatedSignal(score, confidence, signals, totalWeight, null);
    }

    private SignalResult calculate(IndicatorConfig config, List<Candle> candles) {
        Indicator indicator = indicatorFactory.create(config);
        try {
            SignalResult result = indicator.calculate(candles == null ? List.of() : candles);
            if (result.isInsufficientData()) {
                log.debug("Indicator {} has insufficient data: {}", indicator.getName(), result.metadata());
            }
            return result;
        } catch (ArithmeticException | IndexOutOfBoundsException e) {
            log.warn("Indicator {} failed, treating as hold: {}", indicator.getName(), e.getMessage());
            return new SignalResult(indicator.getName(), 0.0, SignalAction.HOLD, 0.0,
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
