package com.signalbot.backend.service.indicator;

import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.trading.pipeline.SignalResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fast/slow simple moving average crossover. A fresh crossover scores 0.8; otherwise the
 * score follows the separation between the two averages.
 */
public class MovingAverageIndicator extends AbstractIndicator {

    static final double CROSSOVER_SCORE = 0.8;
    static final double ACTION_THRESHOLD = 0.1;

    private final MovingAverageConfig config;

    public MovingAverageIndicator(MovingAverageConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "MA_Crossover";
    }

    @Override
    public int getRequiredPeriods() {
        return Math.max(config.getFastPeriod(), config.getSlowPeriod()) + 1;
    }

    @Override
    protected SignalResult score(List<Double> closes) {
        List<Double> fast = simpleMovingAverage(closes, config.getFastPeriod());
        List<Double> slow = simpleMovingAverage(closes, config.getSlowPeriod());
        int last = closes.size() - 1;
        double currentFast = fast.get(last);
        double currentSlow = slow.get(last);
        double prevFast = fast.get(last - 1);
        double prevSlow = slow.get(last - 1);

        boolean bullishCrossover = prevFast <= prevSlow && currentFast > currentSlow;
        boolean bearishCrossover = prevFast >= prevSlow && currentFast < currentSlow;
        double separation = currentSlow == 0 ? 0.0 : (currentFast - currentSlow) / currentSlow;

        double score;
        SignalAction action;
        double confidence;
        if (bullishCrossover) {
            score = -CROSSOVER_SCORE;
            action = SignalAction.BUY;
            confidence = CROSSOVER_SCORE;
        } else if (bearishCrossover) {
            score = CROSSOVER_SCORE;
            action = SignalAction.SELL;
            confidence = CROSSOVER_SCORE;
        } else {
            // fast above slow is bullish, which maps to a negative score
            score = -Math.tanh(separation * 10);
            action = score < -ACTION_THRESHOLD ? SignalAction.BUY
                    : score > ACTION_THRESHOLD ? SignalAction.SELL : SignalAction.HOLD;
            confidence = Math.abs(score) * 0.5;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fast_ma", currentFast);
        metadata.put("slow_ma", currentSlow);
        metadata.put("fast_period", config.getFastPeriod());
        metadata.put("slow_period", config.getSlowPeriod());
        metadata.put("separation_pct", separation * 100);
        return new SignalResult(getName(), score, action, confidence, metadata);
    }
}
