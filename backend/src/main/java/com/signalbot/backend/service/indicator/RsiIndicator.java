package com.signalbot.backend.service.indicator;

import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.trading.pipeline.SignalResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RsiIndicator extends AbstractIndicator {

    private final RsiConfig config;

    public RsiIndicator(RsiConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "RSI";
    }

    @Override
    public int getRequiredPeriods() {
        return config.getPeriod() + 1;
    }

    @Override
    protected SignalResult score(List<Double> closes) {
        double rsi = calculateRsi(closes, config.getPeriod());
        double oversold = config.getOversold();
        double overbought = config.getOverbought();

        double score;
        SignalAction action;
        double confidence;
        if (rsi <= oversold) {
            score = -(oversold - rsi) / oversold;
            action = SignalAction.BUY;
            confidence = Math.min(Math.abs(score), 1.0);
        } else if (rsi >= overbought) {
            score = (rsi - overbought) / (100 - overbought);
            action = SignalAction.SELL;
            confidence = Math.min(Math.abs(score), 1.0);
        } else {
            score = 0.0;
            action = SignalAction.HOLD;
            confidence = 0.1;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rsi_value", rsi);
        metadata.put("period", config.getPeriod());
        metadata.put("oversold_threshold", oversold);
        metadata.put("overbought_threshold", overbought);
        return new SignalResult(getName(), score, action, confidence, metadata);
    }

    // Wilder smoothing
    static double calculateRsi(List<Double> closes, int period) {
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
