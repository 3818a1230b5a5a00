package com.signalbot.backend.service.indicator;

import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.trading.pipeline.SignalResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MacdIndicator extends AbstractIndicator {

    static final double CROSSOVER_SCORE = 0.8;
    static final double ACTION_THRESHOLD = 0.1;

    private final MacdConfig config;

    public MacdIndicator(MacdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "MACD";
    }

    // slow EMA warm-up plus signal EMA warm-up, plus one bar to detect a crossover
    @Override
    public int getRequiredPeriods() {
        return config.getSlowPeriod() + config.getSignalPeriod();
    }

    @Override
    protected SignalResult score(List<Double> closes) {
        List<Double> fastSeries = exponentialMovingAverage(closes, config.getFastPeriod());
        List<Double> slowSeries = exponentialMovingAverage(closes, config.getSlowPeriod());

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }
        List<Double> signalSeries = exponentialMovingAverage(macdSeries, config.getSignalPeriod());
        int last = macdSeries.size() - 1;
        double macdLine = macdSeries.get(last);
        double signalLine = signalSeries.get(last);
        double histogram = macdLine - signalLine;
        Double prevSignal = signalSeries.get(last - 1);
        double prevHistogram = prevSignal == null ? histogram : macdSeries.get(last - 1) - prevSignal;
        double lastClose = closes.get(closes.size() - 1);

        double score;
        SignalAction action;
        double confidence;
        if (prevHistogram <= 0 && histogram > 0) {
            score = -CROSSOVER_SCORE;
            action = SignalAction.BUY;
            confidence = CROSSOVER_SCORE;
        } else if (prevHistogram >= 0 && histogram < 0) {
            score = CROSSOVER_SCORE;
            action = SignalAction.SELL;
            confidence = CROSSOVER_SCORE;
        } else {
            double normalized = lastClose <= 0 ? 0.0 : histogram / lastClose;
            score = -Math.tanh(normalized * 100);
            action = score < -ACTION_THRESHOLD ? SignalAction.BUY
                    : score > ACTION_THRESHOLD ? SignalAction.SELL : SignalAction.HOLD;
            confidence = Math.abs(score) * 0.5;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("macd_line", macdLine);
        metadata.put("signal_line", signalLine);
        metadata.put("histogram", histogram);
        metadata.put("fast_period", config.getFastPeriod());
        metadata.put("slow_period", config.getSlowPeriod());
        metadata.put("signal_period", config.getSignalPeriod());
        return new SignalResult(getName(), score, action, confidence, metadata);
    }
}
