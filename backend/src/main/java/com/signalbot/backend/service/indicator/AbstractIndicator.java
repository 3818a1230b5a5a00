package com.signalbot.backend.service.indicator;

import com.signalbot.backend.model.Candle;
import com.signalbot.backend.trading.pipeline.SignalResult;

import java.util.ArrayList;
import java.util.List;

abstract class AbstractIndicator implements Indicator {

    @Override
    public final SignalResult calculate(List<Candle> candles) {
        int available = candles == null ? 0 : candles.size();
        if (available < getRequiredPeriods()) {
            return SignalResult.insufficientData(getName(), getRequiredPeriods(), available);
        }
        return score(candles.stream().map(Candle::getClose).toList());
    }

    protected abstract SignalResult score(List<Double> closes);

    static List<Double> simpleMovingAverage(List<Double> values, int period) {
        List<Double> series = new ArrayList<>(values.size());
        double sum = 0.0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.get(i);
            if (i >= period) {
                sum -= values.get(i - period);
            }
            series.add(i >= period - 1 ? sum / period : null);
        }
        return series;
    }

    static List<Double> exponentialMovingAverage(List<Double> values, int period) {
        List<Double> series = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            series.add(null);
        }
        if (values.size() < period) {
            return series;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        series.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            series.set(i, ema);
        }
        return series;
    }
}
