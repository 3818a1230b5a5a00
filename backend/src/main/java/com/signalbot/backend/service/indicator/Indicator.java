package com.signalbot.backend.service.indicator;

import com.signalbot.backend.model.Candle;
import com.signalbot.backend.trading.pipeline.SignalResult;

import java.util.List;

public interface Indicator {

    String getName();

    int getRequiredPeriods();

    /**
     * Scores the series. Never throws for short input; reports insufficient data instead.
     */
    SignalResult calculate(List<Candle> candles);
}
