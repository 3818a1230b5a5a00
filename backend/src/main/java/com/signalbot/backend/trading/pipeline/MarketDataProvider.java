package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.Candle;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface MarketDataProvider {

    /**
     * Candles in ascending time order. May be empty, which callers treat as insufficient data.
     */
    List<Candle> getHistorical(String pair, String granularity, int limit);

    Optional<BigDecimal> getPrice(String pair);
}
