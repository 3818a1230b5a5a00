package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Market data held in memory. A feed publishes candles and marks here; the trading core reads them.
 */
@Service
@Slf4j
public class CandleStoreMarketDataProvider implements MarketDataProvider {

    private final Map<String, List<Candle>> candlesByKey = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> marks = new ConcurrentHashMap<>();

    public void publishCandles(String pair, String granularity, List<Candle> candles) {
        List<Candle> sorted = new ArrayList<>(candles);
        sorted.sort(Comparator.comparing(Candle::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
        candlesByKey.put(key(pair, granularity), List.copyOf(sorted));
        if (!sorted.isEmpty()) {
            marks.put(pair, BigDecimal.valueOf(sorted.get(sorted.size() - 1).getClose()));
        }
        log.debug("Stored {} candles for {} at granularity {}", sorted.size(), pair, granularity);
    }

    public void updatePrice(String pair, BigDecimal price) {
        marks.put(pair, price);
    }

    @Override
    public List<Candle> getHistorical(String pair, String granularity, int limit) {
        List<Candle> candles = candlesByKey.getOrDefault(key(pair, granularity), List.of());
        if (limit <= 0 || candles.size() <= limit) {
            return candles;
        }
        return candles.subList(candles.size() - limit, candles.size());
    }

    @Override
    public Optional<BigDecimal> getPrice(String pair) {
        return Optional.ofNullable(marks.get(pair));
    }

    private static String key(String pair, String granularity) {
        return pair + "|" + granularity;
    }
}
