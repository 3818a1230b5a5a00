package com.signalbot.backend.service.indicator;

import com.signalbot.backend.config.SizingProperties;
import com.signalbot.backend.model.MarketRegime;
import com.signalbot.backend.trading.pipeline.RegimeSnapshot;
import com.signalbot.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarketRegimeDetectorTest {

    private final SizingProperties properties = new SizingProperties();
    private final MarketRegimeDetector detector = new MarketRegimeDetector(properties);

    @Test
    void steadyUptrendIsStrongTrending() {
        RegimeSnapshot snapshot = detector.detect(TestCandleFactory.trendingCandles(100, 100, 1));

        assertThat(snapshot.regime()).isEqualTo(MarketRegime.STRONG_TRENDING);
        assertThat(snapshot.trendStrength()).isPositive();
        assertThat(snapshot.confidence()).isEqualTo(1.0);
        assertThat(snapshot.volatilities()).hasSize(3);
    }

    @Test
    void downtrendHasNegativeStrength() {
        RegimeSnapshot snapshot = detector.detect(TestCandleFactory.trendingCandles(100, 500, -2));

        assertThat(snapshot.trendStrength()).isNegative();
        assertThat(snapshot.regime()).isIn(MarketRegime.STRONG_TRENDING, MarketRegime.TRENDING);
    }

    @Test
    void flatMarketIsChoppy() {
        RegimeSnapshot snapshot = detector.detect(TestCandleFactory.flatCandles(100, 100));

        assertThat(snapshot.regime()).isEqualTo(MarketRegime.CHOPPY);
        assertThat(snapshot.volatilities()).containsOnly(0.0);
    }

    @Test
    void shortHistoryIsUnknown() {
        RegimeSnapshot snapshot = detector.detect(TestCandleFactory.flatCandles(20, 100));

        assertThat(snapshot.regime()).isEqualTo(MarketRegime.UNKNOWN);
        assertThat(snapshot.volatilities()).isEmpty();
    }

    @Test
    void volatilityWindowsNeedEnoughReturns() {
        RegimeSnapshot snapshot = detector.detect(TestCandleFactory.trendingCandles(30, 100, 1));

        // 29 returns: short and medium windows only
        assertThat(snapshot.volatilities()).hasSize(2);
    }

    @Test
    void classifiesWeightedStrength() {
        SizingProperties.Regime config = properties.getRegime();

        assertThat(detector.classify(0.5, 0.9, config)).isEqualTo(MarketRegime.STRONG_TRENDING);
        assertThat(detector.classify(-0.3, 0.6, config)).isEqualTo(MarketRegime.TRENDING);
        assertThat(detector.classify(0.1, 0.6, config)).isEqualTo(MarketRegime.RANGING);
        assertThat(detector.classify(0.1, 0.2, config)).isEqualTo(MarketRegime.CHOPPY);
    }
}
