package com.signalbot.backend.trading.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.service.indicator.IndicatorFactory;
import com.signalbot.backend.service.indicator.MacdConfig;
import com.signalbot.backend.service.indicator.MovingAverageConfig;
import com.signalbot.backend.service.indicator.RsiConfig;
import com.signalbot.backend.service.indicator.SignalConfig;
import com.signalbot.backend.service.indicator.SignalConfigParser;
import com.signalbot.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalAggregatorTest {

    private final SignalAggregator aggregator =
            new SignalAggregator(new SignalConfigParser(new ObjectMapper()), new IndicatorFactory());

    @Test
    void weightsScoresAndConfidenceByIndicatorWeight() {
        RsiConfig rsi = new RsiConfig();
        rsi.setWeight(2.0);
        MovingAverageConfig ma = new MovingAverageConfig();
        ma.setWeight(1.0);

        // falling market: RSI pins at -1; fast MA below slow MA leans sell
        AggregatedSignal signal = aggregator.aggregate(new SignalConfig(List.of(rsi, ma)),
                TestCandleFactory.trendingCandles(40, 200, -1));

        double maScore = signal.signals().get(1).result().score();
        double maConfidence = signal.signals().get(1).result().confidence();
        assertThat(signal.hasError()).isFalse();
        assertThat(signal.totalWeight()).isEqualTo(3.0);
        assertThat(signal.score()).isCloseTo((-1.0 * 2 + maScore) / 3, within(1e-9));
        assertThat(signal.confidence()).isCloseTo((1.0 * 2 + maConfidence) / 3, within(1e-9));
        assertThat(maScore).isPositive();
    }

    @Test
    void disabledIndicatorsAreIgnored() {
        RsiConfig rsi = new RsiConfig();
        MacdConfig macd = new MacdConfig();
        macd.setEnabled(false);
        macd.setWeight(5.0);

        AggregatedSignal signal = aggregator.aggregate(new SignalConfig(List.of(rsi, macd)),
                TestCandleFactory.trendingCandles(40, 200, -1));

        assertThat(signal.signals()).extracting(AggregatedSignal.WeightedSignal::type).containsExactly("rsi");
        assertThat(signal.score()).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void insufficientIndicatorsDiluteInsteadOfDropping() {
        RsiConfig rsi = new RsiConfig();
        MacdConfig macd = new MacdConfig();

        // 20 candles: enough for RSI(14), not for MACD(26, 9)
        AggregatedSignal signal = aggregator.aggregate(new SignalConfig(List.of(rsi, macd)),
                TestCandleFactory.trendingCandles(20, 200, -1));

        assertThat(signal.signals().get(1).result().isInsufficientData()).isTrue();
        assertThat(signal.score()).isCloseTo(-0.5, within(1e-9));
        assertThat(signal.confidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void invalidConfigurationYieldsNeutralError() {
        AggregatedSignal signal = aggregator.aggregate("[{\"type\": \"unknown\"}]",
                TestCandleFactory.flatCandles(40, 100));

        assertThat(signal.hasError()).isTrue();
        assertThat(signal.score()).isZero();
        assertThat(signal.confidence()).isZero();
    }

    @Test
    void zeroTotalWeightIsAnError() {
        RsiConfig rsi = new RsiConfig();
        rsi.setWeight(0.0);

        AggregatedSignal signal = aggregator.aggregate(new SignalConfig(List.of(rsi)),
                TestCandleFactory.flatCandles(40, 100));

        assertThat(signal.hasError()).isTrue();
    }

    @Test
    void everyIndicatorResultIsReported() {
        AggregatedSignal signal = aggregator.aggregate(
                "[{\"type\":\"rsi\"},{\"type\":\"moving_average\"},{\"type\":\"macd\"}]",
                TestCandleFactory.flatCandles(60, 100));

        assertThat(signal.signals()).hasSize(3);
        assertThat(signal.signals()).allSatisfy(s -> assertThat(s.result().action()).isEqualTo(SignalAction.HOLD));
    }
}
