package com.signalbot.backend.trading.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.config.SizingProperties;
import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.SafetyLimits;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotSignalHistory;
import com.signalbot.backend.model.BotStatus;
import com.signalbot.backend.model.ConfirmationState;
import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.model.Temperature;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.BotSignalHistoryRepository;
import com.signalbot.backend.service.BotLockRegistry;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.indicator.IndicatorFactory;
import com.signalbot.backend.service.indicator.MarketRegimeDetector;
import com.signalbot.backend.service.indicator.SignalConfigParser;
import com.signalbot.backend.util.TestCandleFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BotEvaluationServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");
    private static final SafetyLimits LIMITS = new SafetyLimits(
            new BigDecimal("25"), new BigDecimal("5"), 10, 5, 5, new BigDecimal("100"), Temperature.WARM,
            3, new BigDecimal("50"), Duration.ofDays(7));

    private BotRepository botRepository;
    private BotSignalHistoryRepository historyRepository;
    private TradingProperties tradingProperties;
    private Bot bot;

    @BeforeEach
    void setUp() {
        botRepository = mock(BotRepository.class);
        historyRepository = mock(BotSignalHistoryRepository.class);
        tradingProperties = new TradingProperties();
        bot = Bot.builder()
                .id(11L)
                .name("rsi-bot")
                .pair("BTC-USD")
                .status(BotStatus.RUNNING)
                .signalConfig("[{\"type\": \"rsi\", \"weight\": 1.0}]")
                .confirmationMinutes(5)
                .build();
        when(botRepository.findById(11L)).thenReturn(Optional.of(bot));
    }

    @Test
    void buySignalBecomesActionableAfterConfirmationWindow() {
        EvaluationResult first = serviceAt(T0).evaluate(bot, TestCandleFactory.trendingCandles(40, 200, -2));

        assertThat(first.action()).isEqualTo(SignalAction.BUY);
        assertThat(first.temperature()).isEqualTo(Temperature.HOT);
        assertThat(first.confirmation().state()).isEqualTo(ConfirmationState.CONFIRMING);
        assertThat(first.isActionable()).isFalse();
        assertThat(bot.getConfirmationAction()).isEqualTo(SignalAction.BUY);
        assertThat(bot.getSignalConfirmationStart()).isEqualTo(T0);
        assertThat(bot.getCurrentCombinedScore()).isEqualTo(-1.0);

        EvaluationResult second = serviceAt(T0.plus(Duration.ofMinutes(5)))
                .evaluate(bot, TestCandleFactory.trendingCandles(40, 200, -2));

        assertThat(second.confirmation().isConfirmed()).isTrue();
        assertThat(second.isActionable()).isTrue();
        assertThat(second.sizing()).isNotNull();
        assertThat(second.sizing().finalSizeUsd()).isBetween(new BigDecimal("5"), new BigDecimal("25"));
        verify(historyRepository, times(2)).save(any(BotSignalHistory.class));
    }

    @Test
    void invalidConfigurationYieldsHoldWithError() {
        bot.setSignalConfig("{\"rsi\": 5}");

        EvaluationResult result = serviceAt(T0).evaluate(bot, TestCandleFactory.trendingCandles(40, 200, -2));

        assertThat(result.hasError()).isTrue();
        assertThat(result.action()).isEqualTo(SignalAction.HOLD);
        assertThat(result.isActionable()).isFalse();
        assertThat(bot.getConfirmationState()).isEqualTo(ConfirmationState.NO_SIGNAL);

        ArgumentCaptor<BotSignalHistory> history = ArgumentCaptor.forClass(BotSignalHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(history.getValue().getEvaluationMetadata()).contains("error");
    }

    @Test
    void disabledConfirmationConfirmsImmediately() {
        tradingProperties.getConfirmation().setEnabled(false);

        EvaluationResult result = serviceAt(T0).evaluate(bot, TestCandleFactory.trendingCandles(40, 200, -2));

        assertThat(result.isActionable()).isTrue();
    }

    @Test
    void holdClearsPendingConfirmation() {
        bot.setConfirmationState(ConfirmationState.CONFIRMING);
        bot.setConfirmationAction(SignalAction.SELL);
        bot.setSignalConfirmationStart(T0.minusSeconds(60));

        EvaluationResult result = serviceAt(T0).evaluate(bot, TestCandleFactory.flatCandles(40, 100));

        assertThat(result.action()).isEqualTo(SignalAction.HOLD);
        assertThat(bot.getConfirmationState()).isEqualTo(ConfirmationState.NO_SIGNAL);
        assertThat(bot.getSignalConfirmationStart()).isNull();
    }

    @Test
    void reportsPersistedConfirmationProgress() {
        bot.setConfirmationState(ConfirmationState.CONFIRMING);
        bot.setConfirmationAction(SignalAction.BUY);
        bot.setSignalConfirmationStart(T0.minusSeconds(150));

        ConfirmationStatus status = serviceAt(T0).getConfirmationStatus(11L);

        assertThat(status.progress()).isEqualTo(0.5);
        assertThat(status.secondsRemaining()).isEqualTo(150);
        assertThatThrownBy(() -> serviceAt(T0).getConfirmationStatus(404L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void historyLimitIsClamped() {
        serviceAt(T0).getSignalHistory(11L, 10_000);
        serviceAt(T0).getSignalHistory(11L, 0);

        verify(historyRepository).findByBotIdOrderByEvaluatedAtDesc(11L, PageRequest.of(0, 500));
        verify(historyRepository).findByBotIdOrderByEvaluatedAtDesc(11L, PageRequest.of(0, 1));
    }

    private BotEvaluationService serviceAt(Instant now) {
        SizingProperties sizingProperties = new SizingProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        return new BotEvaluationService(
                new SignalAggregator(new SignalConfigParser(objectMapper), new IndicatorFactory()),
                new ActionResolver(),
                new ConfirmationTracker(),
                new PositionSizer(sizingProperties),
                new MarketRegimeDetector(sizingProperties),
                () -> LIMITS,
                botRepository,
                historyRepository,
                new BotLockRegistry(),
                tradingProperties,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                mock(MetricsService.class),
                objectMapper,
                Clock.fixed(now, ZoneOffset.UTC));
    }
}
