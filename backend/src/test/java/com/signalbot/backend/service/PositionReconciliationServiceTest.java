package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.PositionReconciliation;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotStatus;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionReconciliationServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private BotRepository botRepository;
    private TradeRepository tradeRepository;
    private AuditEventService auditEventService;
    private AlertService alertService;
    private TradingProperties properties;
    private PositionReconciliationService service;
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        botRepository = mock(BotRepository.class);
        tradeRepository = mock(TradeRepository.class);
        auditEventService = mock(AuditEventService.class);
        alertService = mock(AlertService.class);
        properties = new TradingProperties();
        service = new PositionReconciliationService(botRepository, tradeRepository, new BotLockRegistry(), properties,
                new TransactionTemplate(mock(PlatformTransactionManager.class)), auditEventService, alertService,
                mock(ScheduledTaskGuard.class));
    }

    @Test
    void replaysFillsWithTheSameFloorAsLiveUpdates() {
        Bot bot = bot(1L, "15");
        when(tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(1L, TradeStatus.COMPLETED)).thenReturn(List.of(
                fill(TradeSide.BUY, "10", "0.0005"),
                // oversized sell floors at zero
                fill(TradeSide.SELL, "12", "0.0006"),
                fill(TradeSide.BUY, "15", "0.00075")));

        PositionReconciliation report = service.calculatePositionFromTrades(bot.getId());

        assertThat(report.tradeCount()).isEqualTo(3);
        assertThat(report.calculatedPositionUsd()).isEqualByComparingTo("15");
        assertThat(report.calculatedBaseQuantity()).isEqualByComparingTo("0.00075");
        assertThat(report.differenceUsd()).isEqualByComparingTo("0");
        assertThat(report.drifted()).isFalse();
    }

    @Test
    void driftBeyondToleranceIsReported() {
        Bot inSync = bot(1L, "10");
        Bot drifted = bot(2L, "25");
        when(botRepository.findAll()).thenReturn(List.of(inSync, drifted));
        when(tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(1L, TradeStatus.COMPLETED))
                .thenReturn(List.of(fill(TradeSide.BUY, "10.005", "0.0005")));
        when(tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(2L, TradeStatus.COMPLETED))
                .thenReturn(List.of(fill(TradeSide.BUY, "10", "0.0005")));

        List<PositionReconciliation> discrepancies = service.findDiscrepancies();

        assertThat(discrepancies).singleElement().satisfies(report -> {
            assertThat(report.botId()).isEqualTo(2L);
            assertThat(report.differenceUsd()).isEqualByComparingTo("-15");
        });
    }

    @Test
    void reconcileRewritesTrackedPositionAndAudits() {
        Bot bot = bot(2L, "25");
        when(tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(2L, TradeStatus.COMPLETED))
                .thenReturn(List.of(fill(TradeSide.BUY, "10", "0.0005")));

        PositionReconciliation report = service.reconcile(2L);

        assertThat(report.corrected()).isTrue();
        assertThat(bot.getCurrentPositionSize()).isEqualByComparingTo("10");
        verify(botRepository).save(bot);
        verify(auditEventService).recordEvent(eq(2L), eq("reconciliation"), eq("POSITION_CORRECTED"), any(), anyMap());
    }

    @Test
    void scheduledRunOnlyAlertsUnlessAutoCorrectIsOn() {
        Bot bot = bot(2L, "25");
        when(botRepository.findAll()).thenReturn(List.of(bot));
        when(tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(2L, TradeStatus.COMPLETED))
                .thenReturn(List.of(fill(TradeSide.BUY, "10", "0.0005")));

        List<PositionReconciliation> results = service.reconcileAll();

        assertThat(results).singleElement().satisfies(report -> assertThat(report.corrected()).isFalse());
        assertThat(bot.getCurrentPositionSize()).isEqualByComparingTo("25");
        verify(alertService).sendAlert(eq(2L), eq("POSITION_DRIFT"), any(), anyMap());
        verify(botRepository, never()).save(any());

        properties.getReconciliation().setAutoCorrect(true);
        assertThat(service.reconcileAll()).singleElement()
                .satisfies(report -> assertThat(report.corrected()).isTrue());
        assertThat(bot.getCurrentPositionSize()).isEqualByComparingTo("10");
    }

    private Bot bot(Long id, String trackedUsd) {
        Bot bot = Bot.builder()
                .id(id)
                .name("bot-" + id)
                .pair("BTC-USD")
                .status(BotStatus.RUNNING)
                .currentPositionSize(new BigDecimal(trackedUsd))
                .build();
        when(botRepository.findById(id)).thenReturn(Optional.of(bot));
        return bot;
    }

    private Trade fill(TradeSide side, String sizeUsd, String size) {
        long id = ids.incrementAndGet();
        return Trade.builder()
                .id(id)
                .side(side)
                .sizeUsd(new BigDecimal(sizeUsd))
                .size(new BigDecimal(size))
                .status(TradeStatus.COMPLETED)
                .filledAt(T0.plusSeconds(id * 60))
                .build();
    }
}
