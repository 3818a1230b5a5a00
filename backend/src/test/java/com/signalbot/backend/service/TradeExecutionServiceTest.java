package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.ErrorKind;
import com.signalbot.backend.dto.ExecutionResult;
import com.signalbot.backend.dto.RejectReason;
import com.signalbot.backend.dto.SafetyCheckResult;
import com.signalbot.backend.dto.SignalSnapshot;
import com.signalbot.backend.exception.BrokerApiException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotStatus;
import com.signalbot.backend.model.Temperature;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.service.broker.BrokerClient;
import com.signalbot.backend.service.broker.BrokerClient.BrokerOrder;
import com.signalbot.backend.trading.pipeline.MarketDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TradeExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final BigDecimal PRICE = new BigDecimal("20000");

    private BotRepository botRepository;
    private TradeRepository tradeRepository;
    private TradingSafetyService safetyService;
    private TradeCooldownService cooldownService;
    private TradeLifecycleService lifecycleService;
    private BotLockRegistry lockRegistry;
    private MarketDataProvider marketDataProvider;
    private BrokerClient brokerClient;
    private AuditEventService auditEventService;
    private TradeExecutionService service;
    private Bot bot;

    @BeforeEach
    void setUp() {
        botRepository = mock(BotRepository.class);
        tradeRepository = mock(TradeRepository.class);
        safetyService = mock(TradingSafetyService.class);
        cooldownService = mock(TradeCooldownService.class);
        lifecycleService = mock(TradeLifecycleService.class);
        lockRegistry = new BotLockRegistry();
        marketDataProvider = mock(MarketDataProvider.class);
        brokerClient = mock(BrokerClient.class);
        auditEventService = mock(AuditEventService.class);
        TradingProperties properties = new TradingProperties();
        properties.setLockTimeout(Duration.ofMillis(100));
        service = new TradeExecutionService(botRepository, tradeRepository, safetyService, cooldownService,
                lifecycleService, lockRegistry, marketDataProvider, brokerClient, properties,
                new TransactionTemplate(mock(PlatformTransactionManager.class)), mock(MetricsService.class),
                auditEventService, Clock.fixed(NOW, ZoneOffset.UTC));

        bot = Bot.builder().id(1L).name("btc-bot").pair("BTC-USD").status(BotStatus.RUNNING)
                .currentCombinedScore(-0.5).build();
        when(botRepository.findById(1L)).thenReturn(Optional.of(bot));
        when(safetyService.check(any(), any(), any(), any())).thenReturn(SafetyCheckResult.ok());
        when(cooldownService.remainingCooldown(bot)).thenReturn(Optional.empty());
        when(marketDataProvider.getPrice("BTC-USD")).thenReturn(Optional.of(PRICE));
        when(tradeRepository.saveAndFlush(any(Trade.class))).thenAnswer(invocation -> {
            Trade trade = invocation.getArgument(0);
            trade.setId(42L);
            return trade;
        });
    }

    @Test
    void submitsOrderAndWritesPendingTradeFirst() {
        when(brokerClient.placeOrder(eq("BTC-USD"), eq(TradeSide.BUY), any()))
                .thenReturn(new BrokerOrder("ord-9", "BTC-USD", TradeSide.BUY, "OPEN", null, null, null));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, new BigDecimal("10"), Temperature.HOT,
                new SignalSnapshot(-0.62, "{\"rsi\":-0.6}"));

        assertThat(result.success()).isTrue();
        assertThat(result.tradeId()).isEqualTo(42L);
        assertThat(result.orderId()).isEqualTo("ord-9");
        assertThat(result.baseSize()).isEqualByComparingTo("0.0005");

        ArgumentCaptor<Trade> saved = ArgumentCaptor.forClass(Trade.class);
        verify(tradeRepository).saveAndFlush(saved.capture());
        Trade trade = saved.getValue();
        assertThat(trade.getStatus()).isEqualTo(TradeStatus.PENDING);
        assertThat(trade.getSizeUsd()).isEqualByComparingTo("10");
        assertThat(trade.getCombinedSignalScore()).isEqualTo(-0.62);
        assertThat(trade.getFilledAt()).isNull();
        assertThat(trade.getOrderId()).isEqualTo("ord-9");
        verify(brokerClient).placeOrder(eq("BTC-USD"), eq(TradeSide.BUY),
                argThat(quantity -> quantity.compareTo(new BigDecimal("0.0005")) == 0));
        verify(lifecycleService).applyBrokerStatus(eq(42L), any());
    }

    @Test
    void busyLockRejectsWithoutSideEffects() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (BotLockRegistry.BotLock ignored = lockRegistry.tryAcquire(1L, Duration.ofSeconds(1)).orElseThrow()) {
                acquired.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);
        release.countDown();
        holder.join();

        assertThat(result.success()).isFalse();
        assertThat(result.rejectReason()).isEqualTo(RejectReason.TRADE_IN_PROGRESS);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.CONCURRENCY_CONFLICT);
        verifyNoInteractions(brokerClient);
        verify(tradeRepository, never()).saveAndFlush(any());
    }

    @Test
    void overlappingExecutionIsTurnedAwayWithoutWaiting() {
        try (BotLockRegistry.ExecutionSlot inFlight = lockRegistry.tryBeginExecution(1L).orElseThrow()) {
            ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

            assertThat(result.rejectReason()).isEqualTo(RejectReason.TRADE_IN_PROGRESS);
            verifyNoInteractions(botRepository, brokerClient);
        }
        assertThat(lockRegistry.isExecuting(1L)).isFalse();
    }

    @Test
    void executionSlotIsReleasedAfterEveryOutcome() {
        when(brokerClient.placeOrder(any(), any(), any())).thenThrow(new BrokerApiException("503 from exchange"));

        service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(lockRegistry.isExecuting(1L)).isFalse();
    }

    @Test
    void fillThatCannotBePersistedStillReportsTheSubmittedOrder() {
        when(brokerClient.placeOrder(any(), any(), any()))
                .thenReturn(new BrokerOrder("ord-9", "BTC-USD", TradeSide.BUY, "FILLED", null, PRICE, null));
        when(lifecycleService.applyBrokerStatus(eq(42L), any()))
                .thenThrow(new DataIntegrityViolationException("pair_positions(pair)"));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.success()).isTrue();
        assertThat(result.orderId()).isEqualTo("ord-9");
        verify(auditEventService).recordTradeEvent(any(Trade.class), eq("TRADE_FINALIZE_DEFERRED"), any(), any());
    }

    @Test
    void stoppedBotIsRejected() {
        bot.setStatus(BotStatus.STOPPED);

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.BOT_NOT_RUNNING);
        verifyNoInteractions(safetyService);
    }

    @Test
    void unknownBotIsRejected() {
        ExecutionResult result = service.executeTrade(99L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.BOT_NOT_FOUND);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    void invalidRequestIsRejectedBeforeLocking() {
        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.ZERO, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.INVALID_REQUEST);
        verifyNoInteractions(botRepository);
    }

    @Test
    void safetyRejectionIsPassedThrough() {
        when(safetyService.check(any(), any(), any(), any()))
                .thenReturn(SafetyCheckResult.reject(RejectReason.TEMPERATURE_TOO_LOW, "too cold"));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.COOL);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.TEMPERATURE_TOO_LOW);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.SAFETY_REJECTION);
        assertThat(result.error()).isEqualTo("too cold");
        verifyNoInteractions(brokerClient);
    }

    @Test
    void existingPendingOrderBlocksNewOrder() {
        when(tradeRepository.existsByBotIdAndStatus(1L, TradeStatus.PENDING)).thenReturn(true);

        ExecutionResult result = service.executeTrade(1L, TradeSide.SELL, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.PENDING_ORDER_EXISTS);
        verify(cooldownService, never()).remainingCooldown(any());
    }

    @Test
    void activeCooldownBlocksOrder() {
        when(cooldownService.remainingCooldown(bot)).thenReturn(Optional.of(Duration.ofMinutes(7)));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.COOLDOWN_ACTIVE);
        assertThat(result.error()).contains("420s");
        verifyNoInteractions(brokerClient);
    }

    @Test
    void missingPriceIsReportedAsExternalFailure() {
        when(marketDataProvider.getPrice("BTC-USD")).thenReturn(Optional.empty());

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.PRICE_UNAVAILABLE);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.EXTERNAL_API);
    }

    @Test
    void uniqueIndexViolationMapsToPendingOrderExists() {
        when(tradeRepository.saveAndFlush(any(Trade.class)))
                .thenThrow(new DataIntegrityViolationException("uq_trades_one_pending_per_bot"));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.rejectReason()).isEqualTo(RejectReason.PENDING_ORDER_EXISTS);
        verifyNoInteractions(brokerClient);
    }

    @Test
    void brokerFailureMarksTradeFailed() {
        when(brokerClient.placeOrder(any(), any(), any())).thenThrow(new BrokerApiException("503 from exchange"));

        ExecutionResult result = service.executeTrade(1L, TradeSide.BUY, BigDecimal.TEN, Temperature.HOT);

        assertThat(result.success()).isFalse();
        assertThat(result.tradeId()).isEqualTo(42L);
        assertThat(result.rejectReason()).isEqualTo(RejectReason.BROKER_ERROR);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.EXTERNAL_API);
        verify(lifecycleService).markFailed(eq(42L), any());
        verify(lifecycleService, never()).applyBrokerStatus(anyLong(), any());
    }
}
