package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.ExecutionResult;
import com.signalbot.backend.dto.RejectReason;
import com.signalbot.backend.dto.SafetyCheckResult;
import com.signalbot.backend.dto.SignalSnapshot;
import com.signalbot.backend.exception.BrokerApiException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Temperature;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.service.broker.BrokerClient;
import com.signalbot.backend.service.broker.BrokerClient.BrokerOrder;
import com.signalbot.backend.trading.pipeline.MarketDataProvider;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Submits at most one order per bot at a time.
 * <p>
 * A call first claims the bot's execution slot; an overlapping call for the same bot is rejected
 * with {@link RejectReason#TRADE_IN_PROGRESS} right away rather than waiting its turn. The
 * preconditions (bot status, safety limits, pending order, cooldown) are then checked and the
 * PENDING trade row is written while holding the bot's lock. Rejections and failures come back
 * as an {@link ExecutionResult}; nothing is thrown to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeExecutionService {

    private final BotRepository botRepository;
    private final TradeRepository tradeRepository;
    private final TradingSafetyService tradingSafetyService;
    private final TradeCooldownService tradeCooldownService;
    private final TradeLifecycleService tradeLifecycleService;
    private final BotLockRegistry botLockRegistry;
    private final MarketDataProvider marketDataProvider;
    private final BrokerClient brokerClient;
    private final TradingProperties tradingProperties;
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;
    private final AuditEventService auditEventService;
    private final Clock clock;

    public ExecutionResult executeTrade(Long botId, TradeSide side, BigDecimal sizeUsd, Temperature temperature) {
        return executeTrade(botId, side, sizeUsd, temperature, null);
    }

    public ExecutionResult executeTrade(Long botId, TradeSide side, BigDecimal sizeUsd, Temperature temperature,
                                        SignalSnapshot snapshot) {
        String previousBotId = MDC.get("botId");
        boolean ownsCorrelationId = MDC.get("correlationId") == null;
        if (ownsCorrelationId) {
            MDC.put("correlationId", UUID.randomUUID().toString());
        }
        MDC.put("botId", String.valueOf(botId));
        try {
            if (botId == null || side == null || sizeUsd == null || sizeUsd.signum() <= 0) {
                return reject(botId, RejectReason.INVALID_REQUEST,
                        String.format("Invalid trade request side=%s sizeUsd=%s", side, sizeUsd));
            }
            Optional<BotLockRegistry.ExecutionSlot> slot = botLockRegistry.tryBeginExecution(botId);
            if (slot.isEmpty()) {
                return reject(botId, RejectReason.TRADE_IN_PROGRESS, "Another trade for this bot is in progress");
            }
            try (BotLockRegistry.ExecutionSlot ignoredSlot = slot.get()) {
                Optional<BotLockRegistry.BotLock> lock = botLockRegistry.tryAcquire(botId, tradingProperties.getLockTimeout());
                if (lock.isEmpty()) {
                    return reject(botId, RejectReason.TRADE_IN_PROGRESS, "Bot is busy, try again next cycle");
                }
                try (BotLockRegistry.BotLock ignored = lock.get()) {
                    return executeLocked(botId, side, MoneyUtils.scale(sizeUsd), temperature, snapshot);
                }
            }
        } finally {
            MDC.remove("tradeId");
            if (previousBotId != null) {
                MDC.put("botId", previousBotId);
            } else {
                MDC.remove("botId");
            }
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    private ExecutionResult executeLocked(Long botId, TradeSide side, BigDecimal sizeUsd, Temperature temperature,
                                          SignalSnapshot snapshot) {
        Optional<Bot> maybeBot = botRepository.findById(botId);
        if (maybeBot.isEmpty()) {
            return reject(botId, RejectReason.BOT_NOT_FOUND, "Bot " + botId + " not found");
        }
        Bot bot = maybeBot.get();
        if (bot.getStatus() == null || !bot.getStatus().isTradeable()) {
            return reject(botId, RejectReason.BOT_NOT_RUNNING, "Bot is " + bot.getStatus());
        }

        SafetyCheckResult safety = tradingSafetyService.check(bot, side, sizeUsd, temperature);
        if (!safety.allowed()) {
            return reject(botId, safety.reason(), safety.message());
        }

        if (tradeRepository.existsByBotIdAndStatus(botId, TradeStatus.PENDING)) {
            return reject(botId, RejectReason.PENDING_ORDER_EXISTS, "Bot already has a pending order");
        }

        Optional<Duration> cooldown = tradeCooldownService.remainingCooldown(bot);
        if (cooldown.isPresent()) {
            return reject(botId, RejectReason.COOLDOWN_ACTIVE,
                    String.format("Cooldown active, %ds remaining", cooldown.get().toSeconds()));
        }

        BigDecimal price;
        try {
            price = marketDataProvider.getPrice(bot.getPair()).filter(p -> p.signum() > 0).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Price lookup failed pair={}: {}", bot.getPair(), e.getMessage());
            price = null;
        }
        if (price == null) {
            return reject(botId, RejectReason.PRICE_UNAVAILABLE, "No current price for " + bot.getPair());
        }
        BigDecimal baseSize = MoneyUtils.toBaseQuantity(sizeUsd, price);
        if (baseSize.signum() <= 0) {
            return reject(botId, RejectReason.INVALID_REQUEST, "Order size rounds to zero at price " + price);
        }

        Trade trade;
        try {
            trade = insertPendingTrade(bot, side, sizeUsd, baseSize, price, temperature, snapshot);
        } catch (DataIntegrityViolationException e) {
            // the pending-order index caught a row written outside this process
            return reject(botId, RejectReason.PENDING_ORDER_EXISTS, "Bot already has a pending order");
        }
        MDC.put("tradeId", String.valueOf(trade.getId()));

        BrokerOrder order;
        try {
            order = brokerClient.placeOrder(bot.getPair(), side, baseSize);
        } catch (BrokerApiException e) {
            return brokerFailure(trade, e.getMessage(), e);
        } catch (RuntimeException e) {
            return brokerFailure(trade, "Unexpected broker error: " + e.getMessage(), e);
        }
        if (order == null || order.orderId() == null) {
            return brokerFailure(trade, "Broker returned no order id", null);
        }

        try {
            recordSubmission(bot, trade, order, side, sizeUsd, price);
            // Paper and some live orders fill synchronously
            tradeLifecycleService.applyBrokerStatus(trade.getId(), order);
        } catch (RuntimeException e) {
            // the order is live at the broker; the monitor picks the trade up on its next poll
            log.error("Order submitted but not finalized botId={} tradeId={} orderId={}",
                    botId, trade.getId(), order.orderId(), e);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("orderId", order.orderId());
            metadata.put("error", e.getMessage());
            auditEventService.recordTradeEvent(trade, "TRADE_FINALIZE_DEFERRED",
                    "Order submitted, fill left for the order monitor", metadata);
        }
        return ExecutionResult.submitted(trade.getId(), order.orderId(), baseSize, price);
    }

    private void recordSubmission(Bot bot, Trade trade, BrokerOrder order, TradeSide side, BigDecimal sizeUsd,
                                  BigDecimal price) {
        trade.setOrderId(order.orderId());
        trade.setUpdatedAt(Instant.now(clock));
        transactionTemplate.executeWithoutResult(status -> tradeRepository.save(trade));
        metricsService.incrementTradesSubmitted();
        log.info("Order submitted botId={} tradeId={} orderId={} side={} sizeUsd={} baseSize={} price={}",
                bot.getId(), trade.getId(), order.orderId(), side, sizeUsd, trade.getSize(), price);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("orderId", order.orderId());
        metadata.put("side", side.name());
        metadata.put("sizeUsd", sizeUsd);
        metadata.put("price", price);
        auditEventService.recordTradeEvent(trade, "TRADE_SUBMITTED", "Order submitted to broker", metadata);
    }

    private Trade insertPendingTrade(Bot bot, TradeSide side, BigDecimal sizeUsd, BigDecimal baseSize,
                                     BigDecimal price, Temperature temperature, SignalSnapshot snapshot) {
        Instant now = Instant.now(clock);
        Trade trade = Trade.builder()
                .botId(bot.getId())
                .pair(bot.getPair())
                .side(side)
                .size(baseSize)
                .sizeUsd(sizeUsd)
                .price(price)
                .status(TradeStatus.PENDING)
                .temperature(temperature)
                .combinedSignalScore(snapshot != null ? snapshot.combinedScore() : bot.getCurrentCombinedScore())
                .signalScores(snapshot != null ? snapshot.signalScoresJson() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return transactionTemplate.execute(status -> tradeRepository.saveAndFlush(trade));
    }

    private ExecutionResult brokerFailure(Trade trade, String message, Exception cause) {
        log.error("Broker order failed botId={} tradeId={}: {}", trade.getBotId(), trade.getId(), message, cause);
        metricsService.incrementBrokerFailures();
        metricsService.recordReject(RejectReason.BROKER_ERROR.name());
        tradeLifecycleService.markFailed(trade.getId(), message);
        return ExecutionResult.failed(trade.getId(), RejectReason.BROKER_ERROR, message);
    }

    private ExecutionResult reject(Long botId, RejectReason reason, String message) {
        if (reason == RejectReason.TRADE_IN_PROGRESS) {
            log.info("Trade rejected botId={} reason={} detail={}", botId, reason, message);
        } else {
            log.warn("Trade rejected botId={} reason={} detail={}", botId, reason, message);
        }
        metricsService.recordReject(reason.name());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", reason.name());
        metadata.put("detail", message);
        auditEventService.recordEvent(botId, "trade", "TRADE_REJECTED", message, metadata);
        return ExecutionResult.rejected(reason, message);
    }
}
