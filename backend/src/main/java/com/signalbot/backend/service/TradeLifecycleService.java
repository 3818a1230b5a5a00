package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.FillIngestion;
import com.signalbot.backend.dto.LedgerFillRequest;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.service.broker.BrokerClient.BrokerOrder;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moves trades from PENDING to a terminal status. A completed fill stamps filled_at,
 * adjusts the bot's position and feeds the ledger, all in one transaction committed under the
 * bot lock and the pair's ledger lock. A transition that cannot be persisted leaves the trade
 * PENDING and reports {@code false}; the order monitor retries it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeLifecycleService {

    private final TradeRepository tradeRepository;
    private final BotRepository botRepository;
    private final PositionLedgerService positionLedgerService;
    private final BotLockRegistry botLockRegistry;
    private final TradingProperties tradingProperties;
    private final TransactionTemplate transactionTemplate;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final Clock clock;

    /**
     * Applies the broker's view of an order.
     *
     * @return true when the trade is terminal afterwards
     */
    public boolean applyBrokerStatus(Long tradeId, BrokerOrder order) {
        TradeStatus target = TradeStatus.fromBrokerStatus(order.status());
        if (target == TradeStatus.PENDING) {
            log.debug("Order still open tradeId={} orderId={} brokerStatus={}", tradeId, order.orderId(), order.status());
            return false;
        }
        String error = target == TradeStatus.COMPLETED ? null : "Broker reported " + order.status();
        return finalizeTrade(tradeId, target, order, error);
    }

    public boolean markFailed(Long tradeId, String reason) {
        return finalizeTrade(tradeId, TradeStatus.FAILED, null, reason);
    }

    private boolean finalizeTrade(Long tradeId, TradeStatus target, BrokerOrder order, String error) {
        Trade trade = tradeRepository.findById(tradeId)
                .orElseThrow(() -> new NotFoundException("Trade " + tradeId + " not found"));
        if (trade.getStatus().isTerminal()) {
            return true;
        }
        Optional<BotLockRegistry.BotLock> lock = botLockRegistry.tryAcquire(trade.getBotId(), tradingProperties.getLockTimeout());
        if (lock.isEmpty()) {
            log.info("Bot busy, leaving trade pending for next poll tradeId={} botId={}", tradeId, trade.getBotId());
            return false;
        }
        try (BotLockRegistry.BotLock ignored = lock.get()) {
            // the ledger write joins this transaction, so the pair lock has to outlive the commit
            Boolean done = positionLedgerService.withPairLock(trade.getPair(),
                    () -> transactionTemplate.execute(status -> applyTransition(tradeId, target, order, error)));
            return Boolean.TRUE.equals(done);
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not finalize trade tradeId={} botId={} target={}, leaving it pending for the next poll",
                    tradeId, trade.getBotId(), target, e);
            metricsService.recordFinalizeFailure();
            return false;
        }
    }

    private boolean applyTransition(Long tradeId, TradeStatus target, BrokerOrder order, String error) {
        Trade trade = tradeRepository.findById(tradeId)
                .orElseThrow(() -> new NotFoundException("Trade " + tradeId + " not found"));
        if (trade.getStatus().isTerminal()) {
            log.debug("Trade already terminal tradeId={} status={}", tradeId, trade.getStatus());
            return true;
        }
        Instant now = Instant.now(clock);
        trade.transitionTo(target, now);

        Map<String, Object> audit = new HashMap<>();
        audit.put("status", target.name());
        audit.put("orderId", trade.getOrderId());

        if (target == TradeStatus.COMPLETED) {
            if (order != null && order.fillPrice() != null) {
                trade.setFillPrice(order.fillPrice());
            } else {
                trade.setFillPrice(trade.getPrice());
            }
            if (order != null && order.fee() != null) {
                trade.setFee(order.fee());
            }
            if (order != null && order.filledSize() != null && order.filledSize().signum() > 0) {
                trade.setSize(order.filledSize());
            }
            BigDecimal position = applyPositionUpdate(trade);
            audit.put("positionUsd", position);

            String fillId = trade.getOrderId() != null ? trade.getOrderId() : "trade-" + trade.getId();
            FillIngestion ingestion = positionLedgerService.ingestFill(new LedgerFillRequest(
                    fillId, trade.getPair(), trade.getSide(), trade.getSize(), trade.getFillPrice(), trade.getFee(), now));
            if (trade.getSide() == TradeSide.SELL && ingestion.applied()) {
                trade.setRealizedPnl(ingestion.realizedPnl());
                metricsService.addRealizedPnl(ingestion.realizedPnl().doubleValue());
                audit.put("realizedPnl", ingestion.realizedPnl());
            }
            metricsService.recordTradeFilled();
            log.info("Trade filled tradeId={} botId={} side={} size={} fillPrice={} fee={}",
                    trade.getId(), trade.getBotId(), trade.getSide(), trade.getSize(), trade.getFillPrice(), trade.getFee());
        } else {
            trade.setErrorMessage(error);
            log.warn("Trade closed without fill tradeId={} botId={} status={} reason={}",
                    trade.getId(), trade.getBotId(), target, error);
            audit.put("reason", error);
        }
        tradeRepository.save(trade);
        auditEventService.recordTradeEvent(trade, "TRADE_" + target.name(),
                "Trade " + trade.getId() + " " + target.name().toLowerCase(), audit);
        return true;
    }

    // Applied on fill only, never at submission. Never goes below zero.
    private BigDecimal applyPositionUpdate(Trade trade) {
        Bot bot = botRepository.findById(trade.getBotId())
                .orElseThrow(() -> new NotFoundException("Bot " + trade.getBotId() + " not found"));
        BigDecimal current = MoneyUtils.orZero(bot.getCurrentPositionSize());
        BigDecimal updated = trade.getSide() == TradeSide.BUY
                ? current.add(trade.getSizeUsd())
                : current.subtract(trade.getSizeUsd());
        if (updated.signum() < 0) {
            log.warn("Sell exceeds tracked position botId={} position={} sellUsd={}, clamping to zero",
                    bot.getId(), current, trade.getSizeUsd());
            updated = BigDecimal.ZERO;
        }
        bot.setCurrentPositionSize(MoneyUtils.scale(updated));
        botRepository.save(bot);
        log.info("Bot position updated botId={} positionUsd={}", bot.getId(), bot.getCurrentPositionSize());
        return bot.getCurrentPositionSize();
    }
}
