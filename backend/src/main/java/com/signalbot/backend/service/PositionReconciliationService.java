package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.PositionReconciliation;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds each bot's position from its completed trades and compares it with the tracked
 * {@code current_position_size}. Replays apply the same rule as a live fill: buys add their USD
 * size, sells subtract it, and the running total never drops below zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionReconciliationService {

    private final BotRepository botRepository;
    private final TradeRepository tradeRepository;
    private final BotLockRegistry botLockRegistry;
    private final TradingProperties tradingProperties;
    private final TransactionTemplate transactionTemplate;
    private final AuditEventService auditEventService;
    private final AlertService alertService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${trading.reconciliation.interval-ms:3600000}",
            initialDelayString = "${trading.reconciliation.interval-ms:3600000}")
    public void scheduledReconcile() {
        if (!tradingProperties.getScheduler().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("position-reconciliation", this::reconcileAll);
    }

    public PositionReconciliation calculatePositionFromTrades(Long botId) {
        Bot bot = botRepository.findById(botId)
                .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
        return compare(bot);
    }

    /**
     * Bots whose tracked position is off by more than the configured tolerance.
     */
    public List<PositionReconciliation> findDiscrepancies() {
        List<PositionReconciliation> drifted = new ArrayList<>();
        for (Bot bot : botRepository.findAll()) {
            PositionReconciliation report = compare(bot);
            if (report.drifted()) {
                drifted.add(report);
            }
        }
        return drifted;
    }

    /**
     * Rewrites the tracked position from trade history when it drifted. Runs under the bot lock
     * so it cannot interleave with a fill; a busy bot is reported uncorrected.
     */
    public PositionReconciliation reconcile(Long botId) {
        Optional<BotLockRegistry.BotLock> lock = botLockRegistry.tryAcquire(botId, tradingProperties.getLockTimeout());
        if (lock.isEmpty()) {
            log.info("Bot busy, reconciliation deferred botId={}", botId);
            return calculatePositionFromTrades(botId);
        }
        try (BotLockRegistry.BotLock ignored = lock.get()) {
            return transactionTemplate.execute(status -> {
                Bot bot = botRepository.findById(botId)
                        .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
                PositionReconciliation report = compare(bot);
                if (!report.drifted()) {
                    return report;
                }
                bot.setCurrentPositionSize(report.calculatedPositionUsd());
                botRepository.save(bot);
                log.warn("Position corrected botId={} tracked={} calculated={}",
                        botId, report.trackedPositionUsd(), report.calculatedPositionUsd());
                auditEventService.recordEvent(botId, "reconciliation", "POSITION_CORRECTED",
                        "Tracked position rewritten from trade history", details(report));
                return report.asCorrected();
            });
        }
    }

    public List<PositionReconciliation> reconcileAll() {
        List<PositionReconciliation> discrepancies = findDiscrepancies();
        if (discrepancies.isEmpty()) {
            log.info("Position reconciliation found no drift");
            return discrepancies;
        }
        List<PositionReconciliation> results = new ArrayList<>();
        for (PositionReconciliation report : discrepancies) {
            if (tradingProperties.getReconciliation().isAutoCorrect()) {
                results.add(reconcile(report.botId()));
            } else {
                alertService.sendAlert(report.botId(), "POSITION_DRIFT",
                        "Tracked position differs from trade history by $" + report.differenceUsd(), details(report));
                results.add(report);
            }
        }
        return results;
    }

    private PositionReconciliation compare(Bot bot) {
        List<Trade> fills = tradeRepository.findByBotIdAndStatusOrderByFilledAtAsc(bot.getId(), TradeStatus.COMPLETED);
        BigDecimal positionUsd = BigDecimal.ZERO;
        BigDecimal baseQuantity = BigDecimal.ZERO;
        for (Trade trade : fills) {
            BigDecimal usd = MoneyUtils.orZero(trade.getSizeUsd());
            BigDecimal quantity = MoneyUtils.orZero(trade.getSize());
            if (trade.getSide() == TradeSide.BUY) {
                positionUsd = positionUsd.add(usd);
                baseQuantity = baseQuantity.add(quantity);
            } else {
                positionUsd = MoneyUtils.max(BigDecimal.ZERO, positionUsd.subtract(usd));
                baseQuantity = MoneyUtils.max(BigDecimal.ZERO, baseQuantity.subtract(quantity));
            }
        }
        BigDecimal calculated = MoneyUtils.scale(positionUsd);
        BigDecimal tracked = MoneyUtils.scale(MoneyUtils.orZero(bot.getCurrentPositionSize()));
        BigDecimal difference = calculated.subtract(tracked);
        boolean drifted = difference.abs().compareTo(tradingProperties.getReconciliation().getToleranceUsd()) > 0;
        if (drifted) {
            log.warn("Position drift botId={} tracked={} calculated={} trades={}",
                    bot.getId(), tracked, calculated, fills.size());
        }
        return new PositionReconciliation(bot.getId(), bot.getPair(), fills.size(), calculated,
                MoneyUtils.quantity(baseQuantity), tracked, difference, drifted, false);
    }

    private static Map<String, Object> details(PositionReconciliation report) {
        Map<String, Object> details = new HashMap<>();
        details.put("pair", report.pair());
        details.put("trackedPositionUsd", report.trackedPositionUsd());
        details.put("calculatedPositionUsd", report.calculatedPositionUsd());
        details.put("differenceUsd", report.differenceUsd());
        details.put("tradeCount", report.tradeCount());
        return details;
    }
}
