package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.exception.BrokerApiException;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.service.broker.BrokerClient;
import com.signalbot.backend.service.broker.BrokerClient.BrokerOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls the broker for pending trades and resolves them. Pending rows that never got an
 * order id are failed after the orphan timeout; orders pending past the alert threshold
 * are reported to operators.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderMonitorService {

    private final TradeRepository tradeRepository;
    private final BrokerClient brokerClient;
    private final TradeLifecycleService tradeLifecycleService;
    private final AlertService alertService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${trading.monitor.poll-interval-ms:30000}",
            initialDelayString = "${trading.monitor.poll-interval-ms:30000}")
    public void scheduledPoll() {
        if (!tradingProperties.getScheduler().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("order-monitor", this::pollPendingTrades);
    }

    public MonitorReport pollPendingTrades() {
        List<Trade> pending = tradeRepository.findByStatusOrderByCreatedAtAsc(TradeStatus.PENDING);
        Instant now = Instant.now(clock);
        TradingProperties.Monitor config = tradingProperties.getMonitor();
        int resolved = 0;
        int orphansFailed = 0;
        int alerts = 0;

        for (Trade trade : pending) {
            Duration age = Duration.between(trade.getCreatedAt(), now);
            if (trade.getOrderId() == null) {
                if (age.compareTo(config.getOrphanTimeout()) > 0
                        && tradeLifecycleService.markFailed(trade.getId(), "No broker order id after " + age.toSeconds() + "s")) {
                    orphansFailed++;
                }
                continue;
            }
            if (resolve(trade)) {
                resolved++;
                continue;
            }
            if (age.compareTo(config.getPendingAlertAfter()) > 0) {
                Map<String, Object> details = new HashMap<>();
                details.put("tradeId", trade.getId());
                details.put("orderId", trade.getOrderId());
                details.put("ageSeconds", age.toSeconds());
                alertService.sendAlert(trade.getBotId(), "STUCK_PENDING_ORDER",
                        "Order pending for " + age.toMinutes() + " minutes", details);
                alerts++;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Order monitor checked={} resolved={} orphansFailed={} alerts={}",
                    pending.size(), resolved, orphansFailed, alerts);
        }
        return new MonitorReport(pending.size(), resolved, orphansFailed, alerts);
    }

    private boolean resolve(Trade trade) {
        try {
            BrokerOrder order = brokerClient.getOrderStatus(trade.getOrderId());
            return tradeLifecycleService.applyBrokerStatus(trade.getId(), order);
        } catch (BrokerApiException e) {
            if (!e.isRetryable()) {
                log.warn("Broker rejected status lookup tradeId={} orderId={}: {}", trade.getId(), trade.getOrderId(), e.getMessage());
                return tradeLifecycleService.markFailed(trade.getId(), "Status lookup failed: " + e.getMessage());
            }
            log.warn("Status lookup failed, will retry tradeId={} orderId={}: {}", trade.getId(), trade.getOrderId(), e.getMessage());
            return false;
        }
    }

    public record MonitorReport(int checked, int resolved, int orphansFailed, int alerts) {}
}
