package com.signalbot.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong tradesSubmitted = new AtomicLong();
    private final AtomicLong brokerFailures = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final AtomicReference<Double> realizedPnl = new AtomicReference<>(0.0);

    private Counter evaluationsCounter;
    private Counter tradesSubmittedCounter;
    private Counter tradesFilledCounter;
    private Counter brokerErrorsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        evaluationsCounter = Counter.builder("bot_evaluations_total").register(meterRegistry);
        tradesSubmittedCounter = Counter.builder("trades_submitted_total").register(meterRegistry);
        tradesFilledCounter = Counter.builder("trades_filled_total").register(meterRegistry);
        brokerErrorsCounter = Counter.builder("broker_errors_total").register(meterRegistry);
        Gauge.builder("realized_pnl", realizedPnl, value -> value.get()).register(meterRegistry);
    }

    public void recordEvaluation(String action) {
        if (evaluationsCounter != null) {
            evaluationsCounter.increment();
        }
        Counter.builder("bot_evaluation_actions_total")
                .tag("action", action == null ? "unknown" : action)
                .register(meterRegistry)
                .increment();
    }

    public void incrementTradesSubmitted() {
        tradesSubmitted.incrementAndGet();
        if (tradesSubmittedCounter != null) {
            tradesSubmittedCounter.increment();
        }
    }

    public void recordTradeFilled() {
        if (tradesFilledCounter != null) {
            tradesFilledCounter.increment();
        }
    }

    public void incrementBrokerFailures() {
        brokerFailures.incrementAndGet();
        if (brokerErrorsCounter != null) {
            brokerErrorsCounter.increment();
        }
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("trades_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordFinalizeFailure() {
        Counter.builder("trade_finalize_failures_total")
                .register(meterRegistry)
                .increment();
    }

    public void addRealizedPnl(double pnl) {
        realizedPnl.accumulateAndGet(pnl, Double::sum);
    }

    public long tradesSubmitted() {
        return tradesSubmitted.get();
    }

    public long brokerFailures() {
        return brokerFailures.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
