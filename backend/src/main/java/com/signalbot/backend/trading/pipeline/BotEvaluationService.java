package com.signalbot.backend.trading.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotSignalHistory;
import com.signalbot.backend.model.Candle;
import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.model.Temperature;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.BotSignalHistoryRepository;
import com.signalbot.backend.service.BotLockRegistry;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.SafetyPolicy;
import com.signalbot.backend.service.indicator.MarketRegimeDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One evaluation of a bot: aggregate indicators, resolve the action, advance confirmation,
 * size the order and record the result in the bot's signal history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BotEvaluationService {

    static final int MAX_HISTORY_LIMIT = 500;

    private final SignalAggregator signalAggregator;
    private final ActionResolver actionResolver;
    private final ConfirmationTracker confirmationTracker;
    private final PositionSizer positionSizer;
    private final MarketRegimeDetector marketRegimeDetector;
    private final SafetyPolicy safetyPolicy;
    private final BotRepository botRepository;
    private final BotSignalHistoryRepository botSignalHistoryRepository;
    private final BotLockRegistry botLockRegistry;
    private final TradingProperties tradingProperties;
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EvaluationResult evaluate(Bot bot, List<Candle> candles) {
        List<Candle> series = candles == null ? List.of() : candles;
        Instant now = Instant.now(clock);
        Double price = series.isEmpty() ? null : series.get(series.size() - 1).getClose();

        AggregatedSignal aggregated = signalAggregator.aggregate(bot.getSignalConfig(), series);
        SignalAction action = null;
        String error = aggregated.error();
        if (!aggregated.hasError()) {
            try {
                action = actionResolver.resolve(aggregated.score(), bot.getBuyThreshold(), bot.getSellThreshold());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid thresholds for botId={}: {}", bot.getId(), e.getMessage());
                error = "Invalid thresholds: " + e.getMessage();
            }
        }
        if (error != null) {
            EvaluationResult result = EvaluationResult.error(bot.getId(), error, persistedStatus(bot, now), price, now);
            recordHistory(result, aggregated);
            metricsService.recordEvaluation("ERROR");
            return result;
        }

        Temperature temperature = actionResolver.temperature(aggregated.score());
        ConfirmationStatus confirmation = updateConfirmation(bot.getId(), action, aggregated.score(), now);
        RegimeSnapshot regime = marketRegimeDetector.detect(series);
        SizingResult sizing = positionSizer.size(bot.getPositionSizeUsd(), aggregated.confidence(), regime, safetyPolicy.limits());

        EvaluationResult result = new EvaluationResult(
                bot.getId(),
                aggregated.score(),
                action,
                aggregated.confidence(),
                temperature,
                aggregated.signals(),
                confirmation,
                regime,
                sizing,
                price,
                now,
                null
        );
        recordHistory(result, aggregated);
        metricsService.recordEvaluation(action.name());
        log.info("Bot evaluated botId={} score={} action={} confidence={} temperature={} confirmation={} progress={}",
                bot.getId(), String.format("%.4f", aggregated.score()), action, String.format("%.3f", aggregated.confidence()),
                temperature, confirmation.state(), String.format("%.2f", confirmation.progress()));
        return result;
    }

    public ConfirmationStatus getConfirmationStatus(Long botId) {
        Bot bot = botRepository.findById(botId)
                .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
        return persistedStatus(bot, Instant.now(clock));
    }

    public List<BotSignalHistory> getSignalHistory(Long botId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return botSignalHistoryRepository.findByBotIdOrderByEvaluatedAtDesc(botId, PageRequest.of(0, size));
    }

    /**
     * Per-indicator scores as JSON, as stored on history and trade rows.
     */
    public String describeSignals(List<AggregatedSignal.WeightedSignal> signals) {
        Map<String, Object> scores = new LinkedHashMap<>();
        for (AggregatedSignal.WeightedSignal signal : signals) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("score", signal.result().score());
            entry.put("action", signal.result().action().name());
            entry.put("confidence", signal.result().confidence());
            entry.put("weight", signal.weight());
            entry.put("metadata", signal.result().metadata());
            scores.put(signal.type(), entry);
        }
        return toJson(scores);
    }

    private ConfirmationStatus updateConfirmation(Long botId, SignalAction action, double score, Instant now) {
        Optional<BotLockRegistry.BotLock> lock = botLockRegistry.tryAcquire(botId, tradingProperties.getLockTimeout());
        if (lock.isEmpty()) {
            // a trade is in flight for this bot; report without persisting and try again next cycle
            log.warn("Confirmation state not updated, bot busy botId={}", botId);
            Bot bot = botRepository.findById(botId)
                    .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
            return confirmationTracker.advance(persistedStatus(bot, now), action, window(bot), now);
        }
        try (BotLockRegistry.BotLock ignored = lock.get()) {
            return transactionTemplate.execute(status -> {
                Bot bot = botRepository.findById(botId)
                        .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
                ConfirmationStatus next = confirmationTracker.advance(persistedStatus(bot, now), action, window(bot), now);
                bot.setConfirmationState(next.state());
                bot.setConfirmationAction(next.action());
                bot.setSignalConfirmationStart(next.confirmationStart());
                bot.setCurrentCombinedScore(score);
                botRepository.save(bot);
                return next;
            });
        }
    }

    private ConfirmationStatus persistedStatus(Bot bot, Instant now) {
        return confirmationTracker.describe(bot.getConfirmationAction(), bot.getSignalConfirmationStart(), window(bot), now);
    }

    private Duration window(Bot bot) {
        if (!tradingProperties.getConfirmation().isEnabled()) {
            return Duration.ZERO;
        }
        return Duration.ofMinutes(Math.max(0, bot.getConfirmationMinutes()));
    }

    private void recordHistory(EvaluationResult result, AggregatedSignal aggregated) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_weight", aggregated.totalWeight());
        metadata.put("enabled_signals", aggregated.signals().size());
        if (result.error() != null) {
            metadata.put("error", result.error());
        }
        if (result.regime() != null) {
            metadata.put("regime", result.regime().regime().name());
            metadata.put("trend_strength", result.regime().trendStrength());
        }
        if (result.sizing() != null) {
            metadata.put("size_multiplier", result.sizing().multiplier());
            metadata.put("final_size_usd", result.sizing().finalSizeUsd());
        }
        if (result.confirmation() != null) {
            metadata.put("confirmation_progress", result.confirmation().progress());
        }
        botSignalHistoryRepository.save(BotSignalHistory.builder()
                .botId(result.botId())
                .evaluatedAt(result.evaluatedAt())
                .combinedScore(result.overallScore())
                .action(result.action())
                .confidence(result.confidence())
                .temperature(result.temperature())
                .confirmationState(result.confirmation() == null ? null : result.confirmation().state())
                .signalScores(describeSignals(result.signals()))
                .evaluationMetadata(toJson(metadata))
                .price(result.price())
                .build());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize evaluation details: {}", e.getMessage());
            return null;
        }
    }
}
