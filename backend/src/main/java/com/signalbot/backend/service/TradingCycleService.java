package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.dto.ExecutionResult;
import com.signalbot.backend.dto.SignalSnapshot;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Candle;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.trading.pipeline.BotEvaluationService;
import com.signalbot.backend.trading.pipeline.EvaluationResult;
import com.signalbot.backend.trading.pipeline.MarketDataProvider;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Fetch candles, evaluate, and trade when the evaluation is confirmed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradingCycleService {

    private final BotRepository botRepository;
    private final MarketDataProvider marketDataProvider;
    private final BotEvaluationService botEvaluationService;
    private final TradeExecutionService tradeExecutionService;
    private final TradingProperties tradingProperties;

    public CycleResult runCycle(Long botId) {
        MDC.put("botId", String.valueOf(botId));
        MDC.put("correlationId", UUID.randomUUID().toString());
        try {
            Bot bot = botRepository.findById(botId)
                    .orElseThrow(() -> new NotFoundException("Bot " + botId + " not found"));
            if (!bot.getStatus().isTradeable()) {
                return CycleResult.skipped(botId, null, "Bot is " + bot.getStatus());
            }

            List<Candle> candles = fetchCandles(bot);
            EvaluationResult evaluation = botEvaluationService.evaluate(bot, candles);
            if (!evaluation.isActionable()) {
                String reason = evaluation.hasError() ? evaluation.error()
                        : "Action " + evaluation.action() + " not confirmed";
                return CycleResult.skipped(botId, evaluation, reason);
            }

            TradeSide side = evaluation.action().toSide();
            BigDecimal sizeUsd = evaluation.sizing().finalSizeUsd();
            if (side == TradeSide.SELL) {
                BigDecimal position = MoneyUtils.orZero(bot.getCurrentPositionSize());
                if (position.signum() <= 0) {
                    log.info("Sell signal skipped, no open position botId={}", botId);
                    return CycleResult.skipped(botId, evaluation, "No position to sell");
                }
                sizeUsd = MoneyUtils.min(sizeUsd, position);
            }

            SignalSnapshot snapshot = new SignalSnapshot(evaluation.overallScore(),
                    botEvaluationService.describeSignals(evaluation.signals()));
            ExecutionResult execution = tradeExecutionService.executeTrade(
                    botId, side, sizeUsd, evaluation.temperature(), snapshot);
            return new CycleResult(botId, evaluation, execution, null);
        } finally {
            MDC.remove("botId");
            MDC.remove("correlationId");
        }
    }

    private List<Candle> fetchCandles(Bot bot) {
        TradingProperties.Evaluation config = tradingProperties.getEvaluation();
        try {
            return marketDataProvider.getHistorical(bot.getPair(), config.getGranularity(), config.getCandleLimit());
        } catch (RuntimeException e) {
            log.warn("Market data unavailable pair={}: {}", bot.getPair(), e.getMessage());
            return List.of();
        }
    }
}
