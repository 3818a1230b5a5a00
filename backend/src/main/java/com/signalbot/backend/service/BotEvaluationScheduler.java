package com.signalbot.backend.service;

import com.signalbot.backend.config.TradingProperties;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotStatus;
import com.signalbot.backend.repository.BotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one trading cycle per running bot on every tick. Bots are evaluated in parallel;
 * a manual trigger may overlap a scheduled cycle for the same bot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BotEvaluationScheduler {

    private final BotRepository botRepository;
    private final TradingCycleService tradingCycleService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final TradingProperties tradingProperties;
    @Qualifier("evaluationExecutor")
    private final Executor evaluationExecutor;

    @Scheduled(fixedDelayString = "${trading.scheduler.interval-ms:60000}",
            initialDelayString = "${trading.scheduler.initial-delay-ms:15000}")
    public void runScheduledEvaluations() {
        if (!tradingProperties.getScheduler().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("bot-evaluation", this::dispatchRunningBots);
    }

    public int dispatchRunningBots() {
        List<Bot> bots = botRepository.findByStatus(BotStatus.RUNNING);
        for (Bot bot : bots) {
            Long botId = bot.getId();
            evaluationExecutor.execute(() ->
                    scheduledTaskGuard.run("bot-evaluation", botId, () -> tradingCycleService.runCycle(botId)));
        }
        log.debug("Dispatched {} bot evaluations", bots.size());
        return bots.size();
    }

    public CompletableFuture<CycleResult> triggerManual(Long botId) {
        log.info("Manual evaluation requested botId={}", botId);
        return CompletableFuture.supplyAsync(() -> tradingCycleService.runCycle(botId), evaluationExecutor);
    }
}
