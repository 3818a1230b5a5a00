package com.signalbot.backend.service;

import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cooldown after a bot's last filled trade. Orders that are only submitted have no
 * filled_at and neither start nor extend the window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeCooldownService {

    private final TradeRepository tradeRepository;
    private final Clock clock;

    public Optional<Duration> remainingCooldown(Bot bot) {
        if (bot.getCooldownMinutes() <= 0) {
            return Optional.empty();
        }
        Optional<Instant> lastFill = tradeRepository
                .findFirstByBotIdAndFilledAtIsNotNullOrderByFilledAtDesc(bot.getId())
                .map(Trade::getFilledAt);
        if (lastFill.isEmpty()) {
            return Optional.empty();
        }
        Duration cooldown = Duration.ofMinutes(bot.getCooldownMinutes());
        Duration elapsed = Duration.between(lastFill.get(), Instant.now(clock));
        if (elapsed.compareTo(cooldown) > 0) {
            return Optional.empty();
        }
        Duration remaining = cooldown.minus(elapsed);
        log.debug("Cooldown active botId={} lastFill={} remaining={}s", bot.getId(), lastFill.get(), remaining.toSeconds());
        return Optional.of(remaining);
    }

    public boolean isInCooldown(Bot bot) {
        return remainingCooldown(bot).isPresent();
    }
}
