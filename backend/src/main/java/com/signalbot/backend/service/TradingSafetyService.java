package com.signalbot.backend.service;

import com.signalbot.backend.dto.RejectReason;
import com.signalbot.backend.dto.SafetyCheckResult;
import com.signalbot.backend.dto.SafetyLimits;
import com.signalbot.backend.dto.SafetyStatus;
import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.Temperature;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import com.signalbot.backend.repository.BotRepository;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Hard trading limits. Every order passes {@link #check} before it reaches the broker.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradingSafetyService {

    // trades that count toward the daily caps
    private static final Set<TradeStatus> COUNTED_STATUSES = EnumSet.of(TradeStatus.PENDING, TradeStatus.COMPLETED);

    private final SafetyPolicy safetyPolicy;
    private final TradeRepository tradeRepository;
    private final BotRepository botRepository;
    private final Clock clock;

    public SafetyCheckResult check(Bot bot, TradeSide side, BigDecimal sizeUsd, Temperature temperature) {
        SafetyLimits limits = safetyPolicy.limits();

        if (sizeUsd.compareTo(limits.minPositionUsd()) < 0 || sizeUsd.compareTo(limits.maxPositionUsd()) > 0) {
            return reject(bot, RejectReason.POSITION_SIZE_OUT_OF_RANGE, String.format(
                    "Position size $%s outside limits ($%s-$%s)", sizeUsd, limits.minPositionUsd(), limits.maxPositionUsd()));
        }

        Temperature required = requiredTemperature(bot, limits);
        Temperature actual = temperature == null ? Temperature.FROZEN : temperature;
        if (!actual.isAtLeast(required)) {
            return reject(bot, RejectReason.TEMPERATURE_TOO_LOW,
                    String.format("Temperature %s below minimum %s", actual, required));
        }

        Instant startOfDay = startOfDay();
        long tradesToday = tradeRepository.countByCreatedAtGreaterThanEqualAndStatusIn(startOfDay, COUNTED_STATUSES);
        if (tradesToday >= limits.maxDailyTrades()) {
            return reject(bot, RejectReason.DAILY_TRADE_LIMIT,
                    String.format("Daily trade limit reached (%d/%d)", tradesToday, limits.maxDailyTrades()));
        }
        long botTradesToday = tradeRepository.countByBotIdAndCreatedAtGreaterThanEqualAndStatusIn(
                bot.getId(), startOfDay, COUNTED_STATUSES);
        if (botTradesToday >= limits.maxTradesPerBotDaily()) {
            return reject(bot, RejectReason.DAILY_TRADE_LIMIT,
                    String.format("Bot daily trade limit reached (%d/%d)", botTradesToday, limits.maxTradesPerBotDaily()));
        }

        BigDecimal dailyLoss = dailyLossUsd();
        if (dailyLoss.compareTo(limits.maxDailyLossUsd()) >= 0) {
            return reject(bot, RejectReason.DAILY_LOSS_LIMIT,
                    String.format("Daily loss limit reached ($%s/$%s)", dailyLoss, limits.maxDailyLossUsd()));
        }

        if (limits.maxConsecutiveLosses() > 0) {
            int streak = consecutiveLosses(bot.getId(), limits.maxConsecutiveLosses());
            if (streak >= limits.maxConsecutiveLosses()) {
                return reject(bot, RejectReason.CONSECUTIVE_LOSSES,
                        String.format("Bot has %d consecutive losing trades", streak));
            }
        }

        if (limits.emergencyStopLossUsd() != null && limits.emergencyStopLossUsd().signum() > 0) {
            BigDecimal recentLoss = botLossUsd(bot.getId(), limits.emergencyLookback());
            if (recentLoss.compareTo(limits.emergencyStopLossUsd()) >= 0) {
                return reject(bot, RejectReason.CIRCUIT_BREAKER, String.format(
                        "Emergency circuit breaker: lost $%s in %d days (limit $%s)",
                        recentLoss, limits.emergencyLookback().toDays(), limits.emergencyStopLossUsd()));
            }
        }

        boolean opensPosition = side == TradeSide.BUY && MoneyUtils.orZero(bot.getCurrentPositionSize()).signum() == 0;
        if (opensPosition) {
            long active = botRepository.countByCurrentPositionSizeGreaterThan(BigDecimal.ZERO);
            if (active >= limits.maxActivePositions()) {
                return reject(bot, RejectReason.ACTIVE_POSITION_LIMIT,
                        String.format("Too many active positions (%d/%d)", active, limits.maxActivePositions()));
            }
        }

        log.info("Trade approved by safety checks botId={} side={} sizeUsd={} temperature={}",
                bot.getId(), side, sizeUsd, actual);
        return SafetyCheckResult.ok();
    }

    /**
     * Fees of trades filled today plus the magnitude of today's realized losses.
     */
    public BigDecimal dailyLossUsd() {
        return lossOf(tradeRepository.findByStatusAndFilledAtGreaterThanEqual(TradeStatus.COMPLETED, startOfDay()));
    }

    /**
     * Same measure as {@link #dailyLossUsd()} for one bot over a trailing window.
     */
    public BigDecimal botLossUsd(Long botId, Duration lookback) {
        Instant since = Instant.now(clock).minus(lookback);
        return lossOf(tradeRepository.findByBotIdAndStatusAndFilledAtGreaterThanEqual(botId, TradeStatus.COMPLETED, since));
    }

    /**
     * Losing sells in a row, newest first, counting at most {@code window} fills.
     */
    public int consecutiveLosses(Long botId, int window) {
        List<Trade> recent = tradeRepository.findByBotIdAndStatusAndRealizedPnlIsNotNullOrderByFilledAtDesc(
                botId, TradeStatus.COMPLETED, PageRequest.of(0, window));
        int streak = 0;
        for (Trade trade : recent) {
            if (trade.getRealizedPnl().signum() >= 0) {
                break;
            }
            streak++;
        }
        return streak;
    }

    private BigDecimal lossOf(List<Trade> trades) {
        BigDecimal loss = BigDecimal.ZERO;
        for (Trade trade : trades) {
            loss = loss.add(MoneyUtils.orZero(trade.getFee()));
            BigDecimal realized = trade.getRealizedPnl();
            if (realized != null && realized.signum() < 0) {
                loss = loss.add(realized.abs());
            }
        }
        return MoneyUtils.scale(loss);
    }

    public SafetyStatus getSafetyStatus() {
        SafetyLimits limits = safetyPolicy.limits();
        long tradesToday = tradeRepository.countByCreatedAtGreaterThanEqualAndStatusIn(startOfDay(), COUNTED_STATUSES);
        BigDecimal dailyLoss = dailyLossUsd();
        long activePositions = botRepository.countByCurrentPositionSizeGreaterThan(BigDecimal.ZERO);
        boolean allowed = tradesToday < limits.maxDailyTrades()
                && dailyLoss.compareTo(limits.maxDailyLossUsd()) < 0;
        return new SafetyStatus(
                limits,
                tradesToday,
                Math.max(0, limits.maxDailyTrades() - tradesToday),
                dailyLoss,
                activePositions,
                allowed
        );
    }

    private Temperature requiredTemperature(Bot bot, SafetyLimits limits) {
        Temperature global = limits.minTemperature();
        Temperature perBot = bot.getMinTemperature();
        if (perBot == null) {
            return global;
        }
        if (global == null) {
            return perBot;
        }
        return perBot.getLevel() >= global.getLevel() ? perBot : global;
    }

    private Instant startOfDay() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private SafetyCheckResult reject(Bot bot, RejectReason reason, String message) {
        log.warn("Trade rejected by safety checks botId={} reason={} detail={}", bot.getId(), reason, message);
        return SafetyCheckResult.reject(reason, message);
    }
}
