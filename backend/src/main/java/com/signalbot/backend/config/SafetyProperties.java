package com.signalbot.backend.config;

import com.signalbot.backend.model.Temperature;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "safety")
@Data
@Validated
public class SafetyProperties {

    @Positive
    private BigDecimal maxPositionUsd = BigDecimal.valueOf(25);

    @Positive
    private BigDecimal minPositionUsd = BigDecimal.valueOf(5);

    @Positive
    private int maxDailyTrades = 10;

    @Positive
    private int maxTradesPerBotDaily = 5;

    // bots holding a non-zero position at once
    @Positive
    private int maxActivePositions = 5;

    @PositiveOrZero
    private BigDecimal maxDailyLossUsd = BigDecimal.valueOf(100);

    private Temperature minTemperature = Temperature.WARM;

    // losing sells in a row before a bot is held back, 0 disables
    @PositiveOrZero
    private int maxConsecutiveLosses = 3;

    // per-bot loss over the lookback that trips the emergency breaker, 0 disables
    @PositiveOrZero
    private BigDecimal emergencyStopLossUsd = BigDecimal.valueOf(50);

    private Duration emergencyLookback = Duration.ofDays(7);
}
