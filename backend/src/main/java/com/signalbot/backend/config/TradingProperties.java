package com.signalbot.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
@Validated
public class TradingProperties {

    private Confirmation confirmation = new Confirmation();
    private Duration lockTimeout = Duration.ofSeconds(3);
    private Evaluation evaluation = new Evaluation();
    private Scheduler scheduler = new Scheduler();
    private Monitor monitor = new Monitor();
    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Confirmation {
        private boolean enabled = true;

        @Min(0)
        private int defaultMinutes = 5;
    }

    @Data
    public static class Evaluation {
        @NotBlank
        private String granularity = "3600";

        @Positive
        private int candleLimit = 100;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 60_000;
    }

    @Data
    public static class Monitor {
        @Positive
        private long pollIntervalMs = 30_000;

        private Duration pendingAlertAfter = Duration.ofMinutes(10);

        // pending rows that never received an order id
        private Duration orphanTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Reconciliation {
        @Positive
        private long intervalMs = 3_600_000;

        // drift in USD below this is rounding, not a discrepancy
        @PositiveOrZero
        private BigDecimal toleranceUsd = new BigDecimal("0.01");

        // rewrite the tracked position on the scheduled run instead of only alerting
        private boolean autoCorrect = false;
    }
}
