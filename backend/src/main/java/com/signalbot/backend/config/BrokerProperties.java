package com.signalbot.backend.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "broker")
@Data
@Validated
public class BrokerProperties {

    private String mode = "paper";

    private Paper paper = new Paper();

    @Data
    public static class Paper {
        @PositiveOrZero
        private double feeRate = 0.006;
    }
}
