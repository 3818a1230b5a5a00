package com.signalbot.backend.service;

import com.signalbot.backend.config.SafetyProperties;
import com.signalbot.backend.dto.SafetyLimits;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredSafetyPolicy implements SafetyPolicy {

    private final SafetyProperties safetyProperties;

    @Override
    public SafetyLimits limits() {
        return new SafetyLimits(
                safetyProperties.getMaxPositionUsd(),
                safetyProperties.getMinPositionUsd(),
                safetyProperties.getMaxDailyTrades(),
                safetyProperties.getMaxTradesPerBotDaily(),
                safetyProperties.getMaxActivePositions(),
                safetyProperties.getMaxDailyLossUsd(),
                safetyProperties.getMinTemperature(),
                safetyProperties.getMaxConsecutiveLosses(),
                safetyProperties.getEmergencyStopLossUsd(),
                safetyProperties.getEmergencyLookback()
        );
    }
}
