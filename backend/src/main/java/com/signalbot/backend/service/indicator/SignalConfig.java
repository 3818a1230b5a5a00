package com.signalbot.backend.service.indicator;

import java.util.List;

public record SignalConfig(List<IndicatorConfig> indicators) {

    public List<IndicatorConfig> enabledIndicators() {
        return indicators.stream()
                .filter(IndicatorConfig::isEnabled)
                .toList();
    }

    public double totalEnabledWeight() {
        return enabledIndicators().stream().mapToDouble(IndicatorConfig::getWeight).sum();
    }
}
