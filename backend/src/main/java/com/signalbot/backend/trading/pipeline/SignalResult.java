package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.SignalAction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one indicator. Score is in [-1, 1] where negative leans buy and positive leans sell.
 */
public record SignalResult(
        String name,
        double score,
        SignalAction action,
        double confidence,
        Map<String, Object> metadata
) {

    public static final String INSUFFICIENT_DATA = "insufficient_data";

    public SignalResult {
        score = clamp(score, -1.0, 1.0);
        confidence = clamp(confidence, 0.0, 1.0);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SignalResult insufficientData(String name, int requiredPeriods, int availablePeriods) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(INSUFFICIENT_DATA, true);
        metadata.put("required_periods", requiredPeriods);
        metadata.put("available_periods", availablePeriods);
        return new SignalResult(name, 0.0, SignalAction.HOLD, 0.0, metadata);
    }

    public boolean isInsufficientData() {
        return Boolean.TRUE.equals(metadata.get(INSUFFICIENT_DATA));
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
