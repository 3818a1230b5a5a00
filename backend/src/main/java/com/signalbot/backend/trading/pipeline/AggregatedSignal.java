package com.signalbot.backend.trading.pipeline;

import java.util.List;

/**
 * Weighted combination of indicator results. {@code error} is set when nothing could be
 * aggregated; the score and confidence are then zero.
 */
public record AggregatedSignal(
        double score,
        double confidence,
        List<WeightedSignal> signals,
        double totalWeight,
        String error
) {

    public AggregatedSignal {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static AggregatedSignal error(String error) {
        return new AggregatedSignal(0.0, 0.0, List.of(), 0.0, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public record WeightedSignal(String type, double weight, SignalResult result) {}
}
