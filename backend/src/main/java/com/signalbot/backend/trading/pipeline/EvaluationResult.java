package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.model.Temperature;

import java.time.Instant;
import java.util.List;

public record EvaluationResult(
        Long botId,
        double overallScore,
        SignalAction action,
        double confidence,
        Temperature temperature,
        List<AggregatedSignal.WeightedSignal> signals,
        ConfirmationStatus confirmation,
        RegimeSnapshot regime,
        SizingResult sizing,
        Double price,
        Instant evaluatedAt,
        String error
) {

    public EvaluationResult {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static EvaluationResult error(Long botId, String error, ConfirmationStatus confirmation,
                                         Double price, Instant evaluatedAt) {
        return new EvaluationResult(botId, 0.0, SignalAction.HOLD, 0.0, Temperature.FROZEN, List.of(),
                confirmation, RegimeSnapshot.unknown(), null, price, evaluatedAt, error);
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * True when a trade may be attempted: no error, a non-hold action, and that action confirmed.
     */
    public boolean isActionable() {
        return !hasError()
                && action.isTrade()
                && confirmation != null
                && confirmation.isConfirmed()
                && confirmation.action() == action;
    }
}
