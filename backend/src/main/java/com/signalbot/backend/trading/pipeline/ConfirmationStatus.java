package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.ConfirmationState;
import com.signalbot.backend.model.SignalAction;

import java.time.Instant;

public record ConfirmationStatus(
        ConfirmationState state,
        SignalAction action,
        Instant confirmationStart,
        double progress,
        long secondsRemaining
) {

    public static ConfirmationStatus noSignal() {
        return new ConfirmationStatus(ConfirmationState.NO_SIGNAL, null, null, 0.0, 0);
    }

    public boolean isConfirmed() {
        return state == ConfirmationState.CONFIRMED;
    }
}
