package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.ConfirmationState;
import com.signalbot.backend.model.SignalAction;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Hysteresis for trade actions: a non-hold action has to be observed unchanged for the
 * confirmation window before it becomes actionable.
 * <p>
 * The tracker holds no state of its own. Callers pass the previously persisted status and
 * store the returned one.
 */
@Component
public class ConfirmationTracker {

    public ConfirmationStatus advance(ConfirmationStatus previous, SignalAction action,
                                      Duration window, Instant now) {
        if (action == null || action == SignalAction.HOLD) {
            return ConfirmationStatus.noSignal();
        }
        boolean sameAction = previous != null
                && previous.state() != ConfirmationState.NO_SIGNAL
                && previous.action() == action
                && previous.confirmationStart() != null;
        Instant start = sameAction ? previous.confirmationStart() : now;
        return describe(action, start, window, now);
    }

    /**
     * Status of an action that has been observed since {@code start}, as of {@code now}.
     */
    public ConfirmationStatus describe(SignalAction action, Instant start, Duration window, Instant now) {
        if (action == null || action == SignalAction.HOLD || start == null) {
            return ConfirmationStatus.noSignal();
        }
        Duration elapsed = Duration.between(start, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        if (window.isZero() || window.isNegative() || elapsed.compareTo(window) >= 0) {
            return new ConfirmationStatus(ConfirmationState.CONFIRMED, action, start, 1.0, 0);
        }
        double progress = Math.max(0.0, Math.min(1.0, (double) elapsed.toMillis() / window.toMillis()));
        long remaining = window.minus(elapsed).toSeconds();
        return new ConfirmationStatus(ConfirmationState.CONFIRMING, action, start, progress, remaining);
    }
}
