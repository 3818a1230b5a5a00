package com.signalbot.backend.trading.pipeline;

import com.signalbot.backend.model.SignalAction;
import com.signalbot.backend.model.Temperature;
import org.springframework.stereotype.Component;

/**
 * Maps a combined score onto an action using the bot's own thresholds.
 * Scores at or below the buy threshold buy; at or above the sell threshold sell.
 */
@Component
public class ActionResolver {

    public SignalAction resolve(double score, double buyThreshold, double sellThreshold) {
        if (buyThreshold >= sellThreshold) {
            throw new IllegalArgumentException(String.format(
                    "buyThreshold %.4f must be below sellThreshold %.4f", buyThreshold, sellThreshold));
        }
        if (score <= buyThreshold) {
            return SignalAction.BUY;
        }
        if (score >= sellThreshold) {
            return SignalAction.SELL;
        }
        return SignalAction.HOLD;
    }

    public Temperature temperature(double score) {
        return Temperature.fromScore(score);
    }
}
