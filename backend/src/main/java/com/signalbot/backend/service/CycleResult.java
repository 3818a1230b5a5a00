package com.signalbot.backend.service;

import com.signalbot.backend.dto.ExecutionResult;
import com.signalbot.backend.trading.pipeline.EvaluationResult;

/**
 * Outcome of one trading cycle. {@code execution} is null when no trade was attempted,
 * in which case {@code skippedReason} says why.
 */
public record CycleResult(Long botId, EvaluationResult evaluation, ExecutionResult execution, String skippedReason) {

    static CycleResult skipped(Long botId, EvaluationResult evaluation, String reason) {
        return new CycleResult(botId, evaluation, null, reason);
    }
}
