package com.signalbot.backend.dto;

import java.math.BigDecimal;

/**
 * Outcome of a single trade execution attempt. Failures are reported here rather than thrown.
 */
public record ExecutionResult(
        boolean success,
        Long tradeId,
        String orderId,
        String error,
        ErrorKind errorKind,
        RejectReason rejectReason,
        BigDecimal baseSize,
        BigDecimal price
) {

    public static ExecutionResult submitted(Long tradeId, String orderId, BigDecimal baseSize, BigDecimal price) {
        return new ExecutionResult(true, tradeId, orderId, null, null, null, baseSize, price);
    }

    public static ExecutionResult rejected(RejectReason reason, String error) {
        return new ExecutionResult(false, null, null, error, reason.getErrorKind(), reason, null, null);
    }

    public static ExecutionResult failed(Long tradeId, RejectReason reason, String error) {
        return new ExecutionResult(false, tradeId, null, error, reason.getErrorKind(), reason, null, null);
    }
}
