package com.signalbot.backend.dto;

public record SafetyCheckResult(boolean allowed, RejectReason reason, String message) {

    public static SafetyCheckResult ok() {
        return new SafetyCheckResult(true, null, "approved");
    }

    public static SafetyCheckResult reject(RejectReason reason, String message) {
        return new SafetyCheckResult(false, reason, message);
    }
}
