package com.signalbot.backend.dto;

public enum RejectReason {
    BOT_NOT_FOUND(ErrorKind.VALIDATION),
    BOT_NOT_RUNNING(ErrorKind.SAFETY_REJECTION),
    POSITION_SIZE_OUT_OF_RANGE(ErrorKind.SAFETY_REJECTION),
    TEMPERATURE_TOO_LOW(ErrorKind.SAFETY_REJECTION),
    DAILY_TRADE_LIMIT(ErrorKind.SAFETY_REJECTION),
    DAILY_LOSS_LIMIT(ErrorKind.SAFETY_REJECTION),
    CONSECUTIVE_LOSSES(ErrorKind.SAFETY_REJECTION),
    CIRCUIT_BREAKER(ErrorKind.SAFETY_REJECTION),
    ACTIVE_POSITION_LIMIT(ErrorKind.SAFETY_REJECTION),
    PENDING_ORDER_EXISTS(ErrorKind.SAFETY_REJECTION),
    COOLDOWN_ACTIVE(ErrorKind.SAFETY_REJECTION),
    TRADE_IN_PROGRESS(ErrorKind.CONCURRENCY_CONFLICT),
    PRICE_UNAVAILABLE(ErrorKind.EXTERNAL_API),
    BROKER_ERROR(ErrorKind.EXTERNAL_API),
    INVALID_REQUEST(ErrorKind.VALIDATION);

    private final ErrorKind errorKind;

    RejectReason(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
