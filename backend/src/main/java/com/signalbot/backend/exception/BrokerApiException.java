package com.signalbot.backend.exception;

public class BrokerApiException extends RuntimeException {
    private final int statusCode;
    private final boolean retryable;

    public BrokerApiException(String message) {
        this(message, -1, true, null);
    }

    public BrokerApiException(String message, Throwable cause) {
        this(message, -1, true, cause);
    }

    public BrokerApiException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
