package com.signalbot.backend.exception;

/**
 * Raised when a bot's indicator configuration cannot be parsed or fails validation.
 */
public class InvalidSignalConfigException extends RuntimeException {
    public InvalidSignalConfigException(String message) {
        super(message);
    }

    public InvalidSignalConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
