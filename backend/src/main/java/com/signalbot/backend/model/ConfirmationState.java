package com.signalbot.backend.model;

/**
 * Persisted phase of the signal confirmation state machine.
 */
public enum ConfirmationState {
    NO_SIGNAL,
    CONFIRMING,
    CONFIRMED
}
