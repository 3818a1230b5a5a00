package com.signalbot.backend.model;

public enum BotStatus {
    RUNNING,
    STOPPED,
    ERROR;

    public boolean isTradeable() {
        return this == RUNNING;
    }
}
