package com.signalbot.backend.model;

public enum MarketRegime {
    STRONG_TRENDING,
    TRENDING,
    RANGING,
    CHOPPY,
    UNKNOWN
}
