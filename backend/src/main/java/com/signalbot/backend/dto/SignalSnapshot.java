package com.signalbot.backend.dto;

/**
 * Signal state captured on a trade row when it is submitted.
 */
public record SignalSnapshot(Double combinedScore, String signalScoresJson) {}
