package com.signalbot.backend.service;

import com.signalbot.backend.dto.SafetyLimits;

/**
 * Read-only source of the trading limits.
 */
public interface SafetyPolicy {

    SafetyLimits limits();
}
