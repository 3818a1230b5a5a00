package com.signalbot.backend.dto;

import com.signalbot.backend.model.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

public record LedgerFillRequest(
        String fillId,
        String pair,
        TradeSide side,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal fee,
        Instant filledAt
) {}
