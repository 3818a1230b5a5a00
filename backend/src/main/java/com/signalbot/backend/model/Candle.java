package com.signalbot.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One OHLCV bar. Series handed to the pipeline are ordered by ascending timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candle {
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
    private Instant timestamp;
}
