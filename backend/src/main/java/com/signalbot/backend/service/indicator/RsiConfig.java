package com.signalbot.backend.service.indicator;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class RsiConfig extends IndicatorConfig {

    public static final String TYPE = "rsi";

    private int period = 14;

    @JsonAlias("buy_threshold")
    private double oversold = 30;

    @JsonAlias("sell_threshold")
    private double overbought = 70;

    @Override
    @JsonIgnore
    public String getType() {
        return TYPE;
    }

    @Override
    public String validate() {
        if (period < 2) {
            return "rsi period must be at least 2";
        }
        if (oversold <= 0 || overbought >= 100 || oversold >= overbought) {
            return "rsi thresholds must satisfy 0 < oversold < overbought < 100";
        }
        return null;
    }
}
