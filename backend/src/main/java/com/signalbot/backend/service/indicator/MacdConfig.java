package com.signalbot.backend.service.indicator;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class MacdConfig extends IndicatorConfig {

    public static final String TYPE = "macd";

    @JsonAlias("fast_period")
    private int fastPeriod = 12;

    @JsonAlias("slow_period")
    private int slowPeriod = 26;

    @JsonAlias("signal_period")
    private int signalPeriod = 9;

    @Override
    @JsonIgnore
    public String getType() {
        return TYPE;
    }

    @Override
    public String validate() {
        if (fastPeriod < 1 || slowPeriod <= fastPeriod) {
            return "macd requires 0 < fast_period < slow_period";
        }
        if (signalPeriod < 1) {
            return "macd signal_period must be positive";
        }
        return null;
    }
}
