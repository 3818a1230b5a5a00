package com.signalbot.backend.service.indicator;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class MovingAverageConfig extends IndicatorConfig {

    public static final String TYPE = "moving_average";

    @JsonAlias("fast_period")
    private int fastPeriod = 10;

    @JsonAlias("slow_period")
    private int slowPeriod = 20;

    @Override
    @JsonIgnore
    public String getType() {
        return TYPE;
    }

    @Override
    public String validate() {
        if (fastPeriod < 1 || slowPeriod <= fastPeriod) {
            return "moving_average requires 0 < fast_period < slow_period";
        }
        return null;
    }
}
