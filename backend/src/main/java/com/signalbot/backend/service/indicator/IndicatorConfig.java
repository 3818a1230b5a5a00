package com.signalbot.backend.service.indicator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

/**
 * Typed indicator settings stored in a bot's signal configuration. The {@code type}
 * property selects the concrete subtype.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RsiConfig.class, name = RsiConfig.TYPE),
        @JsonSubTypes.Type(value = MovingAverageConfig.class, name = MovingAverageConfig.TYPE),
        @JsonSubTypes.Type(value = MacdConfig.class, name = MacdConfig.TYPE)
})
public abstract class IndicatorConfig {

    private double weight = 1.0;
    private boolean enabled = true;

    public abstract String getType();

    /**
     * Checks indicator specific parameters, returning a problem description or {@code null}.
     */
    public abstract String validate();
}
