package com.signalbot.backend.service.indicator;

import com.signalbot.backend.exception.InvalidSignalConfigException;
import org.springframework.stereotype.Component;

@Component
public class IndicatorFactory {

    public Indicator create(IndicatorConfig config) {
        if (config instanceof RsiConfig rsi) {
            return new RsiIndicator(rsi);
        }
        if (config instanceof MovingAverageConfig movingAverage) {
            return new MovingAverageIndicator(movingAverage);
        }
        if (config instanceof MacdConfig macd) {
            return new MacdIndicator(macd);
        }
        throw new InvalidSignalConfigException("No indicator registered for type " + config.getType());
    }
}
