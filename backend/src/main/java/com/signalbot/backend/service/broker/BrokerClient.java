package com.signalbot.backend.service.broker;

import com.signalbot.backend.model.TradeSide;

import java.math.BigDecimal;

/**
 * Order gateway. Implementations throw {@link com.signalbot.backend.exception.BrokerApiException}
 * when the broker cannot be reached or refuses the request.
 */
public interface BrokerClient {

    BrokerOrder placeOrder(String pair, TradeSide side, BigDecimal baseQuantity);

    BrokerOrder getOrderStatus(String orderId);

    record BrokerOrder(
            String orderId,
            String pair,
            TradeSide side,
            String status,
            BigDecimal filledSize,
            BigDecimal fillPrice,
            BigDecimal fee
    ) {}
}
