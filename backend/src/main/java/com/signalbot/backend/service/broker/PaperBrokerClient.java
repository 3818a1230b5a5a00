package com.signalbot.backend.service.broker;

import com.signalbot.backend.config.BrokerProperties;
import com.signalbot.backend.exception.BrokerApiException;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.repository.TradeRepository;
import com.signalbot.backend.trading.pipeline.MarketDataProvider;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Simulated broker: market orders fill immediately at the current mark.
 * <p>
 * Nothing is kept in memory. A paper order always filled when it was placed, so its status is
 * rebuilt from the trade row that carries the order id, which also holds across restarts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "broker", name = "mode", havingValue = "paper", matchIfMissing = true)
public class PaperBrokerClient implements BrokerClient {

    static final String FILLED = "FILLED";
    static final String ORDER_PREFIX = "PAPER-";

    private final MarketDataProvider marketDataProvider;
    private final BrokerProperties brokerProperties;
    private final TradeRepository tradeRepository;

    @Override
    public BrokerOrder placeOrder(String pair, TradeSide side, BigDecimal baseQuantity) {
        if (baseQuantity == null || baseQuantity.signum() <= 0) {
            throw new BrokerApiException("Order quantity must be positive", 400, false, null);
        }
        BigDecimal price = marketDataProvider.getPrice(pair)
                .orElseThrow(() -> new BrokerApiException("No mark price for " + pair));
        String orderId = ORDER_PREFIX + UUID.randomUUID();
        BrokerOrder order = new BrokerOrder(orderId, pair, side, FILLED, baseQuantity, price, fee(baseQuantity, price));
        log.info("Paper order filled orderId={} pair={} side={} qty={} price={} fee={}",
                orderId, pair, side, baseQuantity, price, order.fee());
        return order;
    }

    @Override
    public BrokerOrder getOrderStatus(String orderId) {
        Trade trade = orderId == null || !orderId.startsWith(ORDER_PREFIX)
                ? null
                : tradeRepository.findByOrderId(orderId).orElse(null);
        if (trade == null) {
            throw new BrokerApiException("Unknown paper order " + orderId, 404, false, null);
        }
        BigDecimal price = trade.getFillPrice() != null ? trade.getFillPrice() : trade.getPrice();
        BigDecimal fee = trade.getFee() != null ? trade.getFee() : fee(trade.getSize(), price);
        return new BrokerOrder(orderId, trade.getPair(), trade.getSide(), FILLED, trade.getSize(), price, fee);
    }

    private BigDecimal fee(BigDecimal quantity, BigDecimal price) {
        return quantity.multiply(price)
                .multiply(BigDecimal.valueOf(brokerProperties.getPaper().getFeeRate()))
                .setScale(MoneyUtils.PNL_SCALE, RoundingMode.HALF_UP);
    }
}
