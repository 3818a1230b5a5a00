package com.signalbot.backend.repository;

import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.model.TradeStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class TradeRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TradeRepository tradeRepository;

    @Test
    void lastFilledTradeIgnoresPendingRows() {
        entityManager.persist(trade("a", TradeStatus.COMPLETED, NOW.minusSeconds(3600), NOW.minusSeconds(3500)));
        entityManager.persist(trade("b", TradeStatus.COMPLETED, NOW.minusSeconds(1800), NOW.minusSeconds(1700)));
        entityManager.persist(trade("c", TradeStatus.PENDING, NOW.minusSeconds(60), null));
        entityManager.flush();

        Trade last = tradeRepository.findFirstByBotIdAndFilledAtIsNotNullOrderByFilledAtDesc(1L).orElseThrow();

        assertThat(last.getOrderId()).isEqualTo("b");
        assertThat(tradeRepository.existsByBotIdAndStatus(1L, TradeStatus.PENDING)).isTrue();
    }

    @Test
    void countsOnlyCountedStatusesSinceMidnight() {
        Instant midnight = Instant.parse("2024-06-01T00:00:00Z");
        entityManager.persist(trade("a", TradeStatus.COMPLETED, NOW, NOW));
        entityManager.persist(trade("b", TradeStatus.FAILED, NOW, null));
        entityManager.persist(trade("c", TradeStatus.PENDING, NOW, null));
        entityManager.persist(trade("d", TradeStatus.COMPLETED, midnight.minusSeconds(1), midnight.minusSeconds(1)));
        entityManager.flush();

        long counted = tradeRepository.countByCreatedAtGreaterThanEqualAndStatusIn(
                midnight, EnumSet.of(TradeStatus.PENDING, TradeStatus.COMPLETED));

        assertThat(counted).isEqualTo(2);
        assertThat(tradeRepository.findByStatusAndFilledAtGreaterThanEqual(TradeStatus.COMPLETED, midnight))
                .extracting(Trade::getOrderId).containsExactly("a");
    }

    private static Trade trade(String orderId, TradeStatus status, Instant createdAt, Instant filledAt) {
        return Trade.builder()
                .botId(1L)
                .pair("BTC-USD")
                .side(TradeSide.BUY)
                .size(new BigDecimal("0.0005"))
                .sizeUsd(new BigDecimal("10"))
                .price(new BigDecimal("20000"))
                .orderId(orderId)
                .status(status)
                .createdAt(createdAt)
                .filledAt(filledAt)
                .build();
    }
}
