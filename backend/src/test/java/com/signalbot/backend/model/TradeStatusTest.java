package com.signalbot.backend.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeStatusTest {

    @Test
    void pendingLeavesExactlyOnce() {
        Trade trade = Trade.builder().id(1L).status(TradeStatus.PENDING).build();
        Instant filled = Instant.parse("2024-06-01T10:00:00Z");

        trade.transitionTo(TradeStatus.COMPLETED, filled);

        assertThat(trade.getFilledAt()).isEqualTo(filled);
        assertThatThrownBy(() -> trade.transitionTo(TradeStatus.FAILED, filled))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedTradeHasNoFillTime() {
        Trade trade = Trade.builder().id(2L).status(TradeStatus.PENDING).build();

        trade.transitionTo(TradeStatus.FAILED, Instant.parse("2024-06-01T10:00:00Z"));

        assertThat(trade.getFilledAt()).isNull();
        assertThat(TradeStatus.FAILED.isTerminal()).isTrue();
    }

    @Test
    void mapsBrokerStatuses() {
        assertThat(TradeStatus.fromBrokerStatus("filled")).isEqualTo(TradeStatus.COMPLETED);
        assertThat(TradeStatus.fromBrokerStatus("CANCELED")).isEqualTo(TradeStatus.CANCELLED);
        assertThat(TradeStatus.fromBrokerStatus("REJECTED")).isEqualTo(TradeStatus.FAILED);
        assertThat(TradeStatus.fromBrokerStatus("OPEN")).isEqualTo(TradeStatus.PENDING);
        assertThat(TradeStatus.fromBrokerStatus(null)).isEqualTo(TradeStatus.PENDING);
    }
}
