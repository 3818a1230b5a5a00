package com.signalbot.backend.repository;

import com.signalbot.backend.model.Trade;
import com.signalbot.backend.model.TradeStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeRepository extends JpaRepository<Trade, Long> {

    boolean existsByBotIdAndStatus(Long botId, TradeStatus status);

    // Last trade that actually filled; pending rows have no filled_at and never match
    Optional<Trade> findFirstByBotIdAndFilledAtIsNotNullOrderByFilledAtDesc(Long botId);

    Optional<Trade> findByOrderId(String orderId);

    List<Trade> findByStatusOrderByCreatedAtAsc(TradeStatus status);

    List<Trade> findByBotIdOrderByCreatedAtDesc(Long botId);

    long countByCreatedAtGreaterThanEqualAndStatusIn(Instant since, Collection<TradeStatus> statuses);

    long countByBotIdAndCreatedAtGreaterThanEqualAndStatusIn(Long botId, Instant since, Collection<TradeStatus> statuses);

    List<Trade> findByStatusAndFilledAtGreaterThanEqual(TradeStatus status, Instant since);

    List<Trade> findByBotIdAndStatusAndFilledAtGreaterThanEqual(Long botId, TradeStatus status, Instant since);

    // most recent fills that booked P&L, i.e. sells
    List<Trade> findByBotIdAndStatusAndRealizedPnlIsNotNullOrderByFilledAtDesc(Long botId, TradeStatus status,
                                                                                 Pageable pageable);

    List<Trade> findByBotIdAndStatusOrderByFilledAtAsc(Long botId, TradeStatus status);
}
