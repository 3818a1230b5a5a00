package com.signalbot.backend.repository;

import com.signalbot.backend.model.Bot;
import com.signalbot.backend.model.BotStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface BotRepository extends JpaRepository<Bot, Long> {

    List<Bot> findByStatus(BotStatus status);

    // bots currently holding an open position
    long countByCurrentPositionSizeGreaterThan(BigDecimal size);
}
