package com.signalbot.backend.repository;

import com.signalbot.backend.model.BotSignalHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BotSignalHistoryRepository extends JpaRepository<BotSignalHistory, Long> {

    List<BotSignalHistory> findByBotIdOrderByEvaluatedAtDesc(Long botId, Pageable pageable);
}
