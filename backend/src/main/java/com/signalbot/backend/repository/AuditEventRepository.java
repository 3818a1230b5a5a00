package com.signalbot.backend.repository;

import com.signalbot.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByEventType(String eventType);

    List<AuditEvent> findByTradeIdOrderByIdAsc(Long tradeId);
}
