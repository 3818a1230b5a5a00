package com.signalbot.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.model.AuditEvent;
import com.signalbot.backend.model.Trade;
import com.signalbot.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    static final String TRADE_EVENT = "trade";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Best effort: a failed audit write is logged and never fails the caller.
     */
    public void recordEvent(Long botId, String eventType, String action, String description, Object metadata) {
        save(AuditEvent.builder()
                .botId(botId)
                .eventType(eventType)
                .action(action)
                .description(description), metadata);
    }

    public void recordTradeEvent(Trade trade, String action, String description, Object metadata) {
        save(AuditEvent.builder()
                .botId(trade.getBotId())
                .tradeId(trade.getId())
                .pair(trade.getPair())
                .eventType(TRADE_EVENT)
                .action(action)
                .description(description), metadata);
    }

    public List<AuditEvent> tradeHistory(Long tradeId) {
        return auditEventRepository.findByTradeIdOrderByIdAsc(tradeId);
    }

    private void save(AuditEvent.AuditEventBuilder event, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            auditEventRepository.save(event
                    .metadata(payload)
                    .correlationId(MDC.get("correlationId"))
                    .createdAt(Instant.now(clock))
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record audit event {} - {}", event.build().getAction(), e.getMessage());
        }
    }
}
