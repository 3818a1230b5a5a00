package com.signalbot.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Operator alerts. Delivered through the log and the audit trail.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertService {

    private final AuditEventService auditEventService;

    public void sendAlert(Long botId, String type, String message, Map<String, Object> details) {
        log.error("ALERT type={} botId={} message={} details={}", type, botId, message, details);
        auditEventService.recordEvent(botId, "alert", type, message, details);
    }
}
