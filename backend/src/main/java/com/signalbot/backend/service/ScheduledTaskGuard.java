package com.signalbot.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps scheduled work so one failing bot never stops the loop and a slow run is not stacked
 * on top of itself. Runs are keyed by task name and bot id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;
    private final Clock clock;

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public boolean run(String taskName, Runnable task) {
        return run(taskName, null, task);
    }

    /**
     * @return false when the same task for the same bot is still running and this run was skipped
     */
    public boolean run(String taskName, Long botId, Runnable task) {
        String key = botId == null ? taskName : taskName + ":" + botId;
        if (!running.add(key)) {
            log.info("Skipping task={} botId={}, previous run still active", taskName, botId);
            return false;
        }
        Instant started = Instant.now(clock);
        if (botId != null) {
            MDC.put("botId", String.valueOf(botId));
        }
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={} botId={}", taskName, botId, t);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("task", taskName);
            metadata.put("error", String.valueOf(t.getMessage()));
            metadata.put("elapsedMs", Duration.between(started, Instant.now(clock)).toMillis());
            auditEventService.recordEvent(botId, "scheduler", "TASK_FAILED",
                    "Scheduled task failed: " + taskName, metadata);
        } finally {
            running.remove(key);
            if (botId != null) {
                MDC.remove("botId");
            }
        }
        return true;
    }

    public boolean isRunning(String taskName, Long botId) {
        return running.contains(botId == null ? taskName : taskName + ":" + botId);
    }
}
