package com.signalbot.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reentrant lock per bot id. Locks of different bots never contend.
 * <p>
 * Use with try-with-resources so the lock is released on every exit path:
 * <pre>{@code
 * Optional<BotLock> lock = registry.tryAcquire(botId, timeout);
 * if (lock.isEmpty()) { ... }
 * try (BotLock held = lock.get()) { ... }
 * }</pre>
 * Order execution additionally claims an {@link ExecutionSlot}: a second execution for the same
 * bot is turned away at once instead of queueing on the lock and trading after the first one.
 */
@Component
@Slf4j
public class BotLockRegistry {

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<Long> executing = ConcurrentHashMap.newKeySet();

    /**
     * Claims the single execution slot of a bot without waiting.
     *
     * @return empty when another execution for the bot is still in flight
     */
    public Optional<ExecutionSlot> tryBeginExecution(Long botId) {
        if (!executing.add(botId)) {
            log.info("Execution already in flight for botId={}", botId);
            return Optional.empty();
        }
        return Optional.of(new ExecutionSlot(botId));
    }

    public boolean isExecuting(Long botId) {
        return executing.contains(botId);
    }

    public Optional<BotLock> tryAcquire(Long botId, Duration timeout) {
        ReentrantLock lock = locks.computeIfAbsent(botId, id -> new ReentrantLock());
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.of(new BotLock(botId, lock));
            }
            log.info("Lock busy for botId={} after {}ms", botId, timeout.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for lock botId={}", botId);
            return Optional.empty();
        }
    }

    public boolean isHeldByCurrentThread(Long botId) {
        ReentrantLock lock = locks.get(botId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public static final class BotLock implements AutoCloseable {
        private final Long botId;
        private final ReentrantLock lock;

        private BotLock(Long botId, ReentrantLock lock) {
            this.botId = botId;
            this.lock = lock;
        }

        public Long getBotId() {
            return botId;
        }

        @Override
        public void close() {
            lock.unlock();
        }
    }

    public final class ExecutionSlot implements AutoCloseable {
        private final Long botId;
        private boolean released;

        private ExecutionSlot(Long botId) {
            this.botId = botId;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                executing.remove(botId);
            }
        }
    }
}
