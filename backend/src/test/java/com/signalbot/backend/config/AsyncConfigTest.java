package com.signalbot.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("evaluationExecutor")
    private Executor evaluationExecutor;

    @Test
    void evaluationExecutorIsBounded() {
        assertThat(evaluationExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) evaluationExecutor;
        int processors = Runtime.getRuntime().availableProcessors();
        assertThat(executor.getCorePoolSize()).isEqualTo(Math.max(4, processors));
        assertThat(executor.getMaxPoolSize()).isEqualTo(Math.max(16, processors * 2));
        assertThat(executor.getThreadNamePrefix()).isEqualTo("bot-eval-");
        assertThat(executor.getQueueCapacity()).isEqualTo(500);
    }
}
