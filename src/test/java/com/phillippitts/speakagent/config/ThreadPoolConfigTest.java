package com.phillippitts.speakagent.config;

import com.phillippitts.speakagent.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithCorrectConfiguration() {
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).dialogueExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(8);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("dialogue-call-");
        assertThat(taskExecutor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        taskExecutor.shutdown();
    }

    @Test
    void shouldUseConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getDialogue().setCorePoolSize(2);
        properties.getDialogue().setMaxPoolSize(3);

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).dialogueExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        executor.shutdown();
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor)
                new ThreadPoolConfig(new ThreadPoolProperties()).dialogueExecutor();
        ThreadContext.put("sessionId", "s-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
        assertThat(thread.get()).startsWith("dialogue-call-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresPreviousContext() {
        ThreadContext.put("sessionId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("sessionId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("sessionId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isEqualTo("worker");
    }
}
