package com.phillippitts.voicebridge.config;

import com.phillippitts.voicebridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor created;

    @AfterEach
    void tearDown() {
        if (created != null) {
            created.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        ThreadPoolTaskExecutor dispatch = track(config.dispatchExecutor());
        assertThat(dispatch.getCorePoolSize()).isEqualTo(8);
        assertThat(dispatch.getMaxPoolSize()).isEqualTo(32);
        assertThat(dispatch.getThreadNamePrefix()).isEqualTo("dispatch-pool-");
        assertThat(dispatch.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        dispatch.shutdown();

        ThreadPoolTaskExecutor outbound = track(config.outboundExecutor());
        assertThat(outbound.getThreadNamePrefix()).isEqualTo("outbound-pool-");
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = track(config.providerExecutor());

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10); // Simulate work
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void saturatedPoolRunsTaskOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        ThreadPoolProperties.PoolProperties tiny = new ThreadPoolProperties.PoolProperties();
        tiny.setCorePoolSize(1);
        tiny.setMaxPoolSize(1);
        tiny.setQueueCapacity(1);
        tiny.setThreadNamePrefix("tiny-");
        properties.setOutbound(tiny);
        ThreadPoolConfig config = new ThreadPoolConfig(properties);
        Executor executor = track(config.outboundExecutor());
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();

        executor.execute(() -> awaitQuietly(release));
        executor.execute(() -> awaitQuietly(release));
        executor.execute(() -> ranOn.set(Thread.currentThread().getName()));
        release.countDown();

        assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void closePoolStartsAThreadForEveryBlockedClose() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor close = track(config.sessionCloseExecutor());
        assertThat(close.getThreadNamePrefix()).isEqualTo("session-close-");
        int closes = 6;
        CountDownLatch started = new CountDownLatch(closes);
        CountDownLatch release = new CountDownLatch(1);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < closes; i++) {
            close.execute(() -> {
                threads.add(Thread.currentThread().getName());
                started.countDown();
                awaitQuietly(release);
            });
        }

        try {
            assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(threads).hasSize(closes).allMatch(name -> name.startsWith("session-close-"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = track(config.dispatchExecutor());
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("sessionId", "s-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
    }

    @Test
    void shouldUseCorrectThreadNamePrefix() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = track(config.providerExecutor());

        CountDownLatch latch = new CountDownLatch(1);
        String[] threadName = new String[1];

        executor.execute(() -> {
            threadName[0] = Thread.currentThread().getName();
            latch.countDown();
        });

        latch.await(1, TimeUnit.SECONDS);

        assertThat(threadName[0]).startsWith("provider-pool-");
    }

    @Test
    void shouldShutdownGracefully() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.dispatchExecutor();

        executor.execute(() -> {
            // Simple task
        });

        executor.shutdown();
        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }

    private ThreadPoolTaskExecutor track(Executor executor) {
        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        created = (ThreadPoolTaskExecutor) executor;
        return created;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
