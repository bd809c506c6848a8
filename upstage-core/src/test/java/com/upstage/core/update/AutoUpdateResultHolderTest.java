package com.upstage.core.update;

import com.upstage.api.update.PluginAutoUpdateStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AutoUpdateResultHolder 单元测试")
class AutoUpdateResultHolderTest {

    @Test
    @DisplayName("发布前读取为空")
    void shouldBeEmptyBeforePublish() {
        AutoUpdateResultHolder holder = new AutoUpdateResultHolder();
        assertTrue(holder.get().isEmpty());
        assertFalse(holder.isPublished());
    }

    @Test
    @DisplayName("首个写入者生效")
    void firstWriterShouldWin() {
        AutoUpdateResultHolder holder = new AutoUpdateResultHolder();
        AutoUpdateOutcome first = new AutoUpdateOutcome.Success(new PluginAutoUpdateStatistics(1, 1));

        assertTrue(holder.publish(first));
        assertFalse(holder.publish(new AutoUpdateOutcome.Failure(new IllegalStateException())));
        assertSame(first, holder.get().orElseThrow());
    }

    @Test
    @DisplayName("拒绝空结果")
    void shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> new AutoUpdateResultHolder().publish(null));
    }

    @Test
    @DisplayName("并发发布只有一个成功")
    void concurrentPublishShouldHaveSingleWinner() throws InterruptedException {
        AutoUpdateResultHolder holder = new AutoUpdateResultHolder();
        int threads = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                int n = i;
                executor.submit(() -> {
                    startLatch.await();
                    if (holder.publish(new AutoUpdateOutcome.Success(new PluginAutoUpdateStatistics(n, n)))) {
                        winners.incrementAndGet();
                    }
                    return null;
                });
            }
            startLatch.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, winners.get());
        assertTrue(holder.isPublished());
    }

    @Test
    @DisplayName("发布后触发回调")
    void whenPublishedShouldNotifyObservers() {
        AutoUpdateResultHolder holder = new AutoUpdateResultHolder();
        AtomicReference<AutoUpdateOutcome> observed = new AtomicReference<>();
        holder.whenPublished().thenAccept(observed::set);

        AutoUpdateOutcome outcome = new AutoUpdateOutcome.Success(new PluginAutoUpdateStatistics(0, 0));
        new Thread(() -> holder.publish(outcome), "publisher").start();

        await().atMost(Duration.ofSeconds(5)).until(() -> observed.get() != null);
        assertSame(outcome, observed.get());
    }
}
