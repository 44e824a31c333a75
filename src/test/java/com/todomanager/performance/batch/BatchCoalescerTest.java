package com.todomanager.performance.batch;

import com.todomanager.performance.support.DispatchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 批量写入合并器测试
 */
class BatchCoalescerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private BatchCoalescer coalescer;

    @AfterEach
    void tearDown() {
        if (coalescer != null) {
            coalescer.shutdown();
        }
    }

    @Test
    @DisplayName("达到批量大小 - 同步刷新一次且保持入队顺序")
    void testSizeTriggeredFlush() {
        coalescer = new BatchCoalescer(3, Duration.ofSeconds(30), meterRegistry);
        List<List<PendingUpdate>> todoBatches = new CopyOnWriteArrayList<>();
        List<List<PendingUpdate>> subtaskBatches = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", todoBatches::add);
        coalescer.registerFlushHandler("subtask", subtaskBatches::add);

        coalescer.queueUpdate("todo", 1, Map.of("title", "buy milk"));
        coalescer.queueUpdate("todo", 2, Map.of("title", "call bank"));

        assertTrue(todoBatches.isEmpty());
        assertEquals(2, coalescer.pendingCount());

        coalescer.queueUpdate("todo", 3, Map.of("title", "pay rent"));

        assertEquals(1, todoBatches.size());
        List<PendingUpdate> batch = todoBatches.get(0);
        assertEquals(3, batch.size());
        assertEquals(List.of(1, 2, 3), batch.stream().map(PendingUpdate::itemId).toList());
        assertTrue(subtaskBatches.isEmpty());
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    @DisplayName("未达到批量大小 - 间隔到期后刷新一次")
    void testTimeTriggeredFlush() throws InterruptedException {
        coalescer = new BatchCoalescer(100, Duration.ofMillis(100), meterRegistry);
        List<List<PendingUpdate>> batches = new CopyOnWriteArrayList<>();
        CountDownLatch flushed = new CountDownLatch(1);
        coalescer.registerFlushHandler("todo", updates -> {
            batches.add(updates);
            flushed.countDown();
        });

        coalescer.queueUpdate("todo", "a", Map.of("done", true));
        coalescer.queueUpdate("todo", "b", Map.of("done", false));

        assertTrue(flushed.await(2, TimeUnit.SECONDS));
        Thread.sleep(300);

        assertEquals(1, batches.size());
        assertEquals(2, batches.get(0).size());
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    @DisplayName("再次入队重置刷新计时（防抖）")
    void testDebounce() throws InterruptedException {
        coalescer = new BatchCoalescer(100, Duration.ofMillis(500), meterRegistry);
        List<List<PendingUpdate>> batches = new CopyOnWriteArrayList<>();
        CountDownLatch flushed = new CountDownLatch(1);
        coalescer.registerFlushHandler("todo", updates -> {
            batches.add(updates);
            flushed.countDown();
        });

        coalescer.queueUpdate("todo", 1, Map.of());
        Thread.sleep(300);
        coalescer.queueUpdate("todo", 2, Map.of());
        Thread.sleep(300);

        // 首次入队后已超过 500ms，但第二次入队重置了计时
        assertTrue(batches.isEmpty());

        assertTrue(flushed.await(2, TimeUnit.SECONDS));
        assertEquals(1, batches.size());
        assertEquals(2, batches.get(0).size());
    }

    @Test
    @DisplayName("按类型分组 - 各类型内部保持顺序")
    void testPartitionByKind() {
        coalescer = new BatchCoalescer(100, Duration.ofSeconds(30), meterRegistry);
        List<PendingUpdate> todos = new CopyOnWriteArrayList<>();
        List<PendingUpdate> subtasks = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", todos::addAll);
        coalescer.registerFlushHandler("subtask", subtasks::addAll);

        coalescer.queueUpdate("todo", 1, Map.of());
        coalescer.queueUpdate("subtask", 10, Map.of());
        coalescer.queueUpdate("todo", 2, Map.of());
        coalescer.queueUpdate("subtask", 11, Map.of());
        coalescer.queueUpdate("todo", 3, Map.of());

        List<DispatchResult> results = coalescer.forceFlush();

        assertEquals(2, results.size());
        assertEquals(List.of(1, 2, 3), todos.stream().map(PendingUpdate::itemId).toList());
        assertEquals(List.of(10, 11), subtasks.stream().map(PendingUpdate::itemId).toList());
    }

    @Test
    @DisplayName("处理器异常不影响其他类型")
    void testHandlerFailureIsolated() {
        coalescer = new BatchCoalescer(100, Duration.ofSeconds(30), meterRegistry);
        List<PendingUpdate> subtasks = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", updates -> {
            throw new IllegalStateException("storage unavailable");
        });
        coalescer.registerFlushHandler("subtask", subtasks::addAll);

        coalescer.queueUpdate("todo", 1, Map.of());
        coalescer.queueUpdate("subtask", 2, Map.of());

        List<DispatchResult> results = assertDoesNotThrow(() -> coalescer.forceFlush());

        assertEquals(2, results.size());
        DispatchResult todoResult = results.stream().filter(r -> r.target().equals("todo")).findFirst().orElseThrow();
        assertFalse(todoResult.succeeded());
        assertEquals("storage unavailable", todoResult.failure().getMessage());
        assertEquals(1, subtasks.size());
        assertEquals(0, coalescer.pendingCount());
        assertEquals(1, meterRegistry.counter("todo.performance.batch.handler.failures").count());
    }

    @Test
    @DisplayName("空队列刷新无操作")
    void testEmptyFlush() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        List<List<PendingUpdate>> batches = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", batches::add);

        assertTrue(coalescer.forceFlush().isEmpty());
        assertTrue(batches.isEmpty());
    }

    @Test
    @DisplayName("重复注册 - 后注册的处理器生效")
    void testReRegisterReplacesHandler() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        List<PendingUpdate> first = new CopyOnWriteArrayList<>();
        List<PendingUpdate> second = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", first::addAll);
        coalescer.registerFlushHandler("todo", second::addAll);

        coalescer.queueUpdate("todo", 1, Map.of());
        coalescer.forceFlush();

        assertTrue(first.isEmpty());
        assertEquals(1, second.size());
    }

    @Test
    @DisplayName("关闭时刷新剩余更新")
    void testShutdownFlushes() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        List<PendingUpdate> received = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", received::addAll);

        coalescer.queueUpdate("todo", 1, Map.of("title", "draft"));
        coalescer.shutdown();

        assertEquals(1, received.size());
        assertEquals("draft", received.get(0).payload().get("title"));
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    @DisplayName("关闭后入队 - 同步刷新不丢失")
    void testQueueAfterShutdownFlushesInline() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        List<PendingUpdate> received = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", received::addAll);
        coalescer.shutdown();

        coalescer.queueUpdate("todo", 7, Map.of());

        assertEquals(1, received.size());
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void testInvalidArguments() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);

        assertThrows(IllegalArgumentException.class, () -> coalescer.registerFlushHandler("", updates -> { }));
        assertThrows(IllegalArgumentException.class, () -> coalescer.registerFlushHandler("todo", null));
        assertThrows(IllegalArgumentException.class, () -> coalescer.queueUpdate(" ", 1, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new BatchCoalescer(0, Duration.ofSeconds(1), meterRegistry));
    }

    @Test
    @DisplayName("关闭过程中处理器再次入队 - 更新同步刷新不丢失")
    void testRequeueDuringShutdownIsDelivered() throws InterruptedException {
        coalescer = new BatchCoalescer(10, Duration.ofMillis(100), meterRegistry);
        List<Object> delivered = new CopyOnWriteArrayList<>();
        coalescer.registerFlushHandler("todo", updates -> {
            for (PendingUpdate update : updates) {
                delivered.add(update.itemId());
                if (Integer.valueOf(1).equals(update.itemId())) {
                    coalescer.queueUpdate("todo", 2, Map.of("title", "follow-up"));
                }
            }
        });
        coalescer.queueUpdate("todo", 1, Map.of("title", "original"));

        coalescer.shutdown();
        Thread.sleep(300);

        assertEquals(List.of(1, 2), delivered);
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    @DisplayName("同类型批次串行分发 - 定时刷新与容量刷新不重叠且保持顺序")
    void testSameKindBatchesDispatchedInOrder() throws InterruptedException {
        coalescer = new BatchCoalescer(2, Duration.ofMillis(50), meterRegistry);
        List<List<Object>> batches = new CopyOnWriteArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch firstBatchEntered = new CountDownLatch(1);
        coalescer.registerFlushHandler("todo", updates -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                if (batches.isEmpty()) {
                    firstBatchEntered.countDown();
                    Thread.sleep(300);
                }
                batches.add(updates.stream().map(PendingUpdate::itemId).toList());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
        });

        coalescer.queueUpdate("todo", 1, Map.of());
        assertTrue(firstBatchEntered.await(2, TimeUnit.SECONDS));

        // 定时刷新的处理器仍在执行，此时触发容量刷新
        coalescer.queueUpdate("todo", 2, Map.of());
        coalescer.queueUpdate("todo", 3, Map.of());

        assertEquals(List.of(List.of(1), List.of(2, 3)), batches);
        assertEquals(1, maxInFlight.get());
    }

    @Test
    @DisplayName("关闭后摘除待处理数量指标")
    void testShutdownRemovesPendingGauge() {
        coalescer = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        BatchCoalescer other = new BatchCoalescer(10, Duration.ofSeconds(30), meterRegistry);
        other.queueUpdate("todo", 1, Map.of());

        assertEquals(2, meterRegistry.find("todo.performance.batch.pending").gauges().size());

        coalescer.shutdown();

        assertEquals(1, meterRegistry.find("todo.performance.batch.pending").gauges().size());
        assertEquals(1.0, meterRegistry.get("todo.performance.batch.pending").gauge().value(), 1e-9);
        other.shutdown();
        assertNull(meterRegistry.find("todo.performance.batch.pending").gauge());
    }
}
