package com.todomanager.performance.batch;

import com.todomanager.performance.support.DispatchResult;
import com.todomanager.performance.support.Registrations;
import com.todomanager.performance.support.InstanceGauges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 批量写入合并器 - 将大量小更新合并为少量批次
 *
 * 核心特性:
 * 1. 单一待处理列表 - 入队只需一次加锁追加
 * 2. 按类型分组 - 刷新时一次性按 kind 稳定分组，同类型保持入队顺序
 * 3. 双触发 - 达到批量大小立即同步刷新；否则以最近一次入队为起点延迟刷新（防抖）
 * 4. 故障隔离 - 处理器在锁外执行，单个类型失败不影响其他类型
 * 5. 批次有序 - 刷新互斥，同一类型的前一批次处理完成后才会分发下一批次
 */
public class BatchCoalescer {

    private static final Logger log = LoggerFactory.getLogger(BatchCoalescer.class);

    private final int batchSize;
    private final Duration flushInterval;
    private final Clock clock;

    private final List<PendingUpdate> pending = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock flushLock = new ReentrantLock();
    private ScheduledFuture<?> scheduledFlush;
    private boolean shutdown;

    private final ConcurrentHashMap<String, Consumer<List<PendingUpdate>>> flushHandlers = new ConcurrentHashMap<>();

    private final ScheduledExecutorService flushScheduler;

    private final Counter updateCounter;
    private final Counter flushCounter;
    private final Counter failureCounter;
    private final InstanceGauges gauges;

    public BatchCoalescer(int batchSize, Duration flushInterval, Clock clock, MeterRegistry meterRegistry) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive: " + flushInterval);
        }
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
        this.clock = clock;

        this.flushScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batch-coalescer-flush");
            t.setDaemon(true);
            return t;
        });

        this.updateCounter = Counter.builder("todo.performance.batch.updates").register(meterRegistry);
        this.flushCounter = Counter.builder("todo.performance.batch.flushes").register(meterRegistry);
        this.failureCounter = Counter.builder("todo.performance.batch.handler.failures").register(meterRegistry);
        this.gauges = new InstanceGauges(meterRegistry, "batch-coalescer");
        gauges.register("todo.performance.batch.pending", this, BatchCoalescer::pendingCount);

        log.info("BatchCoalescer initialized: batchSize={}, flushInterval={}ms", batchSize, flushInterval.toMillis());
    }

    public BatchCoalescer(int batchSize, Duration flushInterval, MeterRegistry meterRegistry) {
        this(batchSize, flushInterval, Clock.systemUTC(), meterRegistry);
    }

    /**
     * 注册刷新处理器，同一类型重复注册时后者覆盖前者
     */
    public void registerFlushHandler(String kind, Consumer<List<PendingUpdate>> handler) {
        Registrations.requireKey(kind, "kind");
        Registrations.requireCallback(handler, "handler");
        if (flushHandlers.put(kind, handler) != null) {
            log.debug("Flush handler replaced: kind={}", kind);
        }
    }

    /**
     * 入队一条更新；关闭后入队的更新立即同步刷新
     */
    public void queueUpdate(String kind, Object itemId, Map<String, Object> payload) {
        Registrations.requireKey(kind, "kind");

        PendingUpdate update = new PendingUpdate(kind, itemId, payload, clock.instant());
        boolean flushNow;

        lock.lock();
        try {
            pending.add(update);
            updateCounter.increment();
            flushNow = shutdown || pending.size() >= batchSize;
            if (!flushNow) {
                flushNow = !rescheduleFlush();
            }
        } finally {
            lock.unlock();
        }

        if (flushNow) {
            flush();
        }
    }

    /**
     * 立即刷新所有待处理更新
     *
     * @return 每个已分发类型的处理结果
     */
    public List<DispatchResult> forceFlush() {
        return flush();
    }

    /**
     * 先关闭定时器再刷新剩余更新；刷新期间（包括处理器内）再入队的更新走同步刷新
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            cancelScheduledFlush();
        } finally {
            lock.unlock();
        }
        flushScheduler.shutdown();

        forceFlush();
        gauges.removeAll();
        log.info("BatchCoalescer shut down");
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private List<DispatchResult> flush() {
        // 取出与分发在同一互斥区内，批次按取出顺序交给处理器
        flushLock.lock();
        try {
            return drainAndDispatch();
        } finally {
            flushLock.unlock();
        }
    }

    private List<DispatchResult> drainAndDispatch() {
        Map<String, List<PendingUpdate>> partitions = new LinkedHashMap<>();

        lock.lock();
        try {
            cancelScheduledFlush();
            if (pending.isEmpty()) {
                return Collections.emptyList();
            }
            for (PendingUpdate update : pending) {
                partitions.computeIfAbsent(update.kind(), k -> new ArrayList<>()).add(update);
            }
            pending.clear();
        } finally {
            lock.unlock();
        }

        flushCounter.increment();
        List<DispatchResult> results = new ArrayList<>(partitions.size());

        // 锁外调用处理器
        for (Map.Entry<String, List<PendingUpdate>> partition : partitions.entrySet()) {
            String kind = partition.getKey();
            List<PendingUpdate> updates = Collections.unmodifiableList(partition.getValue());

            Consumer<List<PendingUpdate>> handler = flushHandlers.get(kind);
            if (handler == null) {
                log.warn("No flush handler registered, dropping updates: kind={}, size={}", kind, updates.size());
                continue;
            }

            DispatchResult result = DispatchResult.invoke(kind, () -> handler.accept(updates));
            if (result.succeeded()) {
                log.debug("Batch flushed: kind={}, size={}", kind, updates.size());
            } else {
                failureCounter.increment();
                log.error("Flush handler failed: kind={}, size={}", kind, updates.size(), result.failure());
            }
            results.add(result);
        }
        return results;
    }

    /**
     * 以当前时刻为起点重新计时，调用方必须持有锁
     *
     * @return 调度器已关闭时返回 false，此时由调用方同步刷新
     */
    private boolean rescheduleFlush() {
        cancelScheduledFlush();
        try {
            scheduledFlush = flushScheduler.schedule(
                this::flushFromTimer, flushInterval.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Flush scheduler unavailable, flushing inline");
            return false;
        }
    }

    private void cancelScheduledFlush() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel(false);
            scheduledFlush = null;
        }
    }

    private void flushFromTimer() {
        try {
            flush();
        } catch (Exception e) {
            log.error("Scheduled batch flush failed", e);
        }
    }
}
