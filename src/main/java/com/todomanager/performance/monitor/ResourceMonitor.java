package com.todomanager.performance.monitor;

import com.todomanager.performance.support.DispatchResult;
import com.todomanager.performance.support.Registrations;
import com.todomanager.performance.support.InstanceGauges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * 后台内存压力监控
 *
 * 核心特性:
 * 1. 周期采样 - 单线程后台轮询，每个实例最多一个轮询任务
 * 2. 两级阈值 - warning < critical，按系统内存占比分级
 * 3. 边沿触发 - 仅在等级变化时回调，避免回调风暴
 * 4. 容错 - 采样失败退化为零值样本，单次异常记录后继续轮询
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final double warningThreshold;
    private final double criticalThreshold;
    private final Duration stopTimeout;
    private final MemoryProbe probe;
    private final Clock clock;

    private final ConcurrentHashMap<MemoryLevel, Consumer<MemorySample>> callbacks = new ConcurrentHashMap<>();

    private volatile MemoryLevel currentLevel = MemoryLevel.NORMAL;
    private volatile double lastUsedRatio;

    private ScheduledExecutorService monitorExecutor;
    private volatile Thread monitorThread;

    private final Counter transitionCounter;
    private final InstanceGauges gauges;

    public ResourceMonitor(double warningThreshold, double criticalThreshold, Duration stopTimeout,
                           MemoryProbe probe, Clock clock, MeterRegistry meterRegistry) {
        if (warningThreshold <= 0 || criticalThreshold > 1.0 || warningThreshold >= criticalThreshold) {
            throw new IllegalArgumentException(String.format(
                "thresholds must satisfy 0 < warning < critical <= 1: warning=%s, critical=%s",
                warningThreshold, criticalThreshold));
        }
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
        this.stopTimeout = stopTimeout;
        this.probe = probe;
        this.clock = clock;

        this.transitionCounter = Counter.builder("todo.performance.memory.transitions").register(meterRegistry);
        this.gauges = new InstanceGauges(meterRegistry, "resource-monitor");
        gauges.register("todo.performance.memory.level", this, m -> m.currentLevel.ordinal());
        gauges.register("todo.performance.memory.usage", this, m -> m.lastUsedRatio);

        log.info("ResourceMonitor initialized: warningThreshold={}, criticalThreshold={}",
            warningThreshold, criticalThreshold);
    }

    public ResourceMonitor(double warningThreshold, double criticalThreshold, MeterRegistry meterRegistry) {
        this(warningThreshold, criticalThreshold, Duration.ofSeconds(1),
            new JvmMemoryProbe(), Clock.systemUTC(), meterRegistry);
    }

    /**
     * 注册等级回调，每个等级一个，重复注册时后者覆盖前者
     */
    public void registerCallback(MemoryLevel level, Consumer<MemorySample> callback) {
        Objects.requireNonNull(level, "level");
        Registrations.requireCallback(callback, "callback");
        if (callbacks.put(level, callback) != null) {
            log.debug("Memory callback replaced: level={}", level);
        }
    }

    /**
     * 启动后台轮询，已在运行时忽略
     */
    public synchronized void startMonitoring(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        if (monitorExecutor != null) {
            return;
        }

        currentLevel = MemoryLevel.NORMAL;
        monitorExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resource-monitor");
            t.setDaemon(true);
            monitorThread = t;
            return t;
        });
        monitorExecutor.scheduleWithFixedDelay(this::pollSafely,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Resource monitoring started: interval={}ms", interval.toMillis());
    }

    /**
     * 停止后台轮询并在限定时间内等待其退出；未启动或重复调用时无副作用
     */
    public void stopMonitoring() {
        ScheduledExecutorService executor;
        synchronized (this) {
            executor = monitorExecutor;
            monitorExecutor = null;
        }
        if (executor == null) {
            return;
        }

        executor.shutdown();
        // 在监控线程内（等级回调中）调用时不能等待自身
        if (Thread.currentThread() != monitorThread) {
            try {
                if (!executor.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Resource monitor did not stop within {}ms", stopTimeout.toMillis());
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        monitorThread = null;
        log.info("Resource monitoring stopped");
    }

    /**
     * 停止轮询并摘除本实例注册的 Gauge
     */
    public void close() {
        stopMonitoring();
        gauges.removeAll();
    }

    public synchronized boolean isMonitoring() {
        return monitorExecutor != null;
    }

    /**
     * 单次采样 + 分级 + 边沿触发分发，即轮询任务每个周期执行的内容
     *
     * @return 本次采样所属等级
     */
    public MemoryLevel tick() {
        MemorySample sample = getMemoryInfo();
        lastUsedRatio = sample.usedRatio();

        MemoryLevel level = classify(sample.usedRatio());
        MemoryLevel previous = currentLevel;
        currentLevel = level;

        if (level != previous) {
            transitionCounter.increment();
            if (level == MemoryLevel.NORMAL) {
                log.info("Memory pressure level changed: {} -> {} (usage={})", previous, level, sample.usedRatio());
            } else {
                log.warn("Memory pressure level changed: {} -> {} (usage={})", previous, level, sample.usedRatio());
            }
            dispatch(level, sample);
        }
        return level;
    }

    /**
     * 即时内存查询，与轮询无关；采样失败时返回零值样本
     */
    public MemorySample getMemoryInfo() {
        try {
            MemorySample sample = probe.sample();
            return sample != null ? sample : MemorySample.empty(clock.instant());
        } catch (Exception e) {
            log.warn("Memory query failed, using empty sample", e);
            return MemorySample.empty(clock.instant());
        }
    }

    /**
     * 立即触发一次垃圾回收
     *
     * @return 各收集器（代）在本次回收中新增的回收次数
     */
    public Map<String, Long> forceGc() {
        List<GarbageCollectorMXBean> gcBeans = ManagementFactory.getGarbageCollectorMXBeans();

        Map<String, Long> before = new LinkedHashMap<>();
        for (GarbageCollectorMXBean gcBean : gcBeans) {
            before.put(gcBean.getName(), Math.max(0, gcBean.getCollectionCount()));
        }
        long heapBefore = Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();

        System.gc();

        Map<String, Long> collected = new LinkedHashMap<>();
        for (GarbageCollectorMXBean gcBean : gcBeans) {
            long after = Math.max(0, gcBean.getCollectionCount());
            collected.put(gcBean.getName(), Math.max(0, after - before.getOrDefault(gcBean.getName(), 0L)));
        }
        long heapAfter = Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();

        log.info("Forced GC completed: collections={}, freed={}KB", collected, Math.max(0, heapBefore - heapAfter) / 1024);
        return collected;
    }

    public MemoryLevel classify(double usedRatio) {
        if (usedRatio >= criticalThreshold) {
            return MemoryLevel.CRITICAL;
        }
        if (usedRatio >= warningThreshold) {
            return MemoryLevel.WARNING;
        }
        return MemoryLevel.NORMAL;
    }

    public MemoryLevel currentLevel() {
        return currentLevel;
    }

    private void dispatch(MemoryLevel level, MemorySample sample) {
        Consumer<MemorySample> callback = callbacks.get(level);
        if (callback == null) {
            return;
        }
        DispatchResult result = DispatchResult.invoke(level.name(), () -> callback.accept(sample));
        if (!result.succeeded()) {
            log.error("Memory callback failed: level={}", level, result.failure());
        }
    }

    private void pollSafely() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Resource monitor tick failed", e);
        }
    }
}
