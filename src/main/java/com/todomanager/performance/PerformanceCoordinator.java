package com.todomanager.performance;

import com.todomanager.performance.batch.BatchCoalescer;
import com.todomanager.performance.batch.PendingUpdate;
import com.todomanager.performance.cache.ResultCache;
import com.todomanager.performance.config.PerformanceProperties;
import com.todomanager.performance.monitor.JvmMemoryProbe;
import com.todomanager.performance.monitor.MemoryLevel;
import com.todomanager.performance.monitor.MemorySample;
import com.todomanager.performance.monitor.ResourceMonitor;
import com.todomanager.performance.throttle.UpdateThrottler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * 性能层协调器 - 组合根与生命周期管理
 *
 * 持有结果缓存、批量合并器、刷新节流器和资源监控器各一个实例，
 * 把内存压力回调接到其余三个组件上：
 * <ul>
 *   <li>WARNING: 清空缓存、强制刷新批次、触发一次 GC</li>
 *   <li>CRITICAL: 同上，并暂停刷新节流器直到应用显式恢复</li>
 * </ul>
 * 状态机: UNINITIALIZED -> RUNNING -> SHUTDOWN，关闭后不可再次初始化。
 * 协调器只调用各组件的公开方法，不持有任何组件内部的锁。
 */
public class PerformanceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCoordinator.class);

    public enum State {
        UNINITIALIZED,
        RUNNING,
        SHUTDOWN
    }

    private final ResultCache resultCache;
    private final BatchCoalescer batchCoalescer;
    private final UpdateThrottler updateThrottler;
    private final ResourceMonitor resourceMonitor;
    private final Duration monitorInterval;

    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);

    public PerformanceCoordinator(ResultCache resultCache,
                                  BatchCoalescer batchCoalescer,
                                  UpdateThrottler updateThrottler,
                                  ResourceMonitor resourceMonitor,
                                  Duration monitorInterval) {
        this.resultCache = resultCache;
        this.batchCoalescer = batchCoalescer;
        this.updateThrottler = updateThrottler;
        this.resourceMonitor = resourceMonitor;
        this.monitorInterval = monitorInterval;
    }

    /**
     * 按配置构建全部组件
     */
    public static PerformanceCoordinator create(PerformanceProperties properties, MeterRegistry meterRegistry) {
        Clock clock = Clock.systemUTC();
        PerformanceProperties.CacheConfig cache = properties.getCache();
        PerformanceProperties.BatchConfig batch = properties.getBatch();
        PerformanceProperties.ThrottleConfig throttle = properties.getThrottle();
        PerformanceProperties.MonitorConfig monitor = properties.getMonitor();

        return new PerformanceCoordinator(
            new ResultCache(cache.getMaxSize(),
                Duration.ofSeconds(cache.getTtlSeconds()),
                Duration.ofSeconds(cache.getKeyGranularitySeconds()),
                clock, meterRegistry),
            new BatchCoalescer(batch.getBatchSize(),
                Duration.ofMillis(batch.getFlushIntervalMs()),
                clock, meterRegistry),
            new UpdateThrottler(Duration.ofMillis(throttle.getUpdateIntervalMs()),
                throttle.getMaxUpdatesPerSecond(),
                clock, meterRegistry),
            new ResourceMonitor(monitor.getWarningThreshold(),
                monitor.getCriticalThreshold(),
                Duration.ofMillis(monitor.getStopTimeoutMs()),
                new JvmMemoryProbe(clock), clock, meterRegistry),
            Duration.ofMillis(monitor.getIntervalMs())
        );
    }

    /**
     * 接线内存压力回调并启动监控，重复调用无副作用
     *
     * @throws IllegalStateException 已关闭
     */
    public void initialize() {
        if (!state.compareAndSet(State.UNINITIALIZED, State.RUNNING)) {
            if (state.get() == State.SHUTDOWN) {
                throw new IllegalStateException("PerformanceCoordinator has been shut down; create a new instance");
            }
            return;
        }

        resourceMonitor.registerCallback(MemoryLevel.WARNING, this::onMemoryWarning);
        resourceMonitor.registerCallback(MemoryLevel.CRITICAL, this::onMemoryCritical);
        resourceMonitor.startMonitoring(monitorInterval);

        log.info("PerformanceCoordinator initialized: monitorInterval={}ms", monitorInterval.toMillis());
    }

    /**
     * 刷新批次、停止节流器与监控、清空缓存，重复调用无副作用
     */
    public void shutdown() {
        State previous = state.getAndSet(State.SHUTDOWN);
        if (previous == State.SHUTDOWN) {
            return;
        }

        batchCoalescer.shutdown();
        updateThrottler.shutdown();
        resourceMonitor.stopMonitoring();
        resultCache.clear();
        resourceMonitor.close();
        resultCache.close();

        log.info("PerformanceCoordinator shut down");
    }

    public PerformanceStats getPerformanceStats() {
        return new PerformanceStats(
            resultCache.stats(),
            resourceMonitor.getMemoryInfo(),
            batchCoalescer.pendingCount(),
            updateThrottler.pendingCount()
        );
    }

    public State getState() {
        return state.get();
    }

    // ========== 应用侧入口 ==========

    public String cachedResult(Instant primary, Instant secondary, BiFunction<Instant, Instant, String> computation) {
        return resultCache.getOrCompute(primary, secondary, computation);
    }

    public void registerFlushHandler(String kind, Consumer<List<PendingUpdate>> handler) {
        batchCoalescer.registerFlushHandler(kind, handler);
    }

    public void queueUpdate(String kind, Object itemId, Map<String, Object> payload) {
        batchCoalescer.queueUpdate(kind, itemId, payload);
    }

    public void registerUpdateCallback(String componentId, Runnable callback) {
        updateThrottler.registerUpdateCallback(componentId, callback);
    }

    public void requestUpdate(String componentId) {
        updateThrottler.requestUpdate(componentId);
    }

    public ResultCache getResultCache() {
        return resultCache;
    }

    public BatchCoalescer getBatchCoalescer() {
        return batchCoalescer;
    }

    public UpdateThrottler getUpdateThrottler() {
        return updateThrottler;
    }

    public ResourceMonitor getResourceMonitor() {
        return resourceMonitor;
    }

    // ========== 内存压力处理 ==========

    private void onMemoryWarning(MemorySample sample) {
        log.warn("Memory usage warning: {}%", String.format("%.1f", sample.usedRatio() * 100));
        relievePressure();
    }

    private void onMemoryCritical(MemorySample sample) {
        log.warn("Memory usage critical: {}%", String.format("%.1f", sample.usedRatio() * 100));
        relievePressure();
        updateThrottler.stop();
    }

    private void relievePressure() {
        resultCache.clear();
        batchCoalescer.forceFlush();
        Map<String, Long> collected = resourceMonitor.forceGc();
        log.info("Memory pressure relief completed: gc={}", collected);
    }
}
