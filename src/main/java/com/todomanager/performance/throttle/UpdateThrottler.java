package com.todomanager.performance.throttle;

import com.todomanager.performance.support.DispatchResult;
import com.todomanager.performance.support.Registrations;
import com.todomanager.performance.support.InstanceGauges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 刷新请求节流器
 *
 * 将高频的"刷新组件X"信号合并为每个调度周期最多一次回调，并按组件限制最大调用频率。
 * 只记录"哪些组件待刷新"（集合），不保留历史请求队列。
 */
public class UpdateThrottler {

    private static final Logger log = LoggerFactory.getLogger(UpdateThrottler.class);

    private final Duration updateInterval;
    private final Duration minInvocationGap;
    private final Clock clock;

    private final ConcurrentHashMap<String, Runnable> updateCallbacks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastInvocationTimes = new ConcurrentHashMap<>();

    private Set<String> pendingComponents = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();
    private ScheduledFuture<?> scheduledCycle;
    private boolean cycleScheduled;
    private boolean stopped;

    private final ScheduledExecutorService cycleScheduler;

    private final Counter requestCounter;
    private final Counter droppedCounter;
    private final Counter invocationCounter;
    private final InstanceGauges gauges;

    public UpdateThrottler(Duration updateInterval, int maxUpdatesPerSecond, Clock clock, MeterRegistry meterRegistry) {
        if (updateInterval == null || updateInterval.isNegative() || updateInterval.isZero()) {
            throw new IllegalArgumentException("updateInterval must be positive: " + updateInterval);
        }
        if (maxUpdatesPerSecond <= 0) {
            throw new IllegalArgumentException("maxUpdatesPerSecond must be positive: " + maxUpdatesPerSecond);
        }
        this.updateInterval = updateInterval;
        this.minInvocationGap = Duration.ofNanos(TimeUnit.SECONDS.toNanos(1) / maxUpdatesPerSecond);
        this.clock = clock;

        this.cycleScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "update-throttler-cycle");
            t.setDaemon(true);
            return t;
        });

        this.requestCounter = Counter.builder("todo.performance.throttle.requests").register(meterRegistry);
        this.droppedCounter = Counter.builder("todo.performance.throttle.dropped").register(meterRegistry);
        this.invocationCounter = Counter.builder("todo.performance.throttle.invocations").register(meterRegistry);
        this.gauges = new InstanceGauges(meterRegistry, "update-throttler");
        gauges.register("todo.performance.throttle.pending", this, UpdateThrottler::pendingCount);

        log.info("UpdateThrottler initialized: updateInterval={}ms, maxUpdatesPerSecond={}",
            updateInterval.toMillis(), maxUpdatesPerSecond);
    }

    public UpdateThrottler(Duration updateInterval, int maxUpdatesPerSecond, MeterRegistry meterRegistry) {
        this(updateInterval, maxUpdatesPerSecond, Clock.systemUTC(), meterRegistry);
    }

    /**
     * 注册组件刷新回调，重复注册时后者覆盖前者
     */
    public void registerUpdateCallback(String componentId, Runnable callback) {
        Registrations.requireKey(componentId, "componentId");
        Registrations.requireCallback(callback, "callback");
        if (updateCallbacks.put(componentId, callback) != null) {
            log.debug("Update callback replaced: component={}", componentId);
        }
    }

    /**
     * 请求刷新组件
     *
     * 距该组件上次实际刷新不足 1/maxUpdatesPerSecond 秒时直接丢弃；
     * 否则加入待刷新集合，必要时启动一个调度周期。
     */
    public void requestUpdate(String componentId) {
        Registrations.requireKey(componentId, "componentId");
        requestCounter.increment();

        Instant lastInvocation = lastInvocationTimes.get(componentId);
        if (lastInvocation != null
            && Duration.between(lastInvocation, clock.instant()).compareTo(minInvocationGap) < 0) {
            droppedCounter.increment();
            return;
        }

        lock.lock();
        try {
            if (stopped) {
                droppedCounter.increment();
                log.debug("Throttler stopped, update request ignored: component={}", componentId);
                return;
            }
            pendingComponents.add(componentId);
            if (!cycleScheduled) {
                scheduleCycle();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取消已调度的周期并清空待刷新集合，之后的请求被忽略直到 {@link #resume()}
     */
    public void stop() {
        lock.lock();
        try {
            if (scheduledCycle != null) {
                scheduledCycle.cancel(false);
                scheduledCycle = null;
            }
            cycleScheduled = false;
            pendingComponents.clear();
            if (!stopped) {
                stopped = true;
                log.info("UpdateThrottler stopped");
            }
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            if (stopped) {
                stopped = false;
                log.info("UpdateThrottler resumed");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止并释放调度线程，不可恢复
     */
    public void shutdown() {
        stop();
        cycleScheduler.shutdownNow();
        gauges.removeAll();
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pendingComponents.size();
        } finally {
            lock.unlock();
        }
    }

    // 调用方必须持有锁
    private void scheduleCycle() {
        try {
            scheduledCycle = cycleScheduler.schedule(
                this::runCycle, updateInterval.toMillis(), TimeUnit.MILLISECONDS);
            cycleScheduled = true;
        } catch (RejectedExecutionException e) {
            log.warn("Update cycle scheduler unavailable, dropping {} pending components", pendingComponents.size());
            pendingComponents.clear();
            cycleScheduled = false;
        }
    }

    private void runCycle() {
        Set<String> components;

        lock.lock();
        try {
            scheduledCycle = null;
            components = pendingComponents;
            pendingComponents = new HashSet<>();
        } finally {
            lock.unlock();
        }

        // 锁外执行回调
        for (String componentId : components) {
            Runnable callback = updateCallbacks.get(componentId);
            if (callback == null) {
                log.debug("No update callback registered: component={}", componentId);
                continue;
            }

            Instant invokedAt = clock.instant();
            DispatchResult result = DispatchResult.invoke(componentId, callback);
            if (result.succeeded()) {
                lastInvocationTimes.put(componentId, invokedAt);
                invocationCounter.increment();
            } else {
                log.error("Update callback failed: component={}", componentId, result.failure());
            }
        }

        lock.lock();
        try {
            // 停止后或 stop/resume 期间已重新调度时不再续期
            if (stopped || scheduledCycle != null) {
                return;
            }
            if (!pendingComponents.isEmpty()) {
                scheduleCycle();
            } else {
                cycleScheduled = false;
            }
        } finally {
            lock.unlock();
        }
    }
}
