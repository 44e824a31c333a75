package com.todomanager.performance.health;

import com.todomanager.performance.PerformanceCoordinator;
import com.todomanager.performance.PerformanceStats;
import com.todomanager.performance.monitor.MemoryLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 性能层健康检查
 *
 * 内存处于 CRITICAL 或协调器未运行时报告 DOWN。
 */
@Slf4j
@RequiredArgsConstructor
public class PerformanceHealthIndicator implements HealthIndicator {

    private final PerformanceCoordinator coordinator;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            PerformanceStats stats = coordinator.getPerformanceStats();
            MemoryLevel level = coordinator.getResourceMonitor().classify(stats.memory().usedRatio());

            details.put("state", coordinator.getState());
            details.put("memory_level", level);
            details.put("memory_usage", stats.memory().usedRatio());
            details.put("cache_size", stats.cache().size());
            details.put("cache_max_size", stats.cache().maxSize());
            details.put("cache_hit_rate", stats.cache().hitRate());
            details.put("batch_pending", stats.batchPending());
            details.put("throttle_pending", stats.throttlePending());
            details.put("throttle_stopped", coordinator.getUpdateThrottler().isStopped());

            boolean healthy = coordinator.getState() == PerformanceCoordinator.State.RUNNING
                && level != MemoryLevel.CRITICAL;
            return (healthy ? Health.up() : Health.down()).withDetails(details).build();
        } catch (Exception e) {
            log.error("Performance health check failed", e);
            return Health.down(e).withDetails(details).build();
        }
    }
}
