package com.todomanager.performance;

import com.todomanager.performance.config.PerformanceProperties;
import io.micrometer.core.instrument.Metrics;

/**
 * 共享协调器的延迟访问入口
 *
 * 面向无法注入协调器的调用方：首次访问时按默认配置构建并初始化一个实例，
 * 指标注册到 Micrometer 全局注册表。能注入的地方应直接注入 {@link PerformanceCoordinator}。
 */
public final class PerformanceCoordinators {

    private static volatile PerformanceCoordinator shared;

    private PerformanceCoordinators() {
    }

    public static PerformanceCoordinator shared() {
        PerformanceCoordinator coordinator = shared;
        if (coordinator == null) {
            synchronized (PerformanceCoordinators.class) {
                coordinator = shared;
                if (coordinator == null) {
                    coordinator = PerformanceCoordinator.create(new PerformanceProperties(), Metrics.globalRegistry);
                    coordinator.initialize();
                    shared = coordinator;
                }
            }
        }
        return coordinator;
    }

    /**
     * 关闭并丢弃共享实例，下次访问时重新构建
     */
    public static synchronized void reset() {
        PerformanceCoordinator coordinator = shared;
        shared = null;
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }
}
