package com.todomanager.performance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 性能层配置属性
 */
@Data
@ConfigurationProperties(prefix = "todo.performance")
public class PerformanceProperties {

    /** 是否启用性能层自动配置 */
    private boolean enabled = true;

    /** 结果缓存配置 */
    private CacheConfig cache = new CacheConfig();

    /** 批量合并配置 */
    private BatchConfig batch = new BatchConfig();

    /** 刷新节流配置 */
    private ThrottleConfig throttle = new ThrottleConfig();

    /** 资源监控配置 */
    private MonitorConfig monitor = new MonitorConfig();

    // ========== 内部配置类 ==========

    @Data
    public static class CacheConfig {
        /** 最大条目数 */
        private int maxSize = 1000;

        /** 过期时间(秒) */
        private long ttlSeconds = 60;

        /** 缓存键时间粒度(秒) */
        private long keyGranularitySeconds = 60;
    }

    @Data
    public static class BatchConfig {
        /** 达到该数量立即刷新 */
        private int batchSize = 50;

        /** 最近一次入队后的刷新延迟(毫秒) */
        private long flushIntervalMs = 500;
    }

    @Data
    public static class ThrottleConfig {
        /** 调度周期(毫秒) */
        private long updateIntervalMs = 1000;

        /** 每个组件每秒最大刷新次数 */
        private int maxUpdatesPerSecond = 30;
    }

    @Data
    public static class MonitorConfig {
        /** 警告阈值 */
        private double warningThreshold = 0.8;

        /** 危险阈值 */
        private double criticalThreshold = 0.9;

        /** 轮询间隔(毫秒) */
        private long intervalMs = 5000;

        /** 停止时等待轮询线程退出的上限(毫秒) */
        private long stopTimeoutMs = 1000;
    }
}
