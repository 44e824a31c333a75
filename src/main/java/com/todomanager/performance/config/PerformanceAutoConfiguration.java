package com.todomanager.performance.config;

import com.todomanager.performance.PerformanceCoordinator;
import com.todomanager.performance.batch.BatchCoalescer;
import com.todomanager.performance.cache.ResultCache;
import com.todomanager.performance.health.PerformanceHealthIndicator;
import com.todomanager.performance.monitor.JvmMemoryProbe;
import com.todomanager.performance.monitor.MemoryProbe;
import com.todomanager.performance.monitor.ResourceMonitor;
import com.todomanager.performance.throttle.UpdateThrottler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 性能层自动配置
 *
 * 各组件的生命周期由协调器统一管理，组件 Bean 不声明销毁方法。
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PerformanceProperties.class)
@ConditionalOnProperty(prefix = "todo.performance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PerformanceAutoConfiguration {

    public PerformanceAutoConfiguration() {
        log.info("Todo performance layer auto-configuration loaded");
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock performanceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryProbe memoryProbe(Clock performanceClock) {
        return new JvmMemoryProbe(performanceClock);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public ResultCache resultCache(PerformanceProperties properties, Clock performanceClock, MeterRegistry meterRegistry) {
        PerformanceProperties.CacheConfig cache = properties.getCache();
        return new ResultCache(cache.getMaxSize(),
            Duration.ofSeconds(cache.getTtlSeconds()),
            Duration.ofSeconds(cache.getKeyGranularitySeconds()),
            performanceClock, meterRegistry);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public BatchCoalescer batchCoalescer(PerformanceProperties properties, Clock performanceClock, MeterRegistry meterRegistry) {
        PerformanceProperties.BatchConfig batch = properties.getBatch();
        return new BatchCoalescer(batch.getBatchSize(),
            Duration.ofMillis(batch.getFlushIntervalMs()),
            performanceClock, meterRegistry);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public UpdateThrottler updateThrottler(PerformanceProperties properties, Clock performanceClock, MeterRegistry meterRegistry) {
        PerformanceProperties.ThrottleConfig throttle = properties.getThrottle();
        return new UpdateThrottler(Duration.ofMillis(throttle.getUpdateIntervalMs()),
            throttle.getMaxUpdatesPerSecond(),
            performanceClock, meterRegistry);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public ResourceMonitor resourceMonitor(PerformanceProperties properties, MemoryProbe memoryProbe,
                                           Clock performanceClock, MeterRegistry meterRegistry) {
        PerformanceProperties.MonitorConfig monitor = properties.getMonitor();
        return new ResourceMonitor(monitor.getWarningThreshold(),
            monitor.getCriticalThreshold(),
            Duration.ofMillis(monitor.getStopTimeoutMs()),
            memoryProbe, performanceClock, meterRegistry);
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public PerformanceCoordinator performanceCoordinator(PerformanceProperties properties,
                                                         ResultCache resultCache,
                                                         BatchCoalescer batchCoalescer,
                                                         UpdateThrottler updateThrottler,
                                                         ResourceMonitor resourceMonitor) {
        return new PerformanceCoordinator(resultCache, batchCoalescer, updateThrottler, resourceMonitor,
            Duration.ofMillis(properties.getMonitor().getIntervalMs()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "performanceHealthIndicator")
        public PerformanceHealthIndicator performanceHealthIndicator(PerformanceCoordinator performanceCoordinator) {
            return new PerformanceHealthIndicator(performanceCoordinator);
        }
    }
}
