package com.todomanager.performance.cache;

import com.todomanager.performance.support.InstanceGauges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * 派生状态结果缓存 - TTL + LRU
 *
 * 核心特性:
 * 1. 时间戳粗化 - 同一粒度桶（默认1分钟）内的时间戳共享同一缓存键
 * 2. TTL过期 - 读取时发现过期即移除并计为未命中
 * 3. 容量上限 - 插入前达到上限时淘汰最久未访问的一个条目
 * 4. 单一可重入锁 - 所有读写都在同一把锁内完成，不涉及IO
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    /** 未提供主时间戳时的固定结果 */
    public static final String NO_TIMESTAMP_RESULT = "normal";

    private final int maxSize;
    private final Duration ttl;
    private final Duration keyGranularity;
    private final Clock clock;

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Map<String, Long> accessTimes = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;
    private final InstanceGauges gauges;

    public ResultCache(int maxSize, Duration ttl, Duration keyGranularity, Clock clock, MeterRegistry meterRegistry) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (keyGranularity == null || keyGranularity.isNegative() || keyGranularity.isZero()) {
            throw new IllegalArgumentException("keyGranularity must be positive: " + keyGranularity);
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.keyGranularity = keyGranularity;
        this.clock = clock;

        this.hitCounter = Counter.builder("todo.performance.cache.hits").register(meterRegistry);
        this.missCounter = Counter.builder("todo.performance.cache.misses").register(meterRegistry);
        this.evictionCounter = Counter.builder("todo.performance.cache.evictions").register(meterRegistry);
        this.gauges = new InstanceGauges(meterRegistry, "result-cache");
        gauges.register("todo.performance.cache.size", this, ResultCache::size);

        log.info("ResultCache initialized: maxSize={}, ttl={}s, keyGranularity={}s",
            maxSize, ttl.toSeconds(), keyGranularity.toSeconds());
    }

    public ResultCache(int maxSize, Duration ttl, MeterRegistry meterRegistry) {
        this(maxSize, ttl, Duration.ofMinutes(1), Clock.systemUTC(), meterRegistry);
    }

    /**
     * 查询缓存
     *
     * @return 缓存值；未命中或已过期返回 null。主时间戳为空时直接返回 {@value #NO_TIMESTAMP_RESULT}
     */
    public String get(Instant primary, Instant secondary) {
        if (primary == null) {
            return NO_TIMESTAMP_RESULT;
        }

        String key = deriveKey(primary, secondary);
        long now = clock.millis();

        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                if (now - entry.storedAt() < ttl.toMillis()) {
                    accessTimes.put(key, now);
                    hits++;
                    hitCounter.increment();
                    return entry.value();
                }
                entries.remove(key);
                accessTimes.remove(key);
                log.debug("Cache entry expired: key={}", key);
            }
            misses++;
            missCounter.increment();
            return null;
        } finally {
            lock.unlock();
        }
    }

    public String get(Instant primary) {
        return get(primary, null);
    }

    /**
     * 写入缓存，主时间戳为空时忽略
     */
    public void set(Instant primary, String value, Instant secondary) {
        if (primary == null) {
            return;
        }

        String key = deriveKey(primary, secondary);
        long now = clock.millis();

        lock.lock();
        try {
            if (entries.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry(key, value, now));
            accessTimes.put(key, now);
        } finally {
            lock.unlock();
        }
    }

    public void set(Instant primary, String value) {
        set(primary, value, null);
    }

    /**
     * 读取缓存，未命中时执行计算并回填
     */
    public String getOrCompute(Instant primary, Instant secondary, BiFunction<Instant, Instant, String> computation) {
        String cached = get(primary, secondary);
        if (cached != null) {
            return cached;
        }

        String computed = computation.apply(primary, secondary);
        if (computed != null) {
            set(primary, computed, secondary);
        }
        return computed;
    }

    /**
     * 清空所有条目与访问记录
     */
    public void clear() {
        lock.lock();
        try {
            int cleared = entries.size();
            entries.clear();
            accessTimes.clear();
            log.info("Result cache cleared: {} entries dropped", cleared);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 摘除本实例注册的 Gauge，关闭后缓存仍可读写但不再上报容量
     */
    public void close() {
        gauges.removeAll();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), maxSize, ttl.toSeconds(), hits, misses);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 生成缓存键：主时间戳向下取整到粒度桶，可选附加次时间戳
     */
    String deriveKey(Instant primary, Instant secondary) {
        long granularityMillis = keyGranularity.toMillis();
        long bucket = Math.floorDiv(primary.toEpochMilli(), granularityMillis) * granularityMillis;

        StringBuilder key = new StringBuilder("at_").append(Instant.ofEpochMilli(bucket));
        if (secondary != null) {
            key.append("_done_").append(secondary);
        }
        return key.toString();
    }

    // 调用方必须持有锁
    private void evictLeastRecentlyUsed() {
        String oldestKey = null;
        long oldestAccess = Long.MAX_VALUE;
        for (Map.Entry<String, Long> access : accessTimes.entrySet()) {
            if (access.getValue() < oldestAccess) {
                oldestAccess = access.getValue();
                oldestKey = access.getKey();
            }
        }
        if (oldestKey == null) {
            return;
        }

        entries.remove(oldestKey);
        accessTimes.remove(oldestKey);
        evictionCounter.increment();
        log.debug("Cache evicted (LRU): key={}", oldestKey);
    }

    private record CacheEntry(String key, String value, long storedAt) {}
}
