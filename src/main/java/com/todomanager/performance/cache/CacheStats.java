package com.todomanager.performance.cache;

/**
 * 结果缓存统计快照
 */
public record CacheStats(
    int size,
    int maxSize,
    long ttlSeconds,
    long hits,
    long misses
) {
    public double hitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0;
    }
}
