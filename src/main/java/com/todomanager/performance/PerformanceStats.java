package com.todomanager.performance;

import com.todomanager.performance.cache.CacheStats;
import com.todomanager.performance.monitor.MemorySample;

/**
 * 性能层统计快照（只读）
 */
public record PerformanceStats(
    CacheStats cache,
    MemorySample memory,
    int batchPending,
    int throttlePending
) {}
