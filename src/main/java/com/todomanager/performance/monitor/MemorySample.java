package com.todomanager.performance.monitor;

import java.time.Instant;

/**
 * 单次内存采样，每次轮询新建，不做持久化
 *
 * @param usedRatio            系统内存使用率 [0,1]
 * @param processBytes         本进程占用（堆 + 非堆）
 * @param systemTotalBytes     系统物理内存总量
 * @param systemAvailableBytes 系统可用物理内存
 * @param heapUsedBytes        已用堆内存
 * @param heapMaxBytes         最大堆内存，未定义时为 -1
 * @param sampledAt            采样时间
 */
public record MemorySample(
    double usedRatio,
    long processBytes,
    long systemTotalBytes,
    long systemAvailableBytes,
    long heapUsedBytes,
    long heapMaxBytes,
    Instant sampledAt
) {
    public MemorySample {
        usedRatio = Math.max(0.0, Math.min(1.0, usedRatio));
    }

    /**
     * 采样失败时的零值样本
     */
    public static MemorySample empty(Instant sampledAt) {
        return new MemorySample(0.0, 0, 0, 0, 0, 0, sampledAt);
    }

    public static MemorySample ofRatio(double usedRatio, Instant sampledAt) {
        return new MemorySample(usedRatio, 0, 0, 0, 0, 0, sampledAt);
    }
}
