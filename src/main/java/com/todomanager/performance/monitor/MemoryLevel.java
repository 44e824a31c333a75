package com.todomanager.performance.monitor;

/**
 * 内存压力等级
 */
public enum MemoryLevel {
    NORMAL,
    WARNING,
    CRITICAL
}
