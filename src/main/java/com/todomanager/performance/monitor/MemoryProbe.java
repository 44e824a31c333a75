package com.todomanager.performance.monitor;

/**
 * 内存信息来源
 */
@FunctionalInterface
public interface MemoryProbe {

    MemorySample sample() throws Exception;
}
