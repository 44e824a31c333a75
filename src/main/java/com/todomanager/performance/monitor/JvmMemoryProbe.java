package com.todomanager.performance.monitor;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * 基于 JMX 的内存采样
 *
 * 使用率取系统物理内存占比；平台不提供物理内存信息时退化为堆使用率。
 */
public class JvmMemoryProbe implements MemoryProbe {

    private final MemoryMXBean memoryMXBean;
    private final OperatingSystemMXBean osMXBean;
    private final Clock clock;

    public JvmMemoryProbe(Clock clock) {
        this.memoryMXBean = ManagementFactory.getMemoryMXBean();
        this.osMXBean = ManagementFactory.getOperatingSystemMXBean();
        this.clock = clock;
    }

    public JvmMemoryProbe() {
        this(Clock.systemUTC());
    }

    @Override
    public MemorySample sample() {
        MemoryUsage heap = memoryMXBean.getHeapMemoryUsage();
        MemoryUsage nonHeap = memoryMXBean.getNonHeapMemoryUsage();
        long processBytes = heap.getUsed() + nonHeap.getUsed();

        long systemTotal = 0;
        long systemAvailable = 0;
        if (osMXBean instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            systemTotal = sunOs.getTotalMemorySize();
            systemAvailable = sunOs.getFreeMemorySize();
        }

        double usedRatio;
        if (systemTotal > 0) {
            usedRatio = (double) (systemTotal - systemAvailable) / systemTotal;
        } else if (heap.getMax() > 0) {
            usedRatio = (double) heap.getUsed() / heap.getMax();
        } else {
            usedRatio = 0.0;
        }

        return new MemorySample(
            usedRatio,
            processBytes,
            systemTotal,
            systemAvailable,
            heap.getUsed(),
            heap.getMax(),
            clock.instant()
        );
    }
}
