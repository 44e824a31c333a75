package com.todomanager.performance.support;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * 组件实例级别的 Gauge 注册
 *
 * 每个实例带独立的 instance 标签，同一注册表上的多个实例互不覆盖；
 * 组件关闭时调用 {@link #removeAll()} 从注册表摘除，释放对组件的引用。
 */
public final class InstanceGauges {

    public static final String INSTANCE_TAG = "instance";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final MeterRegistry meterRegistry;
    private final String instance;
    private final List<Gauge> gauges = new CopyOnWriteArrayList<>();

    public InstanceGauges(MeterRegistry meterRegistry, String component) {
        this.meterRegistry = meterRegistry;
        this.instance = component + "-" + SEQUENCE.incrementAndGet();
    }

    public <T> void register(String name, T target, ToDoubleFunction<T> value) {
        gauges.add(Gauge.builder(name, target, value)
            .tag(INSTANCE_TAG, instance)
            .register(meterRegistry));
    }

    public String instance() {
        return instance;
    }

    public void removeAll() {
        for (Gauge gauge : gauges) {
            meterRegistry.remove(gauge);
        }
        gauges.clear();
    }
}
