package xyz.firestige.pipeline.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Micrometer 的指标实现
 * <p>
 * 计数器和计时器按名称由 MeterRegistry 去重；gauge 的取值对象由本类持有
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicLong> gaugeBits = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        // Micrometer 对 gauge 取值对象只持有弱引用
        AtomicLong bits = gaugeBits.computeIfAbsent(name, n -> {
            AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0d));
            registry.gauge(n, holder, h -> Double.longBitsToDouble(h.get()));
            return holder;
        });
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public void recordDuration(String name, long millis) {
        if (millis < 0) {
            return;
        }
        registry.timer(name).record(Duration.ofMillis(millis));
    }
}
