package xyz.firestige.pipeline.infrastructure.metrics;

/**
 * 未接入 Micrometer 时使用的空实现
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name) { }

    @Override
    public void setGauge(String name, double value) { }

    @Override
    public void recordDuration(String name, long millis) { }
}
