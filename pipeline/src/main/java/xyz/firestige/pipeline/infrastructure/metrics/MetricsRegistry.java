package xyz.firestige.pipeline.infrastructure.metrics;

/**
 * 引擎指标出口
 * <p>
 * 指标名使用下划线风格，如 pipeline_execution_started
 */
public interface MetricsRegistry {

    void incrementCounter(String name);

    void setGauge(String name, double value);

    /**
     * 记录一次耗时（毫秒）
     */
    void recordDuration(String name, long millis);
}
