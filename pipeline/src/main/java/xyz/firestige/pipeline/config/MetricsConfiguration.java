package xyz.firestige.pipeline.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.pipeline.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.pipeline.infrastructure.metrics.NoopMetricsRegistry;

/**
 * Optional Spring configuration: if a Micrometer MeterRegistry is present,
 * expose MicrometerMetricsRegistry; otherwise use Noop.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry pipelineMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            return new MicrometerMetricsRegistry(mr);
        }
        return new NoopMetricsRegistry();
    }
}
