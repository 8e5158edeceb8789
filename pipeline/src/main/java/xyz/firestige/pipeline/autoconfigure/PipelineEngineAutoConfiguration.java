package xyz.firestige.pipeline.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration;
import org.springframework.context.annotation.Import;
import xyz.firestige.pipeline.config.MetricsConfiguration;
import xyz.firestige.pipeline.config.PipelineEngineConfiguration;
import xyz.firestige.pipeline.config.RestTemplateConfiguration;
import xyz.firestige.pipeline.config.ValidationConfiguration;

/**
 * 流水线引擎自动装配入口
 * <p>
 * 在事件发布器和持久化装配之后导入引擎配置，使 @ConditionalOnMissingBean 能看到用户自定义的 Bean
 */
@AutoConfiguration(after = {
        DomainEventPublisherAutoConfiguration.class,
        PipelinePersistenceAutoConfiguration.class,
        RestTemplateAutoConfiguration.class,
        ValidationAutoConfiguration.class
})
@Import({
        ValidationConfiguration.class,
        RestTemplateConfiguration.class,
        MetricsConfiguration.class,
        PipelineEngineConfiguration.class
})
public class PipelineEngineAutoConfiguration {
}
