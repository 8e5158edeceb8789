package xyz.firestige.pipeline.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.pipeline.config.properties.DomainEventPublisherProperties;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.infrastructure.event.SpringDomainEventPublisher;

/**
 * 领域事件发布器自动配置
 *
 * 配置属性：
 * - pipeline.event.publisher.type: 发布器类型（目前只有 spring）
 *
 * 需要接入其他消息总线时，自行声明 DomainEventPublisher Bean 即可覆盖默认实现。
 */
@AutoConfiguration
@EnableConfigurationProperties(DomainEventPublisherProperties.class)
public class DomainEventPublisherAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DomainEventPublisherAutoConfiguration.class);

    /**
     * Spring 本地事件发布器（默认配置）
     */
    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    @ConditionalOnProperty(name = "pipeline.event.publisher.type", havingValue = "spring", matchIfMissing = true)
    public DomainEventPublisher springDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        log.info("Configuring SpringDomainEventPublisher (local event bus)");
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }
}
