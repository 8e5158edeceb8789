package xyz.firestige.pipeline.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.pipeline.config.properties.PipelineEngineProperties;

/**
 * HTTP 客户端配置
 */
@Configuration
public class RestTemplateConfiguration {

    /**
     * Webhook / Slack / Teams 通知专用，带连接和读取超时
     */
    @Bean(name = "notificationRestTemplate")
    @ConditionalOnMissingBean(name = "notificationRestTemplate")
    public RestTemplate notificationRestTemplate(ObjectProvider<RestTemplateBuilder> builderProvider,
                                                 PipelineEngineProperties properties) {
        return builderProvider.getIfAvailable(RestTemplateBuilder::new)
                .setConnectTimeout(properties.getWebhookTimeout())
                .setReadTimeout(properties.getWebhookTimeout())
                .build();
    }
}
