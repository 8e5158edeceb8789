package xyz.firestige.pipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 领域事件发布器配置属性
 */
@ConfigurationProperties(prefix = "pipeline.event.publisher")
public class DomainEventPublisherProperties {

    /**
     * 发布器类型：spring（默认）
     */
    private String type = "spring";

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
