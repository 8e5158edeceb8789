package xyz.firestige.pipeline.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 解耦领域层与具体的事件传输机制，默认实现为 Spring 本地事件总线
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);

    /**
     * 批量发布领域事件
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
