package xyz.firestige.pipeline.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;

import java.util.List;

/**
 * Spring 本地事件总线实现
 * <p>
 * 进程内同步投递；监听器抛出的异常只记录日志，不影响流水线执行
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event == null) {
            return;
        }
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("领域事件监听器异常, event: {}, error: {}", event, e.getMessage(), e);
        }
    }

    @Override
    public void publishAll(List<?> events) {
        if (events != null && !events.isEmpty()) {
            events.forEach(this::publish);
        }
    }
}
