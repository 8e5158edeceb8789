package xyz.firestige.pipeline.infrastructure.notification;

import xyz.firestige.pipeline.domain.pipeline.NotificationChannelType;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;

/**
 * 通知渠道
 */
public interface NotificationChannel {

    boolean supports(NotificationChannelType type);

    /**
     * 发送通知，失败时抛出异常由调用方隔离
     */
    void send(NotificationConfig config, NotificationEvent event, String message);
}
