package xyz.firestige.pipeline.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.pipeline.NotificationChannelType;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;

/**
 * 日志通知渠道
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public boolean supports(NotificationChannelType type) {
        return type == NotificationChannelType.LOG;
    }

    @Override
    public void send(NotificationConfig config, NotificationEvent event, String message) {
        log.info("[通知][{}] target: {}, {}", event, config.getTarget(), message);
    }
}
