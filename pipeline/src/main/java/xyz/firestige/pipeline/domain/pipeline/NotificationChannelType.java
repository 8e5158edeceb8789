package xyz.firestige.pipeline.domain.pipeline;

/**
 * 通知渠道类型
 */
public enum NotificationChannelType {
    EMAIL,
    SLACK,
    TEAMS,
    WEBHOOK,
    /**
     * 写入应用日志
     */
    LOG
}
