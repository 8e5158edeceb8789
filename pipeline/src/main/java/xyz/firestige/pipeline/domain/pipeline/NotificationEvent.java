package xyz.firestige.pipeline.domain.pipeline;

import xyz.firestige.pipeline.domain.execution.ExecutionStatus;

/**
 * 执行生命周期通知事件
 */
public enum NotificationEvent {

    START("开始"),
    SUCCESS("成功"),
    FAILURE("失败"),
    CANCELLED("已取消");

    private final String description;

    NotificationEvent(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 终态对应的通知事件
     */
    public static NotificationEvent fromTerminalStatus(ExecutionStatus status) {
        switch (status) {
            case SUCCESS:
                return SUCCESS;
            case CANCELLED:
                return CANCELLED;
            case FAILURE:
                return FAILURE;
            default:
                throw new IllegalArgumentException("非终态无对应通知事件: " + status);
        }
    }
}
