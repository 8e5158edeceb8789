package xyz.firestige.pipeline.domain.pipeline;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * 通知配置
 */
public class NotificationConfig {

    @NotNull
    private NotificationChannelType type;

    /**
     * 渠道目标（邮箱、Webhook URL、频道名等）
     */
    private String target;

    @NotEmpty
    private List<NotificationEvent> events = new ArrayList<>();

    /**
     * 消息模板，支持 ${pipeline} ${event} ${status} ${executionId} ${trigger} 占位符
     */
    private String template;
    private boolean enabled = true;

    public NotificationConfig() {
    }

    public NotificationConfig(NotificationChannelType type, String target, List<NotificationEvent> events) {
        this.type = type;
        this.target = target;
        this.events = new ArrayList<>(events);
    }

    public NotificationConfig copy() {
        NotificationConfig c = new NotificationConfig(type, target, events);
        c.template = template;
        c.enabled = enabled;
        return c;
    }

    public boolean accepts(NotificationEvent event) {
        return enabled && events != null && events.contains(event);
    }

    public NotificationChannelType getType() { return type; }
    public void setType(NotificationChannelType type) { this.type = type; }
    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }
    public List<NotificationEvent> getEvents() { return events; }
    public void setEvents(List<NotificationEvent> events) { this.events = events != null ? events : new ArrayList<>(); }
    public String getTemplate() { return template; }
    public void setTemplate(String template) { this.template = template; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
