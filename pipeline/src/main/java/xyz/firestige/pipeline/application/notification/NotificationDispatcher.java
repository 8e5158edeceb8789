package xyz.firestige.pipeline.application.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.execution.ExecutionNotifier;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.infrastructure.notification.NotificationChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 通知分发器
 * <p>
 * 对流水线中每个启用且订阅了该事件的通知配置，渲染消息并交给对应类型的渠道发送。
 * 每个渠道调用相互隔离：异常或缺失渠道只记录 WARN，不影响其他渠道，也不影响执行状态。
 */
public class NotificationDispatcher implements ExecutionNotifier {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(\\w+)}");

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    @Override
    public void notify(Pipeline pipeline, NotificationEvent event, PipelineExecution execution) {
        for (NotificationConfig config : pipeline.getNotifications()) {
            if (!config.accepts(event)) {
                continue;
            }
            Optional<NotificationChannel> channel = channels.stream()
                    .filter(c -> c.supports(config.getType()))
                    .findFirst();
            if (channel.isEmpty()) {
                logger.warn("[NotificationDispatcher] 未找到通知渠道, type: {}, executionId: {}",
                        config.getType(), execution.getId());
                continue;
            }
            String message = render(config.getTemplate(), pipeline, event, execution);
            try {
                channel.get().send(config, event, message);
            } catch (Exception e) {
                logger.warn("[NotificationDispatcher] 通知发送失败, type: {}, target: {}, executionId: {}, error: {}",
                        config.getType(), config.getTarget(), execution.getId(), e.getMessage());
            }
        }
    }

    /**
     * 渲染消息；未配置模板时使用默认文本，未知占位符原样保留
     */
    static String render(String template, Pipeline pipeline, NotificationEvent event, PipelineExecution execution) {
        if (template == null || template.isBlank()) {
            return String.format("流水线 %s %s (executionId: %s, status: %s, trigger: %s)",
                    pipeline.getName(), event.getDescription(), execution.getId(),
                    execution.getStatus(), execution.getTrigger());
        }
        Map<String, String> values = Map.of(
                "pipeline", String.valueOf(pipeline.getName()),
                "event", event.name(),
                "status", execution.getStatus().name(),
                "executionId", execution.getId(),
                "trigger", String.valueOf(execution.getTrigger()));
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(1), matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
