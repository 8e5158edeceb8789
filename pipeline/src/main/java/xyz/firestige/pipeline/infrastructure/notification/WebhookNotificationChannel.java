package xyz.firestige.pipeline.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.pipeline.domain.pipeline.NotificationChannelType;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Webhook 通知渠道，同时用于 Slack / Teams 的 incoming webhook
 * <p>
 * 请求体：{@code {"text": message, "event": event}}
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private static final Set<NotificationChannelType> SUPPORTED = EnumSet.of(
            NotificationChannelType.WEBHOOK, NotificationChannelType.SLACK, NotificationChannelType.TEAMS);

    private final RestTemplate restTemplate;

    public WebhookNotificationChannel(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public boolean supports(NotificationChannelType type) {
        return SUPPORTED.contains(type);
    }

    @Override
    public void send(NotificationConfig config, NotificationEvent event, String message) {
        if (config.getTarget() == null || config.getTarget().isBlank()) {
            throw new IllegalArgumentException("Webhook 通知缺少 target URL");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", message);
        body.put("event", event.name());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(
                config.getTarget(), new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new IllegalStateException("Webhook 返回非 2xx 状态: " + response.getStatusCode());
        }
        log.debug("Webhook 通知已发送, type: {}, event: {}", config.getType(), event);
    }
}
