package xyz.firestige.pipeline.infrastructure.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.HealthCheckMethod;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认部署后端
 * <p>
 * 平台相关的部署和回滚只记录日志；健康检查通过 RestTemplate 发起真实 HTTP 请求，
 * 连接和读取超时取单次探测的 timeout
 */
public class HttpDeploymentBackend implements DeploymentBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpDeploymentBackend.class);

    private final RestTemplateBuilder restTemplateBuilder;
    private final Map<Long, RestTemplate> templatesByTimeout = new ConcurrentHashMap<>();

    public HttpDeploymentBackend(RestTemplateBuilder restTemplateBuilder) {
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @Override
    public void deploy(DeploymentTarget target, String artifactPath) {
        log.info("部署产物, targetId: {}, platform: {}, environment: {}, artifact: {}",
                target.getId(), target.getPlatform(), target.getEnvironment(), artifactPath);
    }

    @Override
    public int checkHealth(String url, HealthCheckMethod method, long timeoutMillis) {
        RestTemplate restTemplate = templatesByTimeout.computeIfAbsent(timeoutMillis, t ->
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(t))
                        .setReadTimeout(Duration.ofMillis(t))
                        .build());
        try {
            ResponseEntity<Void> response = restTemplate.exchange(url, HttpMethod.valueOf(method.name()), null, Void.class);
            return response.getStatusCode().value();
        } catch (HttpStatusCodeException e) {
            return e.getStatusCode().value();
        }
    }

    @Override
    public void rollback(DeploymentTarget target) {
        log.info("回滚部署, targetId: {}, platform: {}", target.getId(), target.getPlatform());
    }
}
