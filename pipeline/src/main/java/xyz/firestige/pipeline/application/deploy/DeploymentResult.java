package xyz.firestige.pipeline.application.deploy;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 部署成功结果；失败一律以异常返回
 */
public class DeploymentResult {

    private final String targetId;
    private final String artifactPath;
    private final String url;
    private final int healthCheckAttempts;
    private final LocalDateTime deployedAt;
    private final Duration duration;

    public DeploymentResult(String targetId, String artifactPath, String url,
                            int healthCheckAttempts, LocalDateTime deployedAt, Duration duration) {
        this.targetId = targetId;
        this.artifactPath = artifactPath;
        this.url = url;
        this.healthCheckAttempts = healthCheckAttempts;
        this.deployedAt = deployedAt;
        this.duration = duration;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getArtifactPath() {
        return artifactPath;
    }

    public String getUrl() {
        return url;
    }

    /**
     * 健康检查探测次数，未配置健康检查时为 0
     */
    public int getHealthCheckAttempts() {
        return healthCheckAttempts;
    }

    public LocalDateTime getDeployedAt() {
        return deployedAt;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "DeploymentResult{targetId='" + targetId + "', healthCheckAttempts=" + healthCheckAttempts
                + ", duration=" + duration + '}';
    }
}
