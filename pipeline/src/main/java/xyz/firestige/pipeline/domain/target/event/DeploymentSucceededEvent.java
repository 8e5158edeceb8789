package xyz.firestige.pipeline.domain.target.event;

import xyz.firestige.pipeline.domain.target.DeploymentTarget;

public class DeploymentSucceededEvent extends DeploymentEvent {

    private final int healthCheckAttempts;

    public DeploymentSucceededEvent(DeploymentTarget target, String artifactPath, int healthCheckAttempts) {
        super(target, artifactPath, "部署成功，健康检查次数: " + healthCheckAttempts);
        this.healthCheckAttempts = healthCheckAttempts;
    }

    public int getHealthCheckAttempts() {
        return healthCheckAttempts;
    }
}
