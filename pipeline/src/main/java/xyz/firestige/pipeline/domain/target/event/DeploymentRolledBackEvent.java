package xyz.firestige.pipeline.domain.target.event;

import xyz.firestige.pipeline.domain.target.DeploymentTarget;

/**
 * 部署已回滚（自动回滚成功）
 */
public class DeploymentRolledBackEvent extends DeploymentEvent {

    private final int attempts;

    public DeploymentRolledBackEvent(DeploymentTarget target, String artifactPath, int attempts) {
        super(target, artifactPath, "自动回滚成功，尝试次数: " + attempts);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
