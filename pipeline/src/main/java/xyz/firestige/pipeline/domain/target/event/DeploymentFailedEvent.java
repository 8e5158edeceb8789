package xyz.firestige.pipeline.domain.target.event;

import xyz.firestige.pipeline.domain.shared.event.WithFailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;

public class DeploymentFailedEvent extends DeploymentEvent implements WithFailureInfo {

    private final FailureInfo failureInfo;

    public DeploymentFailedEvent(DeploymentTarget target, String artifactPath, FailureInfo failureInfo) {
        super(target, artifactPath, "部署失败: " + failureInfo.getErrorMessage());
        this.failureInfo = failureInfo;
    }

    @Override
    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
