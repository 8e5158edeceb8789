package xyz.firestige.pipeline.domain.target.event;

import xyz.firestige.pipeline.domain.shared.event.DomainEvent;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.TargetEnvironment;

/**
 * 部署事件基类
 */
public abstract class DeploymentEvent extends DomainEvent {

    private final String targetId;
    private final String targetName;
    private final TargetEnvironment environment;
    private final String artifactPath;

    protected DeploymentEvent(DeploymentTarget target, String artifactPath, String message) {
        super();
        this.targetId = target.getId();
        this.targetName = target.getName();
        this.environment = target.getEnvironment();
        this.artifactPath = artifactPath;
        setMessage(message);
    }

    public String getTargetId() {
        return targetId;
    }

    public String getTargetName() {
        return targetName;
    }

    public TargetEnvironment getEnvironment() {
        return environment;
    }

    public String getArtifactPath() {
        return artifactPath;
    }

    @Override
    public String toString() {
        return this.getEventName() + "{" +
                "targetId='" + targetId + '\'' +
                ", environment=" + environment +
                ", artifactPath='" + artifactPath + '\'' +
                ", message='" + this.getMessage() + '\'' +
                '}';
    }
}
