package xyz.firestige.pipeline.domain.pipeline;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 流水线级别的产物声明
 */
public class ArtifactConfig {

    @NotBlank
    private String name;

    @NotBlank
    private String path;
    private ArtifactType type = ArtifactType.FILE;

    /**
     * 保留天数
     */
    @PositiveOrZero
    private int retention = 30;
    private boolean publish;
    private String publishTarget;

    public ArtifactConfig() {
    }

    public ArtifactConfig(String name, String path, ArtifactType type) {
        this.name = name;
        this.path = path;
        this.type = type;
    }

    public ArtifactConfig copy() {
        ArtifactConfig c = new ArtifactConfig(name, path, type);
        c.retention = retention;
        c.publish = publish;
        c.publishTarget = publishTarget;
        return c;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public ArtifactType getType() { return type; }
    public void setType(ArtifactType type) { this.type = type; }
    public int getRetention() { return retention; }
    public void setRetention(int retention) { this.retention = retention; }
    public boolean isPublish() { return publish; }
    public void setPublish(boolean publish) { this.publish = publish; }
    public String getPublishTarget() { return publishTarget; }
    public void setPublishTarget(String publishTarget) { this.publishTarget = publishTarget; }
}
