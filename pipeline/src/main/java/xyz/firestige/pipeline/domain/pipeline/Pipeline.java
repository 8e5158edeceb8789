package xyz.firestige.pipeline.domain.pipeline;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 流水线定义
 * <p>
 * 由 PipelineRegistry 独占写入；执行开始时引擎持有一份深拷贝快照，
 * 之后对注册表中同一流水线的修改不会被正在运行的执行观察到。
 */
public class Pipeline {

    private String id;

    @NotBlank
    private String name;
    private String description;

    @NotNull
    private ProjectType projectType = ProjectType.CUSTOM;

    @Valid
    private List<StageDefinition> stages = new ArrayList<>();
    private Map<String, String> environment = new HashMap<>();

    @Valid
    private List<TriggerConfig> triggers = new ArrayList<>();

    @Valid
    private List<NotificationConfig> notifications = new ArrayList<>();

    @Valid
    private List<ArtifactConfig> artifacts = new ArrayList<>();
    private boolean enabled = true;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Pipeline() {
    }

    /**
     * 深拷贝
     */
    public Pipeline copy() {
        Pipeline c = new Pipeline();
        c.id = id;
        c.name = name;
        c.description = description;
        c.projectType = projectType;
        stages.forEach(s -> c.stages.add(s.copy()));
        c.environment = new HashMap<>(environment);
        triggers.forEach(t -> c.triggers.add(t.copy()));
        notifications.forEach(n -> c.notifications.add(n.copy()));
        artifacts.forEach(a -> c.artifacts.add(a.copy()));
        c.enabled = enabled;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public Optional<StageDefinition> findStage(String stageId) {
        return stages.stream().filter(s -> s.getId().equals(stageId)).findFirst();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public ProjectType getProjectType() { return projectType; }
    public void setProjectType(ProjectType projectType) { this.projectType = projectType; }
    public List<StageDefinition> getStages() { return stages; }
    public void setStages(List<StageDefinition> stages) { this.stages = stages != null ? stages : new ArrayList<>(); }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment != null ? environment : new HashMap<>(); }
    public List<TriggerConfig> getTriggers() { return triggers; }
    public void setTriggers(List<TriggerConfig> triggers) { this.triggers = triggers != null ? triggers : new ArrayList<>(); }
    public List<NotificationConfig> getNotifications() { return notifications; }
    public void setNotifications(List<NotificationConfig> notifications) { this.notifications = notifications != null ? notifications : new ArrayList<>(); }
    public List<ArtifactConfig> getArtifacts() { return artifacts; }
    public void setArtifacts(List<ArtifactConfig> artifacts) { this.artifacts = artifacts != null ? artifacts : new ArrayList<>(); }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Pipeline{id='" + id + "', name='" + name + "', stages=" + stages.size() + ", enabled=" + enabled + '}';
    }

    public static class Builder {
        private final Pipeline pipeline = new Pipeline();

        private Builder(String name) {
            pipeline.name = name;
        }

        public Builder description(String description) { pipeline.description = description; return this; }
        public Builder projectType(ProjectType projectType) { pipeline.projectType = projectType; return this; }
        public Builder stage(StageDefinition stage) { pipeline.stages.add(stage); return this; }
        public Builder env(String key, String value) { pipeline.environment.put(key, value); return this; }
        public Builder trigger(TriggerConfig trigger) { pipeline.triggers.add(trigger); return this; }
        public Builder notification(NotificationConfig notification) { pipeline.notifications.add(notification); return this; }
        public Builder artifact(ArtifactConfig artifact) { pipeline.artifacts.add(artifact); return this; }
        public Builder enabled(boolean enabled) { pipeline.enabled = enabled; return this; }

        public Pipeline build() {
            return pipeline;
        }
    }
}
