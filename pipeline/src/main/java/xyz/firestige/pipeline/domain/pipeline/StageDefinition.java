package xyz.firestige.pipeline.domain.pipeline;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 阶段定义
 * <p>
 * 一个阶段是一组按顺序执行的命令，附带排序、依赖、条件和失败策略元数据
 */
public class StageDefinition {

    @NotBlank
    private String id;

    @NotBlank
    private String name;
    private String description;

    @NotNull
    private StageType type = StageType.CUSTOM;
    private List<String> commands = new ArrayList<>();
    private String workingDirectory;

    /**
     * 阶段级环境变量，覆盖流水线同名变量
     */
    private Map<String, String> environment = new HashMap<>();

    /**
     * 可选的布尔条件表达式，为空表示总是执行
     */
    private String condition;

    /**
     * 阶段超时（毫秒，含全部重试），小于等于 0 表示使用引擎默认值
     */
    private long timeout;

    @PositiveOrZero
    private int retryCount;
    private boolean continueOnFailure;

    /**
     * 命令并行执行（不支持，注册时拒绝）
     */
    private boolean parallel;
    private List<String> dependencies = new ArrayList<>();
    private int order;

    /**
     * 产物 glob 列表
     */
    private List<String> artifacts = new ArrayList<>();

    public StageDefinition() {
    }

    public StageDefinition copy() {
        StageDefinition c = new StageDefinition();
        c.id = id;
        c.name = name;
        c.description = description;
        c.type = type;
        c.commands = new ArrayList<>(commands);
        c.workingDirectory = workingDirectory;
        c.environment = new HashMap<>(environment);
        c.condition = condition;
        c.timeout = timeout;
        c.retryCount = retryCount;
        c.continueOnFailure = continueOnFailure;
        c.parallel = parallel;
        c.dependencies = new ArrayList<>(dependencies);
        c.order = order;
        c.artifacts = new ArrayList<>(artifacts);
        return c;
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public StageType getType() { return type; }
    public void setType(StageType type) { this.type = type; }
    public List<String> getCommands() { return commands; }
    public void setCommands(List<String> commands) { this.commands = commands != null ? commands : new ArrayList<>(); }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment != null ? environment : new HashMap<>(); }
    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = condition; }
    public long getTimeout() { return timeout; }
    public void setTimeout(long timeout) { this.timeout = timeout; }
    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public boolean isContinueOnFailure() { return continueOnFailure; }
    public void setContinueOnFailure(boolean continueOnFailure) { this.continueOnFailure = continueOnFailure; }
    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }
    public List<String> getDependencies() { return dependencies; }
    public void setDependencies(List<String> dependencies) { this.dependencies = dependencies != null ? dependencies : new ArrayList<>(); }
    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }
    public List<String> getArtifacts() { return artifacts; }
    public void setArtifacts(List<String> artifacts) { this.artifacts = artifacts != null ? artifacts : new ArrayList<>(); }

    @Override
    public String toString() {
        return "StageDefinition{id='" + id + "', name='" + name + "', order=" + order + '}';
    }

    public static class Builder {
        private final StageDefinition stage = new StageDefinition();

        private Builder(String id) {
            stage.id = id;
            stage.name = id;
        }

        public Builder name(String name) { stage.name = name; return this; }
        public Builder description(String description) { stage.description = description; return this; }
        public Builder type(StageType type) { stage.type = type; return this; }
        public Builder commands(String... commands) { stage.commands = new ArrayList<>(List.of(commands)); return this; }
        public Builder workingDirectory(String dir) { stage.workingDirectory = dir; return this; }
        public Builder env(String key, String value) { stage.environment.put(key, value); return this; }
        public Builder condition(String condition) { stage.condition = condition; return this; }
        public Builder timeout(long timeoutMillis) { stage.timeout = timeoutMillis; return this; }
        public Builder retryCount(int retryCount) { stage.retryCount = retryCount; return this; }
        public Builder continueOnFailure(boolean continueOnFailure) { stage.continueOnFailure = continueOnFailure; return this; }
        public Builder dependsOn(String... stageIds) { stage.dependencies = new ArrayList<>(List.of(stageIds)); return this; }
        public Builder order(int order) { stage.order = order; return this; }
        public Builder artifacts(String... globs) { stage.artifacts = new ArrayList<>(List.of(globs)); return this; }

        public StageDefinition build() {
            return stage;
        }
    }
}
