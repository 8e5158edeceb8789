package xyz.firestige.pipeline.domain.execution;

import java.util.Map;

/**
 * 执行状态只读视图
 * <p>
 * 条件表达式的求值根对象，所有集合均为不可变拷贝
 */
public final class ExecutionStateView {

    private final String executionId;
    private final String pipelineId;
    private final String trigger;
    private final String status;
    private final Map<String, String> stages;
    private final Map<String, String> env;
    private final Map<String, String> metadata;

    public ExecutionStateView(String executionId, String pipelineId, String trigger, String status,
                              Map<String, String> stages, Map<String, String> env, Map<String, String> metadata) {
        this.executionId = executionId;
        this.pipelineId = pipelineId;
        this.trigger = trigger;
        this.status = status;
        this.stages = Map.copyOf(stages);
        this.env = Map.copyOf(env);
        this.metadata = Map.copyOf(metadata);
    }

    public String getExecutionId() { return executionId; }
    public String getPipelineId() { return pipelineId; }
    public String getTrigger() { return trigger; }
    public String getStatus() { return status; }

    /**
     * 阶段 ID → 阶段状态名（如 "SUCCESS"）
     */
    public Map<String, String> getStages() { return stages; }
    public Map<String, String> getEnv() { return env; }
    public Map<String, String> getMetadata() { return metadata; }
}
