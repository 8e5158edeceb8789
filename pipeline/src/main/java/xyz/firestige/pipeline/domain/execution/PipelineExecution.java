package xyz.firestige.pipeline.domain.execution;

import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 流水线执行聚合根
 * <p>
 * 一次执行独占一条记录，只由运行它的后台线程写入；取消请求来自调用线程，
 * 所以执行级状态转换在记录上同步，保证取消与收尾竞争时只落定一个终态。
 * <p>
 * 阶段执行列表在创建时按流水线声明顺序一次性生成，全部为 PENDING。
 */
public class PipelineExecution {

    private final String id;
    private final String pipelineId;
    private final String pipelineName;
    private final String trigger;
    private final LocalDateTime startTime;
    private final List<StageExecution> stages;
    private final Map<String, String> environment;
    private final Map<String, String> metadata = new ConcurrentHashMap<>();
    private final List<GeneratedArtifact> artifacts = new CopyOnWriteArrayList<>();
    private final List<BuildLog> logs = new CopyOnWriteArrayList<>();

    private volatile ExecutionStatus status = ExecutionStatus.QUEUED;
    private volatile LocalDateTime endTime;
    private volatile Long durationMillis;
    private volatile FailureInfo failureInfo;

    private PipelineExecution(String id, Pipeline pipeline, String trigger) {
        this.id = Objects.requireNonNull(id, "executionId");
        this.pipelineId = pipeline.getId();
        this.pipelineName = pipeline.getName();
        this.trigger = trigger;
        this.startTime = LocalDateTime.now();
        List<StageExecution> stageExecutions = new ArrayList<>();
        for (StageDefinition stage : pipeline.getStages()) {
            stageExecutions.add(new StageExecution(stage.getId(), stage.getName()));
        }
        this.stages = Collections.unmodifiableList(stageExecutions);
        this.environment = Collections.unmodifiableMap(new HashMap<>(pipeline.getEnvironment()));
    }

    /**
     * 创建排队中的执行记录
     */
    public static PipelineExecution create(String executionId, Pipeline pipeline, String trigger) {
        return new PipelineExecution(executionId, pipeline, trigger);
    }

    // ========== 状态转换 ==========

    /**
     * QUEUED → RUNNING
     *
     * @return false 表示执行已不在排队状态（例如排队期间被取消）
     */
    public synchronized boolean start() {
        if (!status.canStart()) {
            return false;
        }
        this.status = ExecutionStatus.RUNNING;
        return true;
    }

    /**
     * RUNNING → SUCCESS / FAILURE
     *
     * @return false 表示执行已处于终态（例如已被取消），本次收尾不生效
     */
    public synchronized boolean complete(ExecutionStatus terminalStatus) {
        if (terminalStatus != ExecutionStatus.SUCCESS && terminalStatus != ExecutionStatus.FAILURE) {
            throw new IllegalArgumentException("complete 只接受 SUCCESS/FAILURE: " + terminalStatus);
        }
        if (status.isTerminal()) {
            return false;
        }
        this.status = terminalStatus;
        stampEnd();
        return true;
    }

    /**
     * 任意非终态 → CANCELLED
     *
     * @return false 表示执行已处于终态，取消为空操作
     */
    public synchronized boolean cancel() {
        if (!status.canCancel()) {
            return false;
        }
        this.status = ExecutionStatus.CANCELLED;
        stampEnd();
        return true;
    }

    private void stampEnd() {
        LocalDateTime now = LocalDateTime.now();
        // 时钟精度不足时，结束时间仍须严格晚于开始时间
        this.endTime = now.isAfter(startTime) ? now : startTime.plusNanos(1_000);
        this.durationMillis = Duration.between(startTime, endTime).toMillis();
    }

    // ========== 运行数据 ==========

    public void recordFailure(FailureInfo failureInfo) {
        this.failureInfo = failureInfo;
    }

    public void addLog(LogLevel level, String message) {
        addLog(level, null, message);
    }

    public void addLog(LogLevel level, String stage, String message) {
        logs.add(new BuildLog(level, stage, message));
    }

    public void addArtifact(GeneratedArtifact artifact) {
        artifacts.add(artifact);
    }

    public void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public Optional<StageExecution> findStage(String stageId) {
        return stages.stream().filter(s -> s.getStageId().equals(stageId)).findFirst();
    }

    public boolean hasFailedStage() {
        return stages.stream().anyMatch(s -> s.getStatus() == StageExecutionStatus.FAILURE);
    }

    public boolean isCancelled() {
        return status == ExecutionStatus.CANCELLED;
    }

    /**
     * 条件表达式使用的只读视图
     */
    public ExecutionStateView toStateView() {
        Map<String, String> stageStatuses = new LinkedHashMap<>();
        stages.forEach(s -> stageStatuses.put(s.getStageId(), s.getStatus().name()));
        return new ExecutionStateView(id, pipelineId, trigger, status.name(),
                stageStatuses, environment, new HashMap<>(metadata));
    }

    // ========== Getters ==========

    public String getId() { return id; }
    public String getPipelineId() { return pipelineId; }
    public String getPipelineName() { return pipelineName; }
    public String getTrigger() { return trigger; }
    public ExecutionStatus getStatus() { return status; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public Long getDurationMillis() { return durationMillis; }
    public List<StageExecution> getStages() { return stages; }
    public Map<String, String> getEnvironment() { return environment; }
    public Map<String, String> getMetadata() { return Collections.unmodifiableMap(metadata); }
    public List<GeneratedArtifact> getArtifacts() { return Collections.unmodifiableList(artifacts); }
    public List<BuildLog> getLogs() { return Collections.unmodifiableList(logs); }
    public FailureInfo getFailureInfo() { return failureInfo; }

    @Override
    public String toString() {
        return "PipelineExecution{id='" + id + "', pipelineId='" + pipelineId + "', status=" + status + '}';
    }
}
