package xyz.firestige.pipeline.domain.execution;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 阶段执行记录
 * <p>
 * 只由所属执行的后台线程写入；查询方可能并发读取，所以状态字段为 volatile，缓冲区读写加锁
 */
public class StageExecution {

    private final String stageId;
    private final String name;
    private volatile StageExecutionStatus status = StageExecutionStatus.PENDING;
    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;
    private volatile Long durationMillis;
    private volatile Integer exitCode;
    private volatile SkipReason skipReason;
    private volatile int attempts;
    private final StringBuilder output = new StringBuilder();
    private final StringBuilder error = new StringBuilder();
    private final List<String> artifacts = new ArrayList<>();

    public StageExecution(String stageId, String name) {
        this.stageId = stageId;
        this.name = name;
    }

    // ========== 状态转换 ==========

    public void start() {
        requireStatus(StageExecutionStatus.PENDING, "start");
        this.status = StageExecutionStatus.RUNNING;
        this.startTime = LocalDateTime.now();
    }

    public void succeed() {
        requireStatus(StageExecutionStatus.RUNNING, "succeed");
        this.status = StageExecutionStatus.SUCCESS;
        stampEnd();
    }

    public void fail() {
        requireStatus(StageExecutionStatus.RUNNING, "fail");
        this.status = StageExecutionStatus.FAILURE;
        stampEnd();
    }

    public void cancel() {
        if (status.isTerminal()) {
            return;
        }
        this.status = StageExecutionStatus.CANCELLED;
        stampEnd();
    }

    /**
     * 跳过：只允许从 PENDING 进入
     */
    public void skip(SkipReason reason) {
        requireStatus(StageExecutionStatus.PENDING, "skip");
        this.status = StageExecutionStatus.SKIPPED;
        this.skipReason = reason;
    }

    private void stampEnd() {
        this.endTime = LocalDateTime.now();
        if (startTime != null) {
            this.durationMillis = Duration.between(startTime, endTime).toMillis();
        }
    }

    private void requireStatus(StageExecutionStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                    "阶段状态不允许 %s: stageId=%s, status=%s", action, stageId, status));
        }
    }

    // ========== 运行数据 ==========

    public synchronized void appendOutput(String text) {
        if (text != null && !text.isEmpty()) {
            output.append(text).append('\n');
        }
    }

    public synchronized void appendError(String text) {
        if (text != null && !text.isEmpty()) {
            error.append(text).append('\n');
        }
    }

    public synchronized void addArtifact(String artifactName) {
        artifacts.add(artifactName);
    }

    public void recordExitCode(Integer exitCode) {
        this.exitCode = exitCode;
    }

    public int nextAttempt() {
        return ++attempts;
    }

    // ========== Getters ==========

    public String getStageId() { return stageId; }
    public String getName() { return name; }
    public StageExecutionStatus getStatus() { return status; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public Long getDurationMillis() { return durationMillis; }
    public Integer getExitCode() { return exitCode; }
    public SkipReason getSkipReason() { return skipReason; }
    public int getAttempts() { return attempts; }

    public synchronized String getOutput() {
        return output.toString();
    }

    public synchronized String getError() {
        return error.toString();
    }

    public synchronized List<String> getArtifacts() {
        return List.copyOf(artifacts);
    }

    @Override
    public String toString() {
        return "StageExecution{stageId='" + stageId + "', status=" + status + ", attempts=" + attempts + '}';
    }
}
