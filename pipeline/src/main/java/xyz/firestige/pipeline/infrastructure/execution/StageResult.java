package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

import java.time.Duration;

/**
 * 阶段执行结果
 */
public class StageResult {

    /**
     * 阶段 ID
     */
    private final String stageId;

    /**
     * 最终状态（SUCCESS / FAILURE / CANCELLED）
     */
    private final StageExecutionStatus status;

    /**
     * 失败信息（如果失败）
     */
    private final FailureInfo failureInfo;

    /**
     * 尝试次数
     */
    private final int attempts;

    private Duration duration;

    private StageResult(String stageId, StageExecutionStatus status, FailureInfo failureInfo, int attempts) {
        this.stageId = stageId;
        this.status = status;
        this.failureInfo = failureInfo;
        this.attempts = attempts;
    }

    public static StageResult success(String stageId, int attempts) {
        return new StageResult(stageId, StageExecutionStatus.SUCCESS, null, attempts);
    }

    public static StageResult failure(String stageId, FailureInfo failureInfo, int attempts) {
        return new StageResult(stageId, StageExecutionStatus.FAILURE, failureInfo, attempts);
    }

    public static StageResult cancelled(String stageId, int attempts) {
        return new StageResult(stageId, StageExecutionStatus.CANCELLED, null, attempts);
    }

    public boolean isSuccess() {
        return status == StageExecutionStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == StageExecutionStatus.FAILURE;
    }

    public boolean isCancelled() {
        return status == StageExecutionStatus.CANCELLED;
    }

    public String getStageId() {
        return stageId;
    }

    public StageExecutionStatus getStatus() {
        return status;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    @Override
    public String toString() {
        return "StageResult{" +
                "stageId='" + stageId + '\'' +
                ", status=" + status +
                ", attempts=" + attempts +
                ", duration=" + duration +
                '}';
    }
}
