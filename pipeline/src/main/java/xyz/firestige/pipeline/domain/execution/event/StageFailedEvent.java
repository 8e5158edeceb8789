package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.shared.event.WithFailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

/**
 * 阶段失败事件
 */
public class StageFailedEvent extends StageStatusEvent implements WithFailureInfo {

    private final FailureInfo failureInfo;
    private final boolean continueOnFailure;

    public StageFailedEvent(String executionId, StageExecution stage, FailureInfo failureInfo, boolean continueOnFailure) {
        super(executionId, stage, "阶段执行失败: " + (failureInfo != null ? failureInfo.getErrorMessage() : ""));
        this.failureInfo = failureInfo;
        this.continueOnFailure = continueOnFailure;
    }

    @Override
    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public boolean isContinueOnFailure() {
        return continueOnFailure;
    }
}
