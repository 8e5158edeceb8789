package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.shared.event.DomainEvent;

/**
 * 阶段状态事件基类
 */
public abstract class StageStatusEvent extends DomainEvent {

    private final String executionId;
    private final String stageId;
    private final StageExecutionStatus status;

    protected StageStatusEvent(String executionId, StageExecution stage, String message) {
        super();
        this.executionId = executionId;
        this.stageId = stage.getStageId();
        this.status = stage.getStatus();
        setMessage(message);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getStageId() {
        return stageId;
    }

    public StageExecutionStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return this.getEventName() + "{" +
                "executionId='" + executionId + '\'' +
                ", stageId='" + stageId + '\'' +
                ", status=" + status +
                ", message='" + this.getMessage() + '\'' +
                '}';
    }
}
