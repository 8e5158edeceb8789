package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.ExecutionStatus;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.shared.event.DomainEvent;

/**
 * 执行状态事件基类
 * <p>
 * 事件只保存发布时刻的标识与状态，不持有执行记录本身
 */
public abstract class ExecutionStatusEvent extends DomainEvent {

    private final String executionId;
    private final String pipelineId;
    private final String pipelineName;
    private final String trigger;
    private final ExecutionStatus status;

    protected ExecutionStatusEvent(PipelineExecution execution) {
        this(execution, "");
    }

    protected ExecutionStatusEvent(PipelineExecution execution, String message) {
        super();
        this.executionId = execution.getId();
        this.pipelineId = execution.getPipelineId();
        this.pipelineName = execution.getPipelineName();
        this.trigger = execution.getTrigger();
        this.status = execution.getStatus();
        setMessage(message);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public String getTrigger() {
        return trigger;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return this.getEventName() + "{" +
                "eventId='" + this.getEventId() + '\'' +
                ", executionId='" + executionId + '\'' +
                ", pipelineId='" + pipelineId + '\'' +
                ", status=" + status +
                ", timestamp=" + this.getFormattedTimestamp() +
                ", message='" + this.getMessage() + '\'' +
                '}';
    }
}
