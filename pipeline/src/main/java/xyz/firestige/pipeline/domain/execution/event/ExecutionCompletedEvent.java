package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;

/**
 * 执行成功事件
 */
public class ExecutionCompletedEvent extends ExecutionStatusEvent {

    private final Long durationMillis;

    public ExecutionCompletedEvent(PipelineExecution execution) {
        super(execution, "执行成功，耗时(ms): " + execution.getDurationMillis());
        this.durationMillis = execution.getDurationMillis();
    }

    public Long getDurationMillis() {
        return durationMillis;
    }
}
