package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;

/**
 * 执行开始事件
 */
public class ExecutionStartedEvent extends ExecutionStatusEvent {

    public ExecutionStartedEvent(PipelineExecution execution) {
        super(execution, "执行开始，触发方式: " + execution.getTrigger());
    }
}
