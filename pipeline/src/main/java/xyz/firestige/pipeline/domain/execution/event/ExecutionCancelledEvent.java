package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;

/**
 * 执行取消事件
 */
public class ExecutionCancelledEvent extends ExecutionStatusEvent {

    public ExecutionCancelledEvent(PipelineExecution execution) {
        super(execution, "执行已取消");
    }
}
