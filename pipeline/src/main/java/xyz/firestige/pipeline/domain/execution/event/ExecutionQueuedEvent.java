package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;

/**
 * 执行已入队事件
 */
public class ExecutionQueuedEvent extends ExecutionStatusEvent {

    private final int stageCount;

    public ExecutionQueuedEvent(PipelineExecution execution) {
        super(execution, String.format("执行已入队，共 %d 个阶段", execution.getStages().size()));
        this.stageCount = execution.getStages().size();
    }

    public int getStageCount() {
        return stageCount;
    }
}
