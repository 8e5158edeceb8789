package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.shared.event.WithFailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 执行失败事件
 */
public class ExecutionFailedEvent extends ExecutionStatusEvent implements WithFailureInfo {

    /**
     * 失败的阶段列表
     */
    private final List<String> failedStages;

    private final FailureInfo failureInfo;

    public ExecutionFailedEvent(PipelineExecution execution) {
        super(execution);
        this.failedStages = execution.getStages().stream()
                .filter(s -> s.getStatus() == StageExecutionStatus.FAILURE)
                .map(StageExecution::getStageId)
                .collect(Collectors.toList());
        this.failureInfo = execution.getFailureInfo();
        setMessage("执行失败，失败阶段: " + failedStages);
    }

    public List<String> getFailedStages() {
        return failedStages;
    }

    @Override
    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
