package xyz.firestige.pipeline.domain.execution;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 执行记录不存在
 */
public class ExecutionNotFoundException extends PipelineEngineException {

    public ExecutionNotFoundException(String executionId) {
        super(ErrorType.DEFINITION_NOT_FOUND, "执行记录不存在: " + executionId, executionId);
    }
}
