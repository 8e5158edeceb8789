package xyz.firestige.pipeline.domain.pipeline;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 流水线不存在
 */
public class PipelineNotFoundException extends PipelineEngineException {

    public PipelineNotFoundException(String pipelineId) {
        super(ErrorType.DEFINITION_NOT_FOUND, "构建流水线不存在: " + pipelineId, pipelineId);
    }
}
