package xyz.firestige.pipeline.domain.pipeline;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 流水线已禁用
 */
public class PipelineDisabledException extends PipelineEngineException {

    public PipelineDisabledException(String pipelineId) {
        super(ErrorType.DEFINITION_DISABLED, "构建流水线已禁用: " + pipelineId, pipelineId);
    }
}
