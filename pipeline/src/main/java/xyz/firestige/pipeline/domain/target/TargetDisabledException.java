package xyz.firestige.pipeline.domain.target;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

public class TargetDisabledException extends PipelineEngineException {

    public TargetDisabledException(String targetId) {
        super(ErrorType.DEFINITION_DISABLED, "部署目标已禁用: " + targetId, targetId);
    }
}
