package xyz.firestige.pipeline.domain.target;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

public class TargetNotFoundException extends PipelineEngineException {

    public TargetNotFoundException(String targetId) {
        super(ErrorType.DEFINITION_NOT_FOUND, "部署目标不存在: " + targetId, targetId);
    }
}
