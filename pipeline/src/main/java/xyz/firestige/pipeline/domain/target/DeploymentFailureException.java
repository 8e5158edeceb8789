package xyz.firestige.pipeline.domain.target;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 部署失败
 */
public class DeploymentFailureException extends PipelineEngineException {

    public DeploymentFailureException(String targetId, String message) {
        super(ErrorType.DEPLOYMENT_FAILURE, message, targetId);
    }

    public DeploymentFailureException(String targetId, String message, Throwable cause) {
        super(ErrorType.DEPLOYMENT_FAILURE, message, targetId, cause);
    }
}
