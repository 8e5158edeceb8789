package xyz.firestige.pipeline.domain.target;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 回滚在全部尝试后仍失败
 */
public class RollbackFailureException extends PipelineEngineException {

    private final int attempts;

    public RollbackFailureException(String targetId, int attempts, Throwable lastError) {
        super(ErrorType.ROLLBACK_FAILURE,
                String.format("回滚失败: targetId=%s, attempts=%d", targetId, attempts),
                targetId, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
