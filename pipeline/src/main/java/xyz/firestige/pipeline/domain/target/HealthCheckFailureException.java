package xyz.firestige.pipeline.domain.target;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 健康检查在全部重试后仍未通过
 */
public class HealthCheckFailureException extends PipelineEngineException {

    private final int attempts;
    private final Integer lastStatus;

    public HealthCheckFailureException(String targetId, int attempts, Integer lastStatus) {
        super(ErrorType.HEALTH_CHECK_FAILURE,
                String.format("健康检查失败: targetId=%s, attempts=%d, lastStatus=%s", targetId, attempts, lastStatus),
                targetId);
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * 最后一次探测的状态码，探测异常时为 null
     */
    public Integer getLastStatus() {
        return lastStatus;
    }
}
