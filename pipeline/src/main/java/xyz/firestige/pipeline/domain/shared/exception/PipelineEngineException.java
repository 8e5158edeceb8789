package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 流水线引擎基础异常类
 * <p>
 * 所有同步抛给调用方的引擎异常的基类，携带错误类型和失败信息
 */
public class PipelineEngineException extends RuntimeException {

    private final ErrorType errorType;
    private final FailureInfo failureInfo;

    public PipelineEngineException(ErrorType errorType, String message) {
        this(errorType, message, null, null);
    }

    public PipelineEngineException(ErrorType errorType, String message, String failedAt) {
        this(errorType, message, failedAt, null);
    }

    public PipelineEngineException(ErrorType errorType, String message, String failedAt, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.failureInfo = FailureInfo.of(errorType, message, failedAt);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
