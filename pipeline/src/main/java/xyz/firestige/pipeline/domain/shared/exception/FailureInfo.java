package xyz.firestige.pipeline.domain.shared.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * <p>
 * 统一封装流水线执行、阶段执行和部署过程中的失败信息，记录在执行记录上供调用方查询
 */
public class FailureInfo {

    /**
     * 错误码
     */
    private String errorCode;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 失败位置（阶段 ID 或部署目标 ID）
     */
    private String failedAt;

    /**
     * 失败时间
     */
    private LocalDateTime timestamp;

    /**
     * 是否可重试
     */
    private boolean retryable;

    public FailureInfo() {
        this.timestamp = LocalDateTime.now();
    }

    public FailureInfo(ErrorType errorType, String errorMessage, String failedAt, boolean retryable) {
        this.errorCode = errorType.name();
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.retryable = retryable;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType, errorMessage, null, false);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, errorMessage, failedAt, false);
    }

    public static FailureInfo fromException(Throwable e, ErrorType errorType, String failedAt) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new FailureInfo(errorType, message, failedAt, isRetryableException(e));
    }

    private static boolean isRetryableException(Throwable e) {
        // 网络、超时类异常通常可重试
        String className = e.getClass().getName();
        return className.contains("Timeout") ||
               className.contains("Network") ||
               className.contains("Connect");
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                ", retryable=" + retryable +
                '}';
    }
}
