package xyz.firestige.pipeline.domain.shared.event;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

/**
 * 失败类事件（执行失败、阶段失败、部署失败）共有的失败信息访问
 */
public interface WithFailureInfo {

    FailureInfo getFailureInfo();

    /**
     * 失败类型，无失败信息时为 null
     */
    default ErrorType getErrorType() {
        FailureInfo failureInfo = getFailureInfo();
        return failureInfo != null ? failureInfo.getErrorType() : null;
    }
}
