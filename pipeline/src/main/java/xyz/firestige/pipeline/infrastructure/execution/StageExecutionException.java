package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

/**
 * 单次阶段尝试失败（命令失败或超时），只在 StageRunner 内部传递
 */
public class StageExecutionException extends PipelineEngineException {

    private final Integer exitCode;

    public StageExecutionException(ErrorType errorType, String stageId, String message, Integer exitCode) {
        super(errorType, message, stageId);
        this.exitCode = exitCode;
    }

    public StageExecutionException(ErrorType errorType, String stageId, String message, Throwable cause) {
        super(errorType, message, stageId, cause);
        this.exitCode = null;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
