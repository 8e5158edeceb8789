package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.StageExecution;

/**
 * 阶段重试事件
 */
public class StageRetryingEvent extends StageStatusEvent {

    private final int attempt;
    private final int maxAttempts;

    public StageRetryingEvent(String executionId, StageExecution stage, int attempt, int maxAttempts) {
        super(executionId, stage, String.format("阶段重试 (%d/%d)", attempt, maxAttempts));
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
