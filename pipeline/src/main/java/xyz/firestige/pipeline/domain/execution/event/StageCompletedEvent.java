package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.StageExecution;

public class StageCompletedEvent extends StageStatusEvent {

    private final int attempts;

    public StageCompletedEvent(String executionId, StageExecution stage) {
        super(executionId, stage, "阶段执行成功，尝试次数: " + stage.getAttempts());
        this.attempts = stage.getAttempts();
    }

    public int getAttempts() {
        return attempts;
    }
}
