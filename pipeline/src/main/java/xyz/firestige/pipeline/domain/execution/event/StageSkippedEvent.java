package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.SkipReason;
import xyz.firestige.pipeline.domain.execution.StageExecution;

public class StageSkippedEvent extends StageStatusEvent {

    private final SkipReason reason;

    public StageSkippedEvent(String executionId, StageExecution stage) {
        super(executionId, stage, "阶段已跳过: " + stage.getSkipReason());
        this.reason = stage.getSkipReason();
    }

    public SkipReason getReason() {
        return reason;
    }
}
