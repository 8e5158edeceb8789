package xyz.firestige.pipeline.domain.execution.event;

import xyz.firestige.pipeline.domain.execution.StageExecution;

public class StageStartedEvent extends StageStatusEvent {

    /**
     * 命令数
     */
    private final int totalCommands;

    public StageStartedEvent(String executionId, StageExecution stage, int totalCommands) {
        super(executionId, stage, "阶段开始执行，命令数: " + totalCommands);
        this.totalCommands = totalCommands;
    }

    public int getTotalCommands() {
        return totalCommands;
    }
}
