package xyz.firestige.pipeline.domain.execution;

/**
 * 阶段执行状态
 */
public enum StageExecutionStatus {

    PENDING("待执行"),

    RUNNING("执行中"),

    SUCCESS("成功"),

    FAILURE("失败"),

    /**
     * 已跳过（只能由依赖未满足或条件不成立导致，命令失败不会进入该状态）
     */
    SKIPPED("已跳过"),

    CANCELLED("已取消");

    private final String description;

    StageExecutionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == SKIPPED || this == CANCELLED;
    }
}
