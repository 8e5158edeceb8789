package xyz.firestige.pipeline.domain.execution;

/**
 * 流水线执行状态
 * <p>
 * 状态转换说明：
 * - QUEUED → RUNNING: 后台线程开始执行
 * - QUEUED → CANCELLED: 排队期间被取消
 * - RUNNING → SUCCESS: 所有阶段成功或跳过
 * - RUNNING → FAILURE: 存在失败阶段，或执行中止
 * - RUNNING → CANCELLED: 用户取消（阶段边界生效）
 * <p>
 * 终态（SUCCESS/FAILURE/CANCELLED）不可离开，也不会被再次进入
 */
public enum ExecutionStatus {

    QUEUED("排队中"),

    RUNNING("执行中"),

    SUCCESS("成功"),

    FAILURE("失败"),

    CANCELLED("已取消");

    private final String description;

    ExecutionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == CANCELLED;
    }

    public boolean canStart() {
        return this == QUEUED;
    }

    public boolean canCancel() {
        return !isTerminal();
    }
}
