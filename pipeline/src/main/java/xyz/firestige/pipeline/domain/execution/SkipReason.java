package xyz.firestige.pipeline.domain.execution;

/**
 * 阶段跳过原因
 */
public enum SkipReason {

    /**
     * 存在未成功的依赖阶段
     */
    DEPENDENCY_UNMET("依赖未满足"),

    /**
     * 条件表达式不成立或求值失败
     */
    CONDITION_FALSE("条件不满足");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
