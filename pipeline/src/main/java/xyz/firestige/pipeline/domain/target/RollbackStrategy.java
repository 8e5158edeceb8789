package xyz.firestige.pipeline.domain.target;

/**
 * 回滚策略
 */
public enum RollbackStrategy {

    /**
     * 部署或健康检查失败后自动回滚
     */
    AUTOMATIC,

    /**
     * 仅记录失败，由人工决定是否回滚
     */
    MANUAL
}
