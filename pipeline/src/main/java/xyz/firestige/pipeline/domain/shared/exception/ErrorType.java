package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 错误类型枚举
 * <p>
 * 用于分类流水线定义、执行与部署过程中的错误，便于错误处理和监控
 */
public enum ErrorType {

    /**
     * 数据校验错误（字段格式）
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 流水线、部署目标或执行记录不存在
     */
    DEFINITION_NOT_FOUND("定义不存在"),

    /**
     * 流水线或部署目标已禁用
     */
    DEFINITION_DISABLED("定义已禁用"),

    /**
     * 流水线定义非法（依赖图缺失/循环、条件表达式无法解析等）
     */
    DEFINITION_INVALID("定义非法"),

    /**
     * 阶段命令执行失败
     */
    STAGE_EXECUTION_FAILURE("阶段执行失败"),

    /**
     * 超时错误
     */
    TIMEOUT_ERROR("超时错误"),

    /**
     * 流水线因不可继续的阶段失败而中止
     */
    PIPELINE_ABORT("流水线中止"),

    /**
     * 已取消
     */
    CANCELLED("已取消"),

    /**
     * 部署失败
     */
    DEPLOYMENT_FAILURE("部署失败"),

    /**
     * 健康检查失败
     */
    HEALTH_CHECK_FAILURE("健康检查失败"),

    /**
     * 回滚失败
     */
    ROLLBACK_FAILURE("回滚失败"),

    /**
     * 网络错误
     */
    NETWORK_ERROR("网络错误"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
