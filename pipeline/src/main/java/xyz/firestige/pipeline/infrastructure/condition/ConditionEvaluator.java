package xyz.firestige.pipeline.infrastructure.condition;

import xyz.firestige.pipeline.domain.execution.ExecutionStateView;

/**
 * 阶段条件求值器
 */
public interface ConditionEvaluator {

    /**
     * 对执行状态求值，无副作用
     * <p>
     * 结果非布尔、为 null、解析或求值出错时一律返回 false
     */
    boolean evaluate(String expression, ExecutionStateView state);

    /**
     * 仅解析表达式，不求值
     *
     * @throws IllegalArgumentException 表达式无法解析
     */
    void validate(String expression);
}
