package xyz.firestige.pipeline.infrastructure.condition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import xyz.firestige.pipeline.domain.execution.ExecutionStateView;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 SpEL 的条件求值器
 * <p>
 * 使用只读数据绑定的 SimpleEvaluationContext：不支持类型引用、构造器、Bean 引用、
 * 方法调用和赋值，表达式只能读取 {@link ExecutionStateView} 的属性，例如
 * <pre>
 * stages['build'] == 'SUCCESS' and env['DEPLOY'] == 'true'
 * trigger == 'manual'
 * </pre>
 */
public class SpelConditionEvaluator implements ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SpelConditionEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    @Override
    public boolean evaluate(String expression, ExecutionStateView state) {
        if (expression == null || expression.isBlank()) {
            return true;
        }
        try {
            EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                    .withRootObject(state)
                    .build();
            Object value = parse(expression).getValue(context);
            if (value instanceof Boolean) {
                return (Boolean) value;
            }
            log.warn("条件表达式结果不是布尔值, expression: {}, result: {}", expression, value);
            return false;
        } catch (ParseException | EvaluationException e) {
            log.warn("条件表达式求值失败, expression: {}, error: {}", expression, e.getMessage());
            return false;
        }
    }

    @Override
    public void validate(String expression) {
        try {
            parse(expression);
        } catch (ParseException e) {
            throw new IllegalArgumentException("条件表达式无法解析: " + expression + " (" + e.getMessage() + ")", e);
        }
    }

    private Expression parse(String expression) {
        Expression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        Expression parsed = parser.parseExpression(expression);
        cache.put(expression, parsed);
        return parsed;
    }
}
