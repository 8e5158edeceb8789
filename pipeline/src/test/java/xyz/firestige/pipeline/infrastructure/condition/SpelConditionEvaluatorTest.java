package xyz.firestige.pipeline.infrastructure.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.domain.execution.ExecutionStateView;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpelConditionEvaluatorTest {

    private final SpelConditionEvaluator evaluator = new SpelConditionEvaluator();

    private final ExecutionStateView state = new ExecutionStateView(
            "exec-1", "demo-1", "manual", "RUNNING",
            Map.of("build", "SUCCESS", "test", "FAILURE"),
            Map.of("DEPLOY", "true"),
            Map.of("branch", "main"));

    @Test
    @DisplayName("读取阶段状态、环境变量和触发方式")
    void evaluatesStateProperties() {
        assertThat(evaluator.evaluate("stages['build'] == 'SUCCESS'", state)).isTrue();
        assertThat(evaluator.evaluate("stages['test'] == 'SUCCESS'", state)).isFalse();
        assertThat(evaluator.evaluate("env['DEPLOY'] == 'true' and trigger == 'manual'", state)).isTrue();
        assertThat(evaluator.evaluate("metadata['branch'] == 'main'", state)).isTrue();
    }

    @Test
    @DisplayName("空表达式视为成立")
    void blankExpressionIsTrue() {
        assertThat(evaluator.evaluate(null, state)).isTrue();
        assertThat(evaluator.evaluate("  ", state)).isTrue();
    }

    @Test
    @DisplayName("非布尔结果和求值错误视为不成立")
    void nonBooleanOrErrorIsFalse() {
        assertThat(evaluator.evaluate("trigger", state)).isFalse();
        assertThat(evaluator.evaluate("unknownProperty == 1", state)).isFalse();
        assertThat(evaluator.evaluate("stages['missing'] == 'SUCCESS'", state)).isFalse();
        assertThat(evaluator.evaluate("stages[", state)).isFalse();
    }

    @Test
    @DisplayName("不允许类型引用和方法调用")
    void sandboxRejectsTypesAndMethods() {
        assertThat(evaluator.evaluate("T(java.lang.Runtime).getRuntime() != null", state)).isFalse();
        assertThat(evaluator.evaluate("trigger.length() > 0", state)).isFalse();
    }

    @Test
    void validateRejectsUnparsableExpression() {
        assertThatThrownBy(() -> evaluator.validate("stages['build'] =="))
                .isInstanceOf(IllegalArgumentException.class);
        evaluator.validate("stages['build'] == 'SUCCESS'");
    }
}
