package xyz.firestige.pipeline.domain.pipeline;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;

import java.util.List;

/**
 * 定义非法（注册时校验失败）
 */
public class DefinitionInvalidException extends PipelineEngineException {

    private final List<String> violations;

    public DefinitionInvalidException(String definitionName, List<String> violations) {
        super(ErrorType.DEFINITION_INVALID,
                "定义校验失败 [" + definitionName + "]: " + String.join("; ", violations),
                definitionName);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
