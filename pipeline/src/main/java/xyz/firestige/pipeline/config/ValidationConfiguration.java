package xyz.firestige.pipeline.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.pipeline.application.registry.PipelineDefinitionValidator;
import xyz.firestige.pipeline.infrastructure.condition.ConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.execution.StageScheduler;

/**
 * 验证配置
 * <p>
 * Facade 使用 Jakarta Validator 做字段格式校验；PipelineDefinitionValidator 做注册时的业务校验
 */
@Configuration
public class ValidationConfiguration {

    @Bean
    @ConditionalOnMissingBean(Validator.class)
    public Validator validator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    @Bean
    public PipelineDefinitionValidator pipelineDefinitionValidator(ConditionEvaluator conditionEvaluator,
                                                                   StageScheduler stageScheduler) {
        return new PipelineDefinitionValidator(conditionEvaluator, stageScheduler);
    }
}
