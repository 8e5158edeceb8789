package xyz.firestige.pipeline.application.registry;

import xyz.firestige.pipeline.domain.pipeline.DefinitionInvalidException;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.infrastructure.artifact.ArtifactCollector;
import xyz.firestige.pipeline.infrastructure.condition.ConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.execution.StageScheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 定义业务校验（注册时快速失败）
 * <p>
 * 校验规则：
 * - 流水线名称非空
 * - 阶段 ID 非空且唯一
 * - 依赖必须指向存在的、在调度顺序中严格更早执行的其他阶段（同时排除了循环依赖）
 * - retryCount 不为负
 * - 不支持 parallel = true
 * - 条件表达式可解析
 * - 产物 glob 模式语法正确
 * <p>
 * 字段格式校验（@NotBlank 等）由 Facade 的 Jakarta Validator 完成
 */
public class PipelineDefinitionValidator {

    private final ConditionEvaluator conditionEvaluator;
    private final StageScheduler stageScheduler;

    public PipelineDefinitionValidator(ConditionEvaluator conditionEvaluator, StageScheduler stageScheduler) {
        this.conditionEvaluator = conditionEvaluator;
        this.stageScheduler = stageScheduler;
    }

    public void validate(Pipeline pipeline) {
        List<String> violations = new ArrayList<>();
        String name = pipeline.getName();
        if (name == null || name.isBlank()) {
            violations.add("流水线名称不能为空");
        }

        Set<String> ids = new HashSet<>();
        for (StageDefinition stage : pipeline.getStages()) {
            if (stage.getId() == null || stage.getId().isBlank()) {
                violations.add("阶段 ID 不能为空");
            } else if (!ids.add(stage.getId())) {
                violations.add("阶段 ID 重复: " + stage.getId());
            }
        }

        // 调度位置：依赖必须排在前面
        Map<String, Integer> position = new HashMap<>();
        List<StageDefinition> ordered = stageScheduler.order(pipeline.getStages());
        for (int i = 0; i < ordered.size(); i++) {
            String id = ordered.get(i).getId();
            if (id != null) {
                position.putIfAbsent(id, i);
            }
        }

        for (StageDefinition stage : pipeline.getStages()) {
            String stageId = stage.getId();
            if (stage.getRetryCount() < 0) {
                violations.add("阶段 retryCount 不能为负: " + stageId);
            }
            if (stage.isParallel()) {
                violations.add("不支持并行执行命令 (parallel = true): " + stageId);
            }
            for (String dependency : stage.getDependencies()) {
                if (dependency == null || !position.containsKey(dependency)) {
                    violations.add(String.format("阶段 %s 依赖的阶段不存在: %s", stageId, dependency));
                } else if (dependency.equals(stageId)) {
                    violations.add("阶段不能依赖自身: " + stageId);
                } else if (stageId != null && position.get(dependency) >= position.get(stageId)) {
                    violations.add(String.format("阶段 %s 依赖的阶段 %s 未在其之前执行（order 需更小）", stageId, dependency));
                }
            }
            for (String pattern : stage.getArtifacts()) {
                try {
                    ArtifactCollector.matcher(pattern);
                } catch (IllegalArgumentException e) {
                    violations.add(String.format("阶段 %s 产物模式无效: %s", stageId, pattern));
                }
            }
            if (stage.hasCondition()) {
                try {
                    conditionEvaluator.validate(stage.getCondition());
                } catch (IllegalArgumentException e) {
                    violations.add(String.format("阶段 %s 条件表达式无法解析: %s", stageId, stage.getCondition()));
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new DefinitionInvalidException(name, violations);
        }
    }

    public void validate(DeploymentTarget target) {
        List<String> violations = new ArrayList<>();
        if (target.getName() == null || target.getName().isBlank()) {
            violations.add("部署目标名称不能为空");
        }
        if (target.getHealthCheck() != null) {
            if (target.getHealthCheck().getUrl() == null || target.getHealthCheck().getUrl().isBlank()) {
                violations.add("健康检查 URL 不能为空");
            }
            if (target.getHealthCheck().getRetries() < 1) {
                violations.add("健康检查 retries 至少为 1");
            }
        }
        if (target.getRollback() != null && target.getRollback().getMaxAttempts() < 1) {
            violations.add("回滚 maxAttempts 至少为 1");
        }
        if (!violations.isEmpty()) {
            throw new DefinitionInvalidException(target.getName(), violations);
        }
    }
}
