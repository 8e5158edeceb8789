package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 阶段调度：决定执行顺序和依赖是否满足
 */
public class StageScheduler {

    /**
     * 按 order 升序排列；order 相同时保持声明顺序（List.sort 是稳定排序）
     */
    public List<StageDefinition> order(List<StageDefinition> stages) {
        List<StageDefinition> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(StageDefinition::getOrder));
        return sorted;
    }

    /**
     * 所有依赖阶段均为 SUCCESS 时返回 true；无依赖返回 true
     */
    public boolean dependenciesMet(StageDefinition stage, PipelineExecution execution) {
        for (String dependency : stage.getDependencies()) {
            Optional<StageExecution> dep = execution.findStage(dependency);
            if (dep.isEmpty() || dep.get().getStatus() != StageExecutionStatus.SUCCESS) {
                return false;
            }
        }
        return true;
    }

    /**
     * 未满足的依赖列表，用于日志
     */
    public List<String> unmetDependencies(StageDefinition stage, PipelineExecution execution) {
        List<String> unmet = new ArrayList<>();
        for (String dependency : stage.getDependencies()) {
            boolean ok = execution.findStage(dependency)
                    .map(s -> s.getStatus() == StageExecutionStatus.SUCCESS)
                    .orElse(false);
            if (!ok) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }
}
