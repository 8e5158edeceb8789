package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.execution.ExecutionNotifier;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.infrastructure.condition.ConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;

/**
 * 执行循环依赖
 * <p>
 * 将执行循环需要的协作者封装到一个对象中，避免构造函数参数过多
 */
public class ExecutionDependencies {

    private final StageRunner stageRunner;
    private final StageScheduler stageScheduler;
    private final ConditionEvaluator conditionEvaluator;
    private final ExecutionNotifier notifier;
    private final DomainEventPublisher eventPublisher;
    private final ActiveExecutionRegistry activeExecutions;
    private final MetricsRegistry metrics;

    public ExecutionDependencies(
            StageRunner stageRunner,
            StageScheduler stageScheduler,
            ConditionEvaluator conditionEvaluator,
            ExecutionNotifier notifier,
            DomainEventPublisher eventPublisher,
            ActiveExecutionRegistry activeExecutions,
            MetricsRegistry metrics) {
        this.stageRunner = stageRunner;
        this.stageScheduler = stageScheduler;
        this.conditionEvaluator = conditionEvaluator;
        this.notifier = notifier;
        this.eventPublisher = eventPublisher;
        this.activeExecutions = activeExecutions;
        this.metrics = metrics;
    }

    // ========== Getters ==========

    public StageRunner getStageRunner() {
        return stageRunner;
    }

    public StageScheduler getStageScheduler() {
        return stageScheduler;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public ExecutionNotifier getNotifier() {
        return notifier;
    }

    public DomainEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    public ActiveExecutionRegistry getActiveExecutions() {
        return activeExecutions;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }
}
