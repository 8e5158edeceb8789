package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.pipeline.domain.execution.ExecutionStatus;
import xyz.firestige.pipeline.domain.execution.LogLevel;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.SkipReason;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.event.ExecutionCancelledEvent;
import xyz.firestige.pipeline.domain.execution.event.ExecutionCompletedEvent;
import xyz.firestige.pipeline.domain.execution.event.ExecutionFailedEvent;
import xyz.firestige.pipeline.domain.execution.event.ExecutionStartedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageSkippedEvent;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

import java.util.List;

/**
 * 流水线执行循环
 *
 * <p>一次执行对应一个实例，在引擎线程池的一个线程上运行：
 * <pre>
 * execute()
 *   ├─ QUEUED → RUNNING（排队期间已取消则直接收尾）
 *   ├─ executeStages()   按 (order, 声明顺序) 逐个阶段：取消检查 → 依赖 → 条件 → StageRunner
 *   └─ finalizeExecution() 落定终态、通知、事件、指标
 * </pre>
 * 不可继续的阶段失败会中止循环，剩余阶段保持 PENDING。
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final Pipeline pipeline;
    private final PipelineExecution execution;
    private final ExecutionHandle handle;
    private final ExecutionDependencies dependencies;

    public PipelineExecutor(Pipeline pipeline,
                            PipelineExecution execution,
                            ExecutionHandle handle,
                            ExecutionDependencies dependencies) {
        this.pipeline = pipeline;
        this.execution = execution;
        this.handle = handle;
        this.dependencies = dependencies;
    }

    /**
     * 执行入口，不向调用方抛出异常；所有错误记录在执行记录上
     */
    public void execute() {
        String executionId = execution.getId();
        boolean abortedByException = false;
        try {
            MDC.put("executionId", executionId);
            MDC.put("pipelineId", execution.getPipelineId());

            if (!execution.start()) {
                log.info("执行在开始前已取消, executionId: {}, status: {}", executionId, execution.getStatus());
                return;
            }
            log.info("开始执行流水线: {}, executionId: {}, trigger: {}",
                    pipeline.getName(), executionId, execution.getTrigger());
            execution.addLog(LogLevel.INFO, "开始执行流水线: " + pipeline.getName());
            dependencies.getEventPublisher().publish(new ExecutionStartedEvent(execution));
            dependencies.getMetrics().incrementCounter("pipeline_execution_started");

            executeStages();

        } catch (Exception e) {
            abortedByException = true;
            log.error("流水线执行异常, executionId: {}, error: {}", executionId, e.getMessage(), e);
            execution.recordFailure(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, null));
            execution.addLog(LogLevel.ERROR, "流水线执行异常: " + e.getMessage());
        } finally {
            try {
                finalizeExecution(abortedByException);
            } finally {
                dependencies.getActiveExecutions().release(executionId);
                dependencies.getMetrics().setGauge("pipeline_execution_active",
                        dependencies.getActiveExecutions().activeCount());
                handle.complete(execution);
                MDC.clear();
            }
        }
    }

    private void executeStages() {
        String executionId = execution.getId();
        List<StageDefinition> ordered = dependencies.getStageScheduler().order(pipeline.getStages());

        for (StageDefinition stage : ordered) {
            if (handle.isCancelRequested() || execution.isCancelled()) {
                log.info("检测到取消请求，停止执行后续阶段, executionId: {}", executionId);
                return;
            }
            StageExecution stageExecution = execution.findStage(stage.getId())
                    .orElseThrow(() -> new IllegalStateException("阶段执行记录不存在: " + stage.getId()));
            MDC.put("stageId", stage.getId());
            try {
                if (!dependencies.getStageScheduler().dependenciesMet(stage, execution)) {
                    List<String> unmet = dependencies.getStageScheduler().unmetDependencies(stage, execution);
                    log.warn("阶段依赖未满足，跳过: {}, unmet: {}, executionId: {}", stage.getId(), unmet, executionId);
                    execution.addLog(LogLevel.WARN, stage.getName(), "依赖未满足，跳过: " + unmet);
                    skip(stageExecution, SkipReason.DEPENDENCY_UNMET);
                    continue;
                }

                if (stage.hasCondition()
                        && !dependencies.getConditionEvaluator().evaluate(stage.getCondition(), execution.toStateView())) {
                    log.info("阶段条件不满足，跳过: {}, condition: {}, executionId: {}",
                            stage.getId(), stage.getCondition(), executionId);
                    execution.addLog(LogLevel.INFO, stage.getName(), "条件不满足，跳过: " + stage.getCondition());
                    skip(stageExecution, SkipReason.CONDITION_FALSE);
                    continue;
                }

                StageResult result = dependencies.getStageRunner().run(stage, stageExecution, execution, handle);

                if (result.isCancelled()) {
                    return;
                }
                if (result.isFailure() && !stage.isContinueOnFailure()) {
                    handleStageFailure(stage, result);
                    return;
                }
            } finally {
                MDC.remove("stageId");
            }
        }
    }

    private void skip(StageExecution stageExecution, SkipReason reason) {
        stageExecution.skip(reason);
        dependencies.getEventPublisher().publish(new StageSkippedEvent(execution.getId(), stageExecution));
    }

    /**
     * 不可继续的阶段失败：中止循环并记录中止原因
     */
    private void handleStageFailure(StageDefinition stage, StageResult result) {
        String detail = result.getFailureInfo() != null ? result.getFailureInfo().getErrorMessage() : "";
        String message = "阶段 " + stage.getId() + " 执行失败，流水线中止: " + detail;
        log.error("流水线中止, stage: {}, executionId: {}, error: {}", stage.getId(), execution.getId(), detail);
        execution.recordFailure(FailureInfo.of(ErrorType.PIPELINE_ABORT, message, stage.getId()));
        execution.addLog(LogLevel.ERROR, stage.getName(), message);
    }

    private void finalizeExecution(boolean abortedByException) {
        String executionId = execution.getId();
        if (!execution.isCancelled()) {
            ExecutionStatus target = abortedByException || execution.hasFailedStage()
                    ? ExecutionStatus.FAILURE : ExecutionStatus.SUCCESS;
            if (!execution.complete(target)) {
                log.info("执行已处于终态，跳过收尾状态转换, executionId: {}, status: {}",
                        executionId, execution.getStatus());
            }
        }

        ExecutionStatus status = execution.getStatus();
        log.info("流水线执行结束, executionId: {}, status: {}, 耗时: {}ms",
                executionId, status, execution.getDurationMillis());
        execution.addLog(status == ExecutionStatus.SUCCESS ? LogLevel.INFO : LogLevel.WARN,
                "流水线执行结束: " + status);

        dependencies.getNotifier().notify(pipeline, NotificationEvent.fromTerminalStatus(status), execution);
        if (execution.getDurationMillis() != null) {
            dependencies.getMetrics().recordDuration("pipeline_execution_duration", execution.getDurationMillis());
        }

        switch (status) {
            case SUCCESS:
                dependencies.getEventPublisher().publish(new ExecutionCompletedEvent(execution));
                dependencies.getMetrics().incrementCounter("pipeline_execution_succeeded");
                break;
            case FAILURE:
                dependencies.getEventPublisher().publish(new ExecutionFailedEvent(execution));
                dependencies.getMetrics().incrementCounter("pipeline_execution_failed");
                break;
            case CANCELLED:
                dependencies.getEventPublisher().publish(new ExecutionCancelledEvent(execution));
                dependencies.getMetrics().incrementCounter("pipeline_execution_cancelled");
                break;
            default:
                log.warn("收尾时执行未处于终态, executionId: {}, status: {}", executionId, status);
        }
    }
}
