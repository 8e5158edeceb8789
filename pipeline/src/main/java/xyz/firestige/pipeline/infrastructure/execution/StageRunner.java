package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.execution.GeneratedArtifact;
import xyz.firestige.pipeline.domain.execution.LogLevel;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.event.StageCompletedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageFailedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageRetryingEvent;
import xyz.firestige.pipeline.domain.execution.event.StageStartedEvent;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.infrastructure.artifact.ArtifactCollector;
import xyz.firestige.pipeline.infrastructure.command.CommandExecutor;
import xyz.firestige.pipeline.infrastructure.command.CommandResult;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 阶段执行器：在一个命令会话内顺序执行阶段的命令
 * <p>
 * 整个阶段（含全部重试）受同一个超时预算约束，失败的尝试在预算内最多重试 retryCount 次，
 * 预算耗尽后不再重试，阶段以 TIMEOUT_ERROR 失败。
 * 每条命令在命令线程池上执行，以 {@code Future.get(remaining)} 竞速剩余预算；
 * 超时或取消时以中断终止正在执行的命令。
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final CommandExecutor commandExecutor;
    private final ExecutorService commandPool;
    private final ArtifactCollector artifactCollector;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final long defaultTimeoutMillis;

    public StageRunner(CommandExecutor commandExecutor,
                       ExecutorService commandPool,
                       ArtifactCollector artifactCollector,
                       DomainEventPublisher eventPublisher,
                       MetricsRegistry metrics,
                       Duration defaultTimeout) {
        this.commandExecutor = commandExecutor;
        this.commandPool = commandPool;
        this.artifactCollector = artifactCollector;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.defaultTimeoutMillis = defaultTimeout.toMillis();
    }

    public StageResult run(StageDefinition stage, StageExecution stageExecution,
                           PipelineExecution execution, ExecutionHandle handle) {
        String stageId = stage.getId();
        String executionId = execution.getId();

        stageExecution.start();
        execution.addLog(LogLevel.INFO, stage.getName(), "阶段开始执行");
        eventPublisher.publish(new StageStartedEvent(executionId, stageExecution, stage.getCommands().size()));
        log.info("开始执行阶段: {}, executionId: {}", stageId, executionId);

        int maxAttempts = stage.getRetryCount() + 1;
        long timeoutMillis = stage.getTimeout() > 0 ? stage.getTimeout() : defaultTimeoutMillis;
        String sessionId = null;
        StageResult result;
        try {
            sessionId = commandExecutor.createSession(
                    artifactCollector.resolveBaseDir(stage.getWorkingDirectory()).toString(),
                    mergeEnvironment(execution.getEnvironment(), stage.getEnvironment()));
            result = runAttempts(stage, stageExecution, execution, handle, sessionId, maxAttempts, timeoutMillis);
        } catch (RuntimeException e) {
            log.error("阶段执行异常: {}, executionId: {}, error: {}", stageId, executionId, e.getMessage(), e);
            FailureInfo failure = FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stageId);
            result = failStage(stage, stageExecution, execution, failure);
        } finally {
            closeQuietly(sessionId);
        }
        result.setDuration(stageExecution.getDurationMillis() != null
                ? Duration.ofMillis(stageExecution.getDurationMillis()) : Duration.ZERO);
        metrics.recordDuration("pipeline_stage_duration", result.getDuration().toMillis());
        return result;
    }

    private StageResult runAttempts(StageDefinition stage, StageExecution stageExecution,
                                    PipelineExecution execution, ExecutionHandle handle,
                                    String sessionId, int maxAttempts, long timeoutMillis) {
        String stageId = stage.getId();
        String executionId = execution.getId();
        FailureInfo lastFailure = null;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (handle.isCancelRequested()) {
                return cancelStage(stage, stageExecution, execution);
            }
            if (attempt > 1 && deadline - System.nanoTime() <= 0) {
                log.warn("阶段超时预算已耗尽，停止重试: {}, executionId: {}", stageId, executionId);
                lastFailure = timeout(stage, timeoutMillis).getFailureInfo();
                break;
            }
            stageExecution.nextAttempt();
            if (attempt > 1) {
                log.info("阶段重试 ({}/{}): {}, executionId: {}", attempt - 1, maxAttempts - 1, stageId, executionId);
                execution.addLog(LogLevel.WARN, stage.getName(),
                        String.format("阶段重试 (%d/%d)", attempt - 1, maxAttempts - 1));
                eventPublisher.publish(new StageRetryingEvent(executionId, stageExecution, attempt - 1, maxAttempts - 1));
                metrics.incrementCounter("pipeline_stage_retried");
            }

            try {
                runCommands(stage, stageExecution, handle, sessionId, deadline, timeoutMillis);
                return succeedStage(stage, stageExecution, execution);
            } catch (StageExecutionException e) {
                lastFailure = e.getFailureInfo();
                if (e.getExitCode() != null) {
                    stageExecution.recordExitCode(e.getExitCode());
                }
                log.warn("阶段尝试失败 ({}/{}): {}, executionId: {}, error: {}",
                        attempt, maxAttempts, stageId, executionId, e.getMessage());
                execution.addLog(LogLevel.WARN, stage.getName(), "尝试失败: " + e.getMessage());
            } catch (CancellationException e) {
                return cancelStage(stage, stageExecution, execution);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelStage(stage, stageExecution, execution);
            }
        }
        return failStage(stage, stageExecution, execution, lastFailure);
    }

    /**
     * 顺序执行一次尝试中的全部命令，deadline 为整个阶段的截止时刻（System.nanoTime）
     */
    private void runCommands(StageDefinition stage, StageExecution stageExecution, ExecutionHandle handle,
                             String sessionId, long deadline, long timeoutMillis) throws InterruptedException {
        for (String command : stage.getCommands()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw timeout(stage, timeoutMillis);
            }
            Future<CommandResult> future = commandPool.submit(() -> commandExecutor.execute(sessionId, command));
            handle.attach(future);
            CommandResult commandResult;
            try {
                commandResult = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw timeout(stage, timeoutMillis);
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof InterruptedException && handle.isCancelRequested()) {
                    throw new CancellationException("命令已取消");
                }
                throw new StageExecutionException(ErrorType.STAGE_EXECUTION_FAILURE, stage.getId(),
                        "命令执行异常: " + command + ", " + cause.getMessage(), cause);
            } finally {
                handle.detach();
            }

            stageExecution.appendOutput(commandResult.getOutput());
            if (!commandResult.isSuccess()) {
                stageExecution.appendError(commandResult.getError());
                throw new StageExecutionException(ErrorType.STAGE_EXECUTION_FAILURE, stage.getId(),
                        String.format("命令执行失败: %s, exitCode: %s", command, commandResult.getExitCode()),
                        commandResult.getExitCode());
            }
            stageExecution.recordExitCode(commandResult.getExitCode());
            if (handle.isCancelRequested()) {
                throw new CancellationException("执行已取消");
            }
        }
    }

    private StageExecutionException timeout(StageDefinition stage, long timeoutMillis) {
        return new StageExecutionException(ErrorType.TIMEOUT_ERROR, stage.getId(),
                "阶段执行超时: " + stage.getId() + ", timeout(ms): " + timeoutMillis, (Integer) null);
    }

    private StageResult succeedStage(StageDefinition stage, StageExecution stageExecution, PipelineExecution execution) {
        List<GeneratedArtifact> artifacts = artifactCollector.collect(
                stage.getId(), stage.getWorkingDirectory(), stage.getArtifacts());
        for (GeneratedArtifact artifact : artifacts) {
            execution.addArtifact(artifact);
            stageExecution.addArtifact(artifact.getName());
        }
        stageExecution.succeed();
        execution.addLog(LogLevel.INFO, stage.getName(), "阶段执行成功");
        eventPublisher.publish(new StageCompletedEvent(execution.getId(), stageExecution));
        log.info("阶段执行成功: {}, 耗时: {}ms, executionId: {}",
                stage.getId(), stageExecution.getDurationMillis(), execution.getId());
        return StageResult.success(stage.getId(), stageExecution.getAttempts());
    }

    private StageResult failStage(StageDefinition stage, StageExecution stageExecution,
                                  PipelineExecution execution, FailureInfo failure) {
        stageExecution.appendError(failure.getErrorMessage());
        stageExecution.fail();
        execution.addLog(LogLevel.ERROR, stage.getName(), "阶段执行失败: " + failure.getErrorMessage());
        eventPublisher.publish(new StageFailedEvent(execution.getId(), stageExecution, failure, stage.isContinueOnFailure()));
        if (stage.isContinueOnFailure()) {
            log.warn("阶段执行失败，继续执行后续阶段: {}, executionId: {}, error: {}",
                    stage.getId(), execution.getId(), failure.getErrorMessage());
        } else {
            log.error("阶段执行失败: {}, executionId: {}, error: {}",
                    stage.getId(), execution.getId(), failure.getErrorMessage());
        }
        return StageResult.failure(stage.getId(), failure, stageExecution.getAttempts());
    }

    private StageResult cancelStage(StageDefinition stage, StageExecution stageExecution, PipelineExecution execution) {
        stageExecution.cancel();
        execution.addLog(LogLevel.WARN, stage.getName(), "阶段已取消");
        log.info("阶段已取消: {}, executionId: {}", stage.getId(), execution.getId());
        return StageResult.cancelled(stage.getId(), stageExecution.getAttempts());
    }

    private void closeQuietly(String sessionId) {
        if (sessionId == null) {
            return;
        }
        try {
            commandExecutor.closeSession(sessionId);
        } catch (RuntimeException e) {
            log.warn("关闭命令会话失败, sessionId: {}, error: {}", sessionId, e.getMessage());
        }
    }

    private static Map<String, String> mergeEnvironment(Map<String, String> pipelineEnv, Map<String, String> stageEnv) {
        Map<String, String> merged = new HashMap<>(pipelineEnv);
        merged.putAll(stageEnv);
        return merged;
    }
}
