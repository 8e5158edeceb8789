package xyz.firestige.pipeline.infrastructure.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.pipeline.domain.execution.GeneratedArtifact;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.execution.event.StageCompletedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageFailedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageRetryingEvent;
import xyz.firestige.pipeline.domain.execution.event.StageStartedEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.infrastructure.artifact.ArtifactCollector;
import xyz.firestige.pipeline.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.pipeline.testutil.RecordingEventPublisher;
import xyz.firestige.pipeline.testutil.command.ScriptedCommandExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.pipeline;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stageBuilder;

class StageRunnerTest {

    @TempDir
    Path workspace;

    private final ScriptedCommandExecutor commands = new ScriptedCommandExecutor();
    private final RecordingEventPublisher events = new RecordingEventPublisher();
    private ExecutorService commandPool;
    private StageRunner runner;

    @BeforeEach
    void setUp() {
        commandPool = Executors.newCachedThreadPool();
        runner = new StageRunner(commands, commandPool, new ArtifactCollector(workspace.toString()),
                events, new NoopMetricsRegistry(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        commandPool.shutdownNow();
    }

    @Test
    @DisplayName("命令全部成功：阶段 SUCCESS，输出累积，会话关闭")
    void runsAllCommandsInOneSession() {
        StageDefinition stage = stageBuilder("build", 1)
                .commands("compile", "package")
                .env("PROFILE", "stage")
                .build();
        Pipeline p = pipeline("demo", stage);
        p.getEnvironment().put("PROFILE", "pipeline");
        p.getEnvironment().put("CI", "true");
        PipelineExecution execution = newExecution(p);

        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));

        StageExecution stageExecution = execution.findStage("build").orElseThrow();
        assertThat(result.isSuccess()).isTrue();
        assertThat(stageExecution.getStatus()).isEqualTo(StageExecutionStatus.SUCCESS);
        assertThat(stageExecution.getAttempts()).isEqualTo(1);
        assertThat(stageExecution.getExitCode()).isEqualTo(0);
        assertThat(stageExecution.getOutput()).contains("compile").contains("package");
        assertThat(commands.getExecuted()).containsExactly("compile", "package");
        assertThat(commands.getSessionEnvironments()).singleElement()
                .isEqualTo(Map.of("PROFILE", "stage", "CI", "true"));
        assertThat(commands.getOpenSessions()).isZero();
        assertThat(events.getEventsOfType(StageStartedEvent.class)).hasSize(1);
        assertThat(events.getEventsOfType(StageCompletedEvent.class)).hasSize(1);
    }

    @Test
    @DisplayName("失败后重试直到成功")
    void retriesUntilSuccess() {
        commands.failTimes("flaky", 2, 1);
        StageDefinition stage = stageBuilder("test", 1).commands("flaky").retryCount(2).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(commands.invocations("flaky")).isEqualTo(3);
        assertThat(events.getEventsOfType(StageRetryingEvent.class))
                .extracting(StageRetryingEvent::getAttempt)
                .containsExactly(1, 2);
    }

    @Test
    @DisplayName("重试耗尽：阶段 FAILURE，记录退出码")
    void failsAfterRetriesExhausted() {
        commands.fail("broken", 2);
        StageDefinition stage = stageBuilder("lint", 1).commands("broken", "never").retryCount(1).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));

        StageExecution stageExecution = execution.findStage("lint").orElseThrow();
        assertThat(result.isFailure()).isTrue();
        assertThat(result.getFailureInfo().getErrorType()).isEqualTo(ErrorType.STAGE_EXECUTION_FAILURE);
        assertThat(stageExecution.getStatus()).isEqualTo(StageExecutionStatus.FAILURE);
        assertThat(stageExecution.getAttempts()).isEqualTo(2);
        assertThat(stageExecution.getExitCode()).isEqualTo(2);
        assertThat(stageExecution.getError()).contains("failed: broken");
        assertThat(commands.invocations("never")).isZero();
        assertThat(events.getEventsOfType(StageFailedEvent.class)).hasSize(1);
    }

    @Test
    @DisplayName("阶段超时：中断命令并以 TIMEOUT_ERROR 失败")
    void timeoutInterruptsCommand() {
        commands.sleep("slow", 5_000);
        StageDefinition stage = stageBuilder("slow-stage", 1).commands("slow").timeout(200).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        long start = System.nanoTime();
        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getFailureInfo().getErrorType()).isEqualTo(ErrorType.TIMEOUT_ERROR);
        assertThat(elapsedMillis).isLessThan(3_000);
        await().atMost(Duration.ofSeconds(2)).until(() -> commands.getInterruptedCount() == 1);
    }

    @Test
    @DisplayName("超时约束整个阶段：预算耗尽后不再重试")
    void timeoutBoundsWholeStageIncludingRetries() {
        commands.sleep("slow", 5_000);
        StageDefinition stage = stageBuilder("slow-stage", 1).commands("slow").timeout(150).retryCount(3).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        long start = System.nanoTime();
        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getFailureInfo().getErrorType()).isEqualTo(ErrorType.TIMEOUT_ERROR);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(commands.invocations("slow")).isEqualTo(1);
        assertThat(events.getEventsOfType(StageRetryingEvent.class)).isEmpty();
        assertThat(elapsedMillis).isLessThan(3_000);
    }

    @Test
    @DisplayName("快速失败的尝试在预算内正常重试")
    void retriesWithinRemainingBudget() {
        commands.fail("flaky", 1);
        StageDefinition stage = stageBuilder("test", 1).commands("flaky").timeout(5_000).retryCount(2).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getFailureInfo().getErrorType()).isEqualTo(ErrorType.STAGE_EXECUTION_FAILURE);
        assertThat(commands.invocations("flaky")).isEqualTo(3);
    }

    @Test
    @DisplayName("取消中断正在执行的命令，阶段 CANCELLED")
    void cancelInterruptsInFlightCommand() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        commands.block("hang", started);
        StageDefinition stage = stageBuilder("deploy", 1).commands("hang").retryCount(3).build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));
        ExecutionHandle handle = new ExecutionHandle(execution.getId());

        CompletableFuture<StageResult> future = CompletableFuture.supplyAsync(() -> run(stage, execution, handle));
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        handle.requestCancel();

        StageResult result = future.get(3, TimeUnit.SECONDS);
        assertThat(result.isCancelled()).isTrue();
        assertThat(execution.findStage("deploy").orElseThrow().getStatus()).isEqualTo(StageExecutionStatus.CANCELLED);
        assertThat(commands.invocations("hang")).isEqualTo(1);
        assertThat(commands.getOpenSessions()).isZero();
    }

    @Test
    @DisplayName("成功后按 glob 收集产物")
    void collectsArtifactsOnSuccess() throws Exception {
        Files.createDirectories(workspace.resolve("dist"));
        Files.writeString(workspace.resolve("dist/app.js"), "console.log(1)");
        StageDefinition stage = stageBuilder("build", 1).artifacts("dist/**").build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        run(stage, execution, new ExecutionHandle(execution.getId()));

        assertThat(execution.getArtifacts()).singleElement()
                .satisfies(a -> {
                    assertThat(a.getStageId()).isEqualTo("build");
                    assertThat(a.getSize()).isEqualTo(14);
                });
        assertThat(execution.findStage("build").orElseThrow().getArtifacts()).hasSize(1);
    }

    @Test
    @DisplayName("产物模式无效不影响阶段结果")
    void invalidArtifactPatternDoesNotFailStage() throws Exception {
        Files.createDirectories(workspace.resolve("dist"));
        Files.writeString(workspace.resolve("dist/app.js"), "x");
        StageDefinition stage = stageBuilder("build", 1).commands("compile").artifacts("dist/[abc", "dist/*.js").build();
        PipelineExecution execution = newExecution(pipeline("demo", stage));

        StageResult result = run(stage, execution, new ExecutionHandle(execution.getId()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(execution.findStage("build").orElseThrow().getStatus()).isEqualTo(StageExecutionStatus.SUCCESS);
        assertThat(execution.getArtifacts()).extracting(GeneratedArtifact::getName).containsExactly("dist/app.js");
    }

    private StageResult run(StageDefinition stage, PipelineExecution execution, ExecutionHandle handle) {
        return runner.run(stage, execution.findStage(stage.getId()).orElseThrow(), execution, handle);
    }

    private static PipelineExecution newExecution(Pipeline p) {
        p.setId("demo-1");
        PipelineExecution execution = PipelineExecution.create("exec-test", p, "manual");
        execution.start();
        return execution;
    }
}
