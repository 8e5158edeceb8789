package xyz.firestige.pipeline.application.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.domain.execution.ExecutionNotFoundException;
import xyz.firestige.pipeline.domain.execution.ExecutionStatus;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.SkipReason;
import xyz.firestige.pipeline.domain.execution.StageExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.execution.event.ExecutionCompletedEvent;
import xyz.firestige.pipeline.domain.execution.event.ExecutionQueuedEvent;
import xyz.firestige.pipeline.domain.execution.event.ExecutionStartedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageCompletedEvent;
import xyz.firestige.pipeline.domain.execution.event.StageStartedEvent;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineDisabledException;
import xyz.firestige.pipeline.domain.pipeline.PipelineNotFoundException;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.testutil.RecordingNotificationChannel;
import xyz.firestige.pipeline.testutil.factory.EngineFixture;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.pipeline;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stage;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stageBuilder;

class PipelineExecutionServiceTest {

    private EngineFixture engine = new EngineFixture();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("立即返回唯一的执行 ID，不等待阶段执行")
    void executeReturnsImmediately() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        engine.commands().block("run-hang", started);
        String pipelineId = engine.register(pipeline("demo", stage("hang", 1)));

        String executionId = engine.executionService().executePipeline(pipelineId, "manual");

        assertThat(executionId).matches("exec-\\d+-[0-9a-z]{9}");
        PipelineExecution execution = engine.executionService().getExecution(executionId).orElseThrow();
        assertThat(execution.getStatus()).isIn(ExecutionStatus.QUEUED, ExecutionStatus.RUNNING);
        assertThat(engine.executionService().getActiveExecutionIds()).contains(executionId);

        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        engine.executionService().cancelExecution(executionId);
    }

    @Test
    void executionIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(PipelineExecutionService.generateExecutionId());
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    @DisplayName("按 order 顺序执行，全部成功后 SUCCESS")
    void runsStagesInOrder() throws Exception {
        String pipelineId = engine.register(pipeline("demo",
                stage("deploy", 3),
                stage("build", 1),
                stage("test", 2)));

        PipelineExecution execution = engine.runToCompletion(pipelineId);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(engine.commands().getExecuted()).containsExactly("run-build", "run-test", "run-deploy");
        assertThat(execution.getStages()).allMatch(s -> s.getStatus() == StageExecutionStatus.SUCCESS);
        assertThat(execution.getEndTime()).isNotNull();
        assertThat(execution.getDurationMillis()).isNotNull();
    }

    @Test
    @DisplayName("不可继续的阶段失败中止流水线，后续阶段保持 PENDING")
    void failureAbortsRemainingStages() throws Exception {
        engine.commands().fail("run-a", 1);
        String pipelineId = engine.register(pipeline("demo", stage("a", 1), stageBuilder("b", 2).dependsOn("a").build()));

        PipelineExecution execution = engine.runToCompletion(pipelineId);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(stageStatus(execution, "a")).isEqualTo(StageExecutionStatus.FAILURE);
        assertThat(stageStatus(execution, "b")).isEqualTo(StageExecutionStatus.PENDING);
        assertThat(execution.getFailureInfo().getErrorType()).isEqualTo(ErrorType.PIPELINE_ABORT);
        assertThat(engine.commands().invocations("run-b")).isZero();
    }

    @Test
    @DisplayName("continueOnFailure 的阶段失败后继续执行，最终 FAILURE")
    void continueOnFailureKeepsGoing() throws Exception {
        engine.commands().fail("run-lint", 1);
        String pipelineId = engine.register(pipeline("demo",
                stageBuilder("lint", 1).continueOnFailure(true).build(),
                stage("build", 2)));

        PipelineExecution execution = engine.runToCompletion(pipelineId);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(stageStatus(execution, "lint")).isEqualTo(StageExecutionStatus.FAILURE);
        assertThat(stageStatus(execution, "build")).isEqualTo(StageExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("条件不成立和依赖未满足的阶段被跳过，执行仍为 SUCCESS")
    void skippedStagesDoNotFailExecution() throws Exception {
        String pipelineId = engine.register(pipeline("demo",
                stage("build", 1),
                stageBuilder("publish", 2).condition("env['PUBLISH'] == 'true'").build(),
                stageBuilder("announce", 3).dependsOn("publish").build(),
                stageBuilder("report", 4).condition("stages['build'] == 'SUCCESS'").build()));

        PipelineExecution execution = engine.runToCompletion(pipelineId);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        StageExecution publish = execution.findStage("publish").orElseThrow();
        StageExecution announce = execution.findStage("announce").orElseThrow();
        assertThat(publish.getStatus()).isEqualTo(StageExecutionStatus.SKIPPED);
        assertThat(publish.getSkipReason()).isEqualTo(SkipReason.CONDITION_FALSE);
        assertThat(announce.getStatus()).isEqualTo(StageExecutionStatus.SKIPPED);
        assertThat(announce.getSkipReason()).isEqualTo(SkipReason.DEPENDENCY_UNMET);
        assertThat(stageStatus(execution, "report")).isEqualTo(StageExecutionStatus.SUCCESS);
        assertThat(engine.commands().getExecuted()).containsExactly("run-build", "run-report");
    }

    @Test
    @DisplayName("取消运行中的执行：立即 CANCELLED，重复取消为空操作")
    void cancelRunningExecution() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        engine.commands().block("run-hang", started);
        String pipelineId = engine.register(pipeline("demo", stage("hang", 1), stage("after", 2)));
        String executionId = engine.executionService().executePipeline(pipelineId, "manual");
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.executionService().cancelExecution(executionId)).isTrue();
        PipelineExecution cancelled = engine.executionService().getExecution(executionId).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(cancelled.getEndTime()).isAfter(cancelled.getStartTime());
        assertThat(engine.executionService().getActiveExecutionIds()).doesNotContain(executionId);
        assertThat(engine.executionService().cancelExecution(executionId)).isFalse();

        PipelineExecution execution = engine.executionService().awaitCompletion(executionId).get(5, TimeUnit.SECONDS);
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(stageStatus(execution, "hang")).isEqualTo(StageExecutionStatus.CANCELLED);
        assertThat(stageStatus(execution, "after")).isEqualTo(StageExecutionStatus.PENDING);
        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(engine.commands().getInterruptedCount()).isEqualTo(1));
        assertThat(notificationsFor(executionId))
                .containsExactly(NotificationEvent.START, NotificationEvent.CANCELLED);
    }

    @Test
    @DisplayName("排队期间取消：执行永不进入 RUNNING")
    void cancelWhileQueued() throws Exception {
        engine.close();
        engine = new EngineFixture(1, Duration.ofSeconds(10), 0);
        CountDownLatch started = new CountDownLatch(1);
        engine.commands().block("run-hang", started);
        String blockingId = engine.register(pipeline("blocking", stage("hang", 1)));
        String queuedPipelineId = engine.register(pipeline("queued", stage("work", 1)));

        String first = engine.executionService().executePipeline(blockingId, "manual");
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        String second = engine.executionService().executePipeline(queuedPipelineId, "manual");
        assertThat(engine.executionService().getExecution(second).orElseThrow().getStatus())
                .isEqualTo(ExecutionStatus.QUEUED);

        assertThat(engine.executionService().cancelExecution(second)).isTrue();
        engine.executionService().cancelExecution(first);

        PipelineExecution queued = engine.executionService().awaitCompletion(second).get(5, TimeUnit.SECONDS);
        assertThat(queued.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(queued.getEndTime()).isAfter(queued.getStartTime());
        assertThat(engine.commands().invocations("run-work")).isZero();
        assertThat(engine.events().getEventsOfType(ExecutionStartedEvent.class))
                .noneMatch(e -> e.getExecutionId().equals(second));
    }

    @Test
    @DisplayName("同一流水线的两次执行互不影响")
    void concurrentExecutionsAreIndependent() throws Exception {
        engine.commands().sleep("run-build", 100);
        String pipelineId = engine.register(pipeline("demo", stage("build", 1)));

        String first = engine.executionService().executePipeline(pipelineId, "manual");
        String second = engine.executionService().executePipeline(pipelineId, "webhook");

        assertThat(first).isNotEqualTo(second);
        PipelineExecution a = engine.executionService().awaitCompletion(first).get(5, TimeUnit.SECONDS);
        PipelineExecution b = engine.executionService().awaitCompletion(second).get(5, TimeUnit.SECONDS);
        assertThat(a.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(b.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(b.getTrigger()).isEqualTo("webhook");
        assertThat(a.getStages().get(0)).isNotSameAs(b.getStages().get(0));
        assertThat(engine.executionService().getExecutions(pipelineId)).hasSize(2);
    }

    @Test
    @DisplayName("事件与通知顺序：入队、开始、阶段、完成；终态通知只发送一次")
    void publishesLifecycleEventsAndNotifications() throws Exception {
        String pipelineId = engine.register(pipeline("demo", stage("build", 1)));

        PipelineExecution execution = engine.runToCompletion(pipelineId);

        assertThat(engine.events().getEventNames()).containsExactly(
                ExecutionQueuedEvent.class.getSimpleName(),
                ExecutionStartedEvent.class.getSimpleName(),
                StageStartedEvent.class.getSimpleName(),
                StageCompletedEvent.class.getSimpleName(),
                ExecutionCompletedEvent.class.getSimpleName());
        assertThat(notificationsFor(execution.getId()))
                .containsExactly(NotificationEvent.START, NotificationEvent.SUCCESS);
    }

    @Test
    void rejectsUnknownAndDisabledPipelines() {
        String pipelineId = engine.register(pipeline("demo", stage("build", 1)));
        engine.registry().setPipelineEnabled(pipelineId, false);

        assertThatThrownBy(() -> engine.executionService().executePipeline(pipelineId, "manual"))
                .isInstanceOf(PipelineDisabledException.class);
        assertThatThrownBy(() -> engine.executionService().executePipeline("missing", "manual"))
                .isInstanceOf(PipelineNotFoundException.class);
        assertThatThrownBy(() -> engine.executionService().awaitCompletion("exec-missing"))
                .isInstanceOf(ExecutionNotFoundException.class);
        assertThat(engine.executionService().cancelExecution("exec-missing")).isFalse();
    }

    @Test
    @DisplayName("执行快照：执行开始后修改流水线不影响本次执行")
    void executionUsesDefinitionSnapshot() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        engine.commands().block("run-gate", started);
        String pipelineId = engine.register(pipeline("demo", stage("gate", 1), stage("build", 2)));
        String executionId = engine.executionService().executePipeline(pipelineId, "manual");
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        Pipeline changed = pipeline("demo", stage("other", 1));
        engine.registry().updatePipeline(pipelineId, changed);
        engine.executionService().cancelExecution(executionId);

        PipelineExecution execution = engine.executionService().awaitCompletion(executionId).get(5, TimeUnit.SECONDS);
        assertThat(execution.getStages()).extracting(StageExecution::getStageId).containsExactly("gate", "build");
    }

    @Test
    @DisplayName("超出历史上限时淘汰最早的已结束执行")
    void evictsOldestTerminalExecutions() throws Exception {
        engine.close();
        engine = new EngineFixture(2, Duration.ofSeconds(10), 2);
        String pipelineId = engine.register(pipeline("demo", stage("build", 1)));

        String first = engine.runToCompletion(pipelineId).getId();
        String second = engine.runToCompletion(pipelineId).getId();
        String third = engine.runToCompletion(pipelineId).getId();

        List<String> kept = engine.executionService().getExecutions().stream()
                .map(PipelineExecution::getId)
                .collect(Collectors.toList());
        assertThat(kept).containsExactlyInAnyOrder(second, third).doesNotContain(first);
    }

    @Test
    void shutdownRejectsNewExecutions() {
        String pipelineId = engine.register(pipeline("demo", stage("build", 1)));
        engine.close();

        assertThatThrownBy(() -> engine.executionService().executePipeline(pipelineId, "manual"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(engine.executionService().getExecutions()).isEmpty();
        assertThat(engine.notifications().getSent()).isEmpty();
        assertThat(engine.events().getEventsOfType(ExecutionQueuedEvent.class)).isEmpty();
    }

    private List<NotificationEvent> notificationsFor(String executionId) {
        return engine.notifications().getSent().stream()
                .filter(s -> s.getMessage().contains(executionId))
                .map(RecordingNotificationChannel.Sent::getEvent)
                .collect(Collectors.toList());
    }

    private static StageExecutionStatus stageStatus(PipelineExecution execution, String stageId) {
        return execution.findStage(stageId).orElseThrow().getStatus();
    }
}
