package xyz.firestige.pipeline.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import xyz.firestige.pipeline.domain.execution.ExecutionStatus;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.StageExecutionStatus;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.facade.BuildPipelineFacade;
import xyz.firestige.pipeline.infrastructure.command.CommandExecutor;
import xyz.firestige.pipeline.testutil.TestEventTracker;
import xyz.firestige.pipeline.testutil.command.ScriptedCommandExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.pipeline;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stage;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stageBuilder;

/**
 * 完整 Spring 上下文下的流水线执行集成测试
 * <p>
 * 命令执行器替换为脚本化实现，其余组件均为自动配置的默认实现
 */
@SpringBootTest
@ActiveProfiles("test")
class BuildPipelineIntegrationTest {

    @TestConfiguration
    static class ScriptedCommandConfiguration {

        @Bean
        CommandExecutor commandExecutor() {
            return new ScriptedCommandExecutor();
        }
    }

    @Autowired
    private BuildPipelineFacade facade;

    @Autowired
    private CommandExecutor commandExecutor;

    @Autowired
    private TestEventTracker eventTracker;

    private ScriptedCommandExecutor commands;

    @BeforeEach
    void setUp() {
        commands = (ScriptedCommandExecutor) commandExecutor;
        eventTracker.clear();
    }

    @Test
    @DisplayName("成功执行：事件经 Spring 事件总线按顺序发布")
    void successfulRunPublishesOrderedEvents() throws Exception {
        String pipelineId = facade.createPipeline(pipeline("integration-success",
                stage("compile", 1),
                stageBuilder("publish", 2).condition("trigger == 'release'").build()));

        String executionId = facade.executePipeline(pipelineId, "manual");
        PipelineExecution execution = facade.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(execution.findStage("publish").orElseThrow().getStatus()).isEqualTo(StageExecutionStatus.SKIPPED);
        assertThat(eventTracker.getEventNames(executionId)).containsExactly(
                "ExecutionQueuedEvent",
                "ExecutionStartedEvent",
                "StageStartedEvent",
                "StageCompletedEvent",
                "StageSkippedEvent",
                "ExecutionCompletedEvent");
        assertThat(facade.getExecution(executionId)).isPresent();
    }

    @Test
    @DisplayName("阶段失败：重试耗尽后中止执行")
    void failingStageAbortsAfterRetries() throws Exception {
        commands.fail("run-flaky", 2);
        String pipelineId = facade.createPipeline(pipeline("integration-failure",
                stageBuilder("flaky", 1).retryCount(1).build(),
                stage("never", 2)));

        String executionId = facade.executePipeline(pipelineId);
        PipelineExecution execution = facade.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(execution.findStage("flaky").orElseThrow().getAttempts()).isEqualTo(2);
        assertThat(execution.findStage("never").orElseThrow().getStatus()).isEqualTo(StageExecutionStatus.PENDING);
        assertThat(commands.invocations("run-flaky")).isEqualTo(2);
        assertThat(eventTracker.getEventNames(executionId))
                .contains("StageRetryingEvent", "StageFailedEvent")
                .endsWith("ExecutionFailedEvent");
    }

    @Test
    @DisplayName("取消：运行中的命令被中断，执行立即进入 CANCELLED")
    void cancelInterruptsRunningCommand() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        commands.block("run-long", started);
        String pipelineId = facade.createPipeline(pipeline("integration-cancel", stage("long", 1)));

        String executionId = facade.executePipeline(pipelineId);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(facade.cancelExecution(executionId)).isTrue();
        assertThat(facade.getActiveExecutionIds()).doesNotContain(executionId);

        PipelineExecution execution = facade.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(eventTracker.getEventNames(executionId)).endsWith("ExecutionCancelledEvent");
    }

    @Test
    void pipelineSurvivesRegistryRoundTrip() {
        Pipeline definition = pipeline("integration-crud", stage("compile", 1));
        String pipelineId = facade.createPipeline(definition);

        facade.setPipelineEnabled(pipelineId, false);
        assertThat(facade.getPipeline(pipelineId).orElseThrow().isEnabled()).isFalse();

        facade.deletePipeline(pipelineId);
        assertThat(facade.getPipeline(pipelineId)).isEmpty();
    }
}
