package xyz.firestige.pipeline.config;

import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.pipeline.application.deploy.DeploymentManager;
import xyz.firestige.pipeline.application.execution.PipelineExecutionService;
import xyz.firestige.pipeline.application.notification.NotificationDispatcher;
import xyz.firestige.pipeline.application.registry.PipelineDefinitionValidator;
import xyz.firestige.pipeline.application.registry.PipelineRegistry;
import xyz.firestige.pipeline.application.template.PipelineTemplates;
import xyz.firestige.pipeline.config.properties.PipelineEngineProperties;
import xyz.firestige.pipeline.domain.execution.ExecutionRepository;
import xyz.firestige.pipeline.domain.pipeline.PipelineRepository;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.domain.target.DeploymentTargetRepository;
import xyz.firestige.pipeline.facade.BuildPipelineFacade;
import xyz.firestige.pipeline.infrastructure.artifact.ArtifactCollector;
import xyz.firestige.pipeline.infrastructure.command.CommandExecutor;
import xyz.firestige.pipeline.infrastructure.command.ProcessCommandExecutor;
import xyz.firestige.pipeline.infrastructure.condition.ConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.condition.SpelConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.deploy.DeploymentBackend;
import xyz.firestige.pipeline.infrastructure.deploy.HttpDeploymentBackend;
import xyz.firestige.pipeline.infrastructure.execution.ActiveExecutionRegistry;
import xyz.firestige.pipeline.infrastructure.execution.ExecutionDependencies;
import xyz.firestige.pipeline.infrastructure.execution.PipelineExecutorFactory;
import xyz.firestige.pipeline.infrastructure.execution.StageRunner;
import xyz.firestige.pipeline.infrastructure.execution.StageScheduler;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.pipeline.infrastructure.notification.LoggingNotificationChannel;
import xyz.firestige.pipeline.infrastructure.notification.NotificationChannel;
import xyz.firestige.pipeline.infrastructure.notification.WebhookNotificationChannel;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 流水线引擎配置类
 * <p>
 * 装配顺序：基础设施 → 执行循环依赖 → 应用服务 → Facade
 */
@Configuration
@EnableConfigurationProperties(PipelineEngineProperties.class)
public class PipelineEngineConfiguration {

    // ========== 基础设施 Bean ==========

    @Bean
    @ConditionalOnMissingBean
    public CommandExecutor commandExecutor(@Qualifier("pipelineStreamPool") ExecutorService pipelineStreamPool) {
        return new ProcessCommandExecutor(pipelineStreamPool);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator() {
        return new SpelConditionEvaluator();
    }

    @Bean
    public StageScheduler stageScheduler() {
        return new StageScheduler();
    }

    @Bean
    public ArtifactCollector artifactCollector(PipelineEngineProperties properties) {
        return new ArtifactCollector(properties.getWorkspaceRoot());
    }

    @Bean
    public ActiveExecutionRegistry activeExecutionRegistry() {
        return new ActiveExecutionRegistry();
    }

    /**
     * 命令线程池：每条命令一个任务，数量随运行中的阶段伸缩
     */
    @Bean(name = "pipelineCommandPool")
    public ExecutorService pipelineCommandPool() {
        return Executors.newCachedThreadPool(namedThreadFactory("pipeline-command-"));
    }

    /**
     * 进程输出读取线程池：每个运行中的进程占用两个线程，不能设上限
     */
    @Bean(name = "pipelineStreamPool")
    public ExecutorService pipelineStreamPool() {
        return Executors.newCachedThreadPool(namedThreadFactory("pipeline-stream-"));
    }

    /**
     * 引擎线程池：每个执行占用一个线程，大小即最大并发执行数
     */
    @Bean(name = "pipelineEnginePool")
    public ExecutorService pipelineEnginePool(PipelineEngineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrency()),
                namedThreadFactory("pipeline-engine-"));
    }

    // ========== 通知 ==========

    @Bean
    public NotificationChannel loggingNotificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean
    public NotificationChannel webhookNotificationChannel(
            @Qualifier("notificationRestTemplate") RestTemplate notificationRestTemplate) {
        return new WebhookNotificationChannel(notificationRestTemplate);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(List<NotificationChannel> channels) {
        return new NotificationDispatcher(channels);
    }

    // ========== 部署 ==========

    /**
     * 健康检查按每个目标的 timeout 构建 RestTemplate
     */
    @Bean
    @ConditionalOnMissingBean
    public DeploymentBackend deploymentBackend(ObjectProvider<RestTemplateBuilder> restTemplateBuilderProvider) {
        return new HttpDeploymentBackend(restTemplateBuilderProvider.getIfAvailable(RestTemplateBuilder::new));
    }

    // ========== 执行循环 ==========

    @Bean
    public StageRunner stageRunner(CommandExecutor commandExecutor,
                                   @Qualifier("pipelineCommandPool") ExecutorService pipelineCommandPool,
                                   ArtifactCollector artifactCollector,
                                   DomainEventPublisher domainEventPublisher,
                                   MetricsRegistry metricsRegistry,
                                   PipelineEngineProperties properties) {
        return new StageRunner(
                commandExecutor,
                pipelineCommandPool,
                artifactCollector,
                domainEventPublisher,
                metricsRegistry,
                properties.getDefaultStageTimeout()
        );
    }

    @Bean
    public ExecutionDependencies executionDependencies(StageRunner stageRunner,
                                                       StageScheduler stageScheduler,
                                                       ConditionEvaluator conditionEvaluator,
                                                       NotificationDispatcher notificationDispatcher,
                                                       DomainEventPublisher domainEventPublisher,
                                                       ActiveExecutionRegistry activeExecutionRegistry,
                                                       MetricsRegistry metricsRegistry) {
        return new ExecutionDependencies(
                stageRunner,
                stageScheduler,
                conditionEvaluator,
                notificationDispatcher,
                domainEventPublisher,
                activeExecutionRegistry,
                metricsRegistry
        );
    }

    @Bean
    public PipelineExecutorFactory pipelineExecutorFactory(ExecutionDependencies executionDependencies) {
        return new PipelineExecutorFactory(executionDependencies);
    }

    // ========== Application Service Bean ==========

    @Bean(initMethod = "load")
    public PipelineRegistry pipelineRegistry(PipelineRepository pipelineRepository,
                                             DeploymentTargetRepository deploymentTargetRepository,
                                             PipelineStore pipelineStore,
                                             PipelineDefinitionValidator pipelineDefinitionValidator) {
        return new PipelineRegistry(
                pipelineRepository,
                deploymentTargetRepository,
                pipelineStore,
                pipelineDefinitionValidator
        );
    }

    @Bean(destroyMethod = "shutdown")
    public PipelineExecutionService pipelineExecutionService(
            PipelineRegistry pipelineRegistry,
            ExecutionRepository executionRepository,
            PipelineExecutorFactory pipelineExecutorFactory,
            @Qualifier("pipelineEnginePool") ExecutorService pipelineEnginePool,
            @Qualifier("pipelineCommandPool") ExecutorService pipelineCommandPool,
            PipelineEngineProperties properties) {
        return new PipelineExecutionService(
                pipelineRegistry,
                executionRepository,
                pipelineExecutorFactory,
                pipelineEnginePool,
                pipelineCommandPool,
                properties.getExecutionHistoryLimit()
        );
    }

    @Bean
    public DeploymentManager deploymentManager(PipelineRegistry pipelineRegistry,
                                               DeploymentBackend deploymentBackend,
                                               DomainEventPublisher domainEventPublisher,
                                               MetricsRegistry metricsRegistry) {
        return new DeploymentManager(pipelineRegistry, deploymentBackend, domainEventPublisher, metricsRegistry);
    }

    @Bean
    public PipelineTemplates pipelineTemplates() {
        return new PipelineTemplates();
    }

    // ========== Facade Bean ==========

    @Bean
    public BuildPipelineFacade buildPipelineFacade(PipelineRegistry pipelineRegistry,
                                                   PipelineExecutionService pipelineExecutionService,
                                                   DeploymentManager deploymentManager,
                                                   PipelineTemplates pipelineTemplates,
                                                   Validator validator,
                                                   PipelineEngineProperties properties) {
        return new BuildPipelineFacade(
                pipelineRegistry,
                pipelineExecutionService,
                deploymentManager,
                pipelineTemplates,
                validator,
                properties.getWorkspaceRoot()
        );
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
