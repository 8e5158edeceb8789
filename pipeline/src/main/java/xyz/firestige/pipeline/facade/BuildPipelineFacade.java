package xyz.firestige.pipeline.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.application.deploy.DeploymentManager;
import xyz.firestige.pipeline.application.deploy.DeploymentResult;
import xyz.firestige.pipeline.application.execution.PipelineExecutionService;
import xyz.firestige.pipeline.application.registry.PipelineRegistry;
import xyz.firestige.pipeline.application.template.PipelineTemplates;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 构建流水线 Facade
 * <p>
 * 职责（纯胶水层）：
 * 1. 参数校验（Jakarta Bean Validation，快速失败）
 * 2. 委派给应用层服务（PipelineRegistry, PipelineExecutionService, DeploymentManager）
 * <p>
 * 业务异常（PipelineEngineException 子类）原样抛出；字段格式错误转换为 IllegalArgumentException
 */
public class BuildPipelineFacade {

    private static final Logger logger = LoggerFactory.getLogger(BuildPipelineFacade.class);

    public static final String DEFAULT_TRIGGER = "manual";

    private final PipelineRegistry registry;
    private final PipelineExecutionService executionService;
    private final DeploymentManager deploymentManager;
    private final PipelineTemplates templates;
    private final Validator validator;
    private final Path workspaceRoot;

    public BuildPipelineFacade(PipelineRegistry registry,
                               PipelineExecutionService executionService,
                               DeploymentManager deploymentManager,
                               PipelineTemplates templates,
                               Validator validator,
                               String workspaceRoot) {
        this.registry = registry;
        this.executionService = executionService;
        this.deploymentManager = deploymentManager;
        this.templates = templates;
        this.validator = validator;
        this.workspaceRoot = Paths.get(workspaceRoot != null ? workspaceRoot : ".");
    }

    // ========== 流水线定义 ==========

    public String createPipeline(Pipeline definition) {
        checkFormat(definition, "Pipeline");
        String pipelineId = registry.createPipeline(definition);
        logger.info("[Facade] 流水线创建成功, pipelineId: {}", pipelineId);
        return pipelineId;
    }

    public void updatePipeline(String pipelineId, Pipeline definition) {
        requireId(pipelineId, "pipelineId");
        checkFormat(definition, "Pipeline");
        registry.updatePipeline(pipelineId, definition);
    }

    public void deletePipeline(String pipelineId) {
        requireId(pipelineId, "pipelineId");
        registry.deletePipeline(pipelineId);
    }

    public void setPipelineEnabled(String pipelineId, boolean enabled) {
        requireId(pipelineId, "pipelineId");
        registry.setPipelineEnabled(pipelineId, enabled);
    }

    public List<Pipeline> getPipelines() {
        return registry.listPipelines();
    }

    public Optional<Pipeline> getPipeline(String pipelineId) {
        return registry.getPipeline(pipelineId);
    }

    // ========== 执行 ==========

    public String executePipeline(String pipelineId) {
        return executePipeline(pipelineId, DEFAULT_TRIGGER);
    }

    public String executePipeline(String pipelineId, String trigger) {
        requireId(pipelineId, "pipelineId");
        String effectiveTrigger = trigger == null || trigger.isBlank() ? DEFAULT_TRIGGER : trigger;
        return executionService.executePipeline(pipelineId, effectiveTrigger);
    }

    public boolean cancelExecution(String executionId) {
        requireId(executionId, "executionId");
        return executionService.cancelExecution(executionId);
    }

    /**
     * @param pipelineId 为 null 时返回全部执行
     */
    public List<PipelineExecution> getExecutions(String pipelineId) {
        return pipelineId == null ? executionService.getExecutions() : executionService.getExecutions(pipelineId);
    }

    public Optional<PipelineExecution> getExecution(String executionId) {
        return executionService.getExecution(executionId);
    }

    public CompletableFuture<PipelineExecution> awaitCompletion(String executionId) {
        requireId(executionId, "executionId");
        return executionService.awaitCompletion(executionId);
    }

    public Set<String> getActiveExecutionIds() {
        return executionService.getActiveExecutionIds();
    }

    // ========== 部署 ==========

    public String createDeploymentTarget(DeploymentTarget definition) {
        checkFormat(definition, "DeploymentTarget");
        return registry.createDeploymentTarget(definition);
    }

    public List<DeploymentTarget> getDeploymentTargets() {
        return registry.listDeploymentTargets();
    }

    public Optional<DeploymentTarget> getDeploymentTarget(String targetId) {
        return registry.getDeploymentTarget(targetId);
    }

    public void deleteDeploymentTarget(String targetId) {
        requireId(targetId, "targetId");
        registry.deleteDeploymentTarget(targetId);
    }

    public DeploymentResult deployToTarget(String targetId, String artifactPath) {
        requireId(targetId, "targetId");
        return deploymentManager.deployToTarget(targetId, artifactPath);
    }

    // ========== 模板 ==========

    /**
     * 按 NPM 模板创建并执行流水线；工作区根目录下必须存在 package.json
     *
     * @return 执行 ID
     */
    public String buildNpmProject(String command, String environment) {
        if (!Files.isRegularFile(workspaceRoot.resolve("package.json"))) {
            throw new IllegalStateException("未找到 package.json 文件: " + workspaceRoot.toAbsolutePath());
        }
        String pipelineId = createPipeline(templates.npmPipeline(command, environment));
        return executePipeline(pipelineId, DEFAULT_TRIGGER);
    }

    /**
     * 按 Android 模板创建并执行流水线
     *
     * @return 执行 ID
     */
    public String buildAndroidProject(String buildType, List<String> tasks) {
        String pipelineId = createPipeline(templates.androidPipeline(buildType, tasks));
        return executePipeline(pipelineId, DEFAULT_TRIGGER);
    }

    // ========== 辅助方法 ==========

    private <T> void checkFormat(T definition, String typeName) {
        if (definition == null) {
            throw new IllegalArgumentException(typeName + " 不能为空");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .sorted()
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] {} 格式校验失败: {}", typeName, errorDetail);
            throw new IllegalArgumentException(typeName + " 格式校验失败: " + errorDetail);
        }
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }
}
