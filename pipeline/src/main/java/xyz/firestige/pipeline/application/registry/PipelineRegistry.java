package xyz.firestige.pipeline.application.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineNotFoundException;
import xyz.firestige.pipeline.domain.pipeline.PipelineRepository;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.DeploymentTargetRepository;
import xyz.firestige.pipeline.domain.target.TargetNotFoundException;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 流水线注册表
 * <p>
 * 职责：
 * 1. 流水线与部署目标定义的增删改查
 * 2. 注册时业务校验（PipelineDefinitionValidator）
 * 3. 每次变更后整体保存到 PipelineStore，启动时整体加载
 * <p>
 * 写操作在注册表上串行化；读操作返回深拷贝，调用方修改返回值不会影响注册表
 */
public class PipelineRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRegistry.class);

    private final PipelineRepository pipelineRepository;
    private final DeploymentTargetRepository targetRepository;
    private final PipelineStore store;
    private final PipelineDefinitionValidator validator;

    public PipelineRegistry(PipelineRepository pipelineRepository,
                            DeploymentTargetRepository targetRepository,
                            PipelineStore store,
                            PipelineDefinitionValidator validator) {
        this.pipelineRepository = pipelineRepository;
        this.targetRepository = targetRepository;
        this.store = store;
        this.validator = validator;
    }

    /**
     * 从存储加载全部定义
     */
    public synchronized void load() {
        List<Pipeline> pipelines = store.loadPipelines();
        pipelines.forEach(pipelineRepository::save);
        List<DeploymentTarget> targets = store.loadDeploymentTargets();
        targets.forEach(targetRepository::save);
        logger.info("[PipelineRegistry] 加载完成, pipelines: {}, deploymentTargets: {}", pipelines.size(), targets.size());
    }

    // ========== 流水线 ==========

    /**
     * 注册流水线
     *
     * @return 生成的流水线 ID
     */
    public synchronized String createPipeline(Pipeline definition) {
        validator.validate(definition);

        Pipeline pipeline = definition.copy();
        pipeline.setId(generateId(definition.getName(), pipelineRepository::exists));
        LocalDateTime now = LocalDateTime.now();
        pipeline.setCreatedAt(now);
        pipeline.setUpdatedAt(now);
        pipelineRepository.save(pipeline);
        persistPipelines(pipeline.getId(), null);

        logger.info("[PipelineRegistry] 流水线已创建: {}, stages: {}", pipeline.getId(), pipeline.getStages().size());
        return pipeline.getId();
    }

    /**
     * 更新流水线：保留 ID 和创建时间，其余内容整体替换
     */
    public synchronized void updatePipeline(String pipelineId, Pipeline definition) {
        Pipeline existing = pipelineRepository.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        validator.validate(definition);

        Pipeline updated = definition.copy();
        updated.setId(pipelineId);
        updated.setCreatedAt(existing.getCreatedAt());
        updated.setUpdatedAt(LocalDateTime.now());
        pipelineRepository.save(updated);
        persistPipelines(pipelineId, existing);

        logger.info("[PipelineRegistry] 流水线已更新: {}", pipelineId);
    }

    public synchronized void deletePipeline(String pipelineId) {
        Pipeline existing = pipelineRepository.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        pipelineRepository.remove(pipelineId);
        persistPipelines(pipelineId, existing);
        logger.info("[PipelineRegistry] 流水线已删除: {}", pipelineId);
    }

    public synchronized void setPipelineEnabled(String pipelineId, boolean enabled) {
        Pipeline existing = pipelineRepository.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        Pipeline updated = existing.copy();
        updated.setEnabled(enabled);
        updated.setUpdatedAt(LocalDateTime.now());
        pipelineRepository.save(updated);
        persistPipelines(pipelineId, existing);
        logger.info("[PipelineRegistry] 流水线{}: {}", enabled ? "已启用" : "已禁用", pipelineId);
    }

    public Optional<Pipeline> getPipeline(String pipelineId) {
        return pipelineRepository.findById(pipelineId).map(Pipeline::copy);
    }

    public List<Pipeline> listPipelines() {
        return pipelineRepository.findAll().stream()
                .sorted(Comparator.comparing(Pipeline::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(Pipeline::getId))
                .map(Pipeline::copy)
                .collect(Collectors.toList());
    }

    // ========== 部署目标 ==========

    /**
     * 注册部署目标；未指定 ID 时按名称生成
     */
    public synchronized String createDeploymentTarget(DeploymentTarget definition) {
        validator.validate(definition);

        DeploymentTarget target = definition.copy();
        if (target.getId() == null || target.getId().isBlank()) {
            target.setId(generateId(target.getName(), targetRepository::exists));
        }
        DeploymentTarget previous = targetRepository.findById(target.getId()).orElse(null);
        targetRepository.save(target);
        persistTargets(target.getId(), previous);

        logger.info("[PipelineRegistry] 部署目标已创建: {}, environment: {}", target.getId(), target.getEnvironment());
        return target.getId();
    }

    public Optional<DeploymentTarget> getDeploymentTarget(String targetId) {
        return targetRepository.findById(targetId).map(DeploymentTarget::copy);
    }

    public List<DeploymentTarget> listDeploymentTargets() {
        return targetRepository.findAll().stream()
                .sorted(Comparator.comparing(DeploymentTarget::getId))
                .map(DeploymentTarget::copy)
                .collect(Collectors.toList());
    }

    public synchronized void deleteDeploymentTarget(String targetId) {
        DeploymentTarget existing = targetRepository.findById(targetId)
                .orElseThrow(() -> new TargetNotFoundException(targetId));
        targetRepository.remove(targetId);
        persistTargets(targetId, existing);
        logger.info("[PipelineRegistry] 部署目标已删除: {}", targetId);
    }

    // ========== 辅助方法 ==========

    /**
     * 名称转 slug 后拼接毫秒时间戳；同一毫秒内重名时追加序号
     */
    static String generateId(String name, Predicate<String> exists) {
        String base = slug(name) + "-" + System.currentTimeMillis();
        String candidate = base;
        int counter = 2;
        while (exists.test(candidate)) {
            candidate = base + "-" + counter++;
        }
        return candidate;
    }

    static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    /**
     * 保存失败时把内存中的该条记录恢复为变更前的状态（previous 为 null 表示新增），再抛出原异常
     */
    private void persistPipelines(String pipelineId, Pipeline previous) {
        try {
            store.savePipelines(pipelineRepository.findAll());
        } catch (RuntimeException e) {
            if (previous != null) {
                pipelineRepository.save(previous);
            } else {
                pipelineRepository.remove(pipelineId);
            }
            logger.error("[PipelineRegistry] 流水线保存失败，已回退内存变更: {}", pipelineId, e);
            throw e;
        }
    }

    private void persistTargets(String targetId, DeploymentTarget previous) {
        try {
            store.saveDeploymentTargets(targetRepository.findAll());
        } catch (RuntimeException e) {
            if (previous != null) {
                targetRepository.save(previous);
            } else {
                targetRepository.remove(targetId);
            }
            logger.error("[PipelineRegistry] 部署目标保存失败，已回退内存变更: {}", targetId, e);
            throw e;
        }
    }
}
