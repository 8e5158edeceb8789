package xyz.firestige.pipeline.application.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.application.registry.PipelineRegistry;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.PipelineEngineException;
import xyz.firestige.pipeline.domain.target.DeploymentFailureException;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.HealthCheckConfig;
import xyz.firestige.pipeline.domain.target.HealthCheckFailureException;
import xyz.firestige.pipeline.domain.target.RollbackConfig;
import xyz.firestige.pipeline.domain.target.RollbackFailureException;
import xyz.firestige.pipeline.domain.target.TargetDisabledException;
import xyz.firestige.pipeline.domain.target.TargetNotFoundException;
import xyz.firestige.pipeline.domain.target.event.DeploymentFailedEvent;
import xyz.firestige.pipeline.domain.target.event.DeploymentRolledBackEvent;
import xyz.firestige.pipeline.domain.target.event.DeploymentSucceededEvent;
import xyz.firestige.pipeline.infrastructure.deploy.DeploymentBackend;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 部署管理器
 * <p>
 * 同步执行：部署 → 健康检查（如已配置）→ 失败时按配置自动回滚。
 * 错误总是抛给调用方；自动回滚全部失败时，回滚异常作为 suppressed 附加在原始异常上。
 */
public class DeploymentManager {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentManager.class);

    private final PipelineRegistry registry;
    private final DeploymentBackend backend;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public DeploymentManager(PipelineRegistry registry,
                             DeploymentBackend backend,
                             DomainEventPublisher eventPublisher,
                             MetricsRegistry metrics) {
        this.registry = registry;
        this.backend = backend;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    public DeploymentResult deployToTarget(String targetId, String artifactPath) {
        DeploymentTarget target = registry.getDeploymentTarget(targetId)
                .orElseThrow(() -> new TargetNotFoundException(targetId));
        if (!target.isEnabled()) {
            throw new TargetDisabledException(targetId);
        }

        LocalDateTime startTime = LocalDateTime.now();
        logger.info("[DeploymentManager] 开始部署, targetId: {}, environment: {}, artifact: {}",
                targetId, target.getEnvironment(), artifactPath);
        try {
            backend.deploy(target, artifactPath);
            int healthAttempts = 0;
            if (target.getHealthCheck() != null) {
                healthAttempts = performHealthCheck(target, target.getHealthCheck());
            }

            Duration duration = Duration.between(startTime, LocalDateTime.now());
            eventPublisher.publish(new DeploymentSucceededEvent(target, artifactPath, healthAttempts));
            metrics.incrementCounter("deployment_succeeded");
            metrics.recordDuration("deployment_duration", duration.toMillis());
            logger.info("[DeploymentManager] 部署成功, targetId: {}, 耗时: {}ms", targetId, duration.toMillis());
            return new DeploymentResult(targetId, artifactPath, target.getUrl(), healthAttempts, startTime, duration);

        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            PipelineEngineException error = e instanceof PipelineEngineException
                    ? (PipelineEngineException) e
                    : new DeploymentFailureException(targetId, "部署失败: " + e.getMessage(), e);
            logger.error("[DeploymentManager] 部署失败, targetId: {}, error: {}", targetId, error.getMessage());
            FailureInfo failureInfo = error.getFailureInfo();
            eventPublisher.publish(new DeploymentFailedEvent(target, artifactPath, failureInfo));
            metrics.incrementCounter("deployment_failed");

            RollbackConfig rollback = target.getRollback();
            if (rollback != null && rollback.shouldRollbackAutomatically()) {
                performRollback(target, artifactPath, rollback, error);
            }
            throw error;
        }
    }

    /**
     * 健康检查：最多探测 retries 次，两次之间间隔 interval 毫秒
     *
     * @return 成功时的探测次数
     */
    private int performHealthCheck(DeploymentTarget target, HealthCheckConfig config) throws InterruptedException {
        int maxAttempts = Math.max(1, config.getRetries());
        Integer lastStatus = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                int status = backend.checkHealth(config.getUrl(), config.getMethod(), config.getTimeout());
                lastStatus = status;
                if (status == config.getExpectedStatus()) {
                    logger.info("[DeploymentManager] 健康检查通过 ({}/{}), targetId: {}", attempt, maxAttempts, target.getId());
                    return attempt;
                }
                logger.warn("[DeploymentManager] 健康检查状态码不符 ({}/{}), targetId: {}, expected: {}, actual: {}",
                        attempt, maxAttempts, target.getId(), config.getExpectedStatus(), status);
            } catch (RuntimeException e) {
                lastStatus = null;
                logger.warn("[DeploymentManager] 健康检查探测异常 ({}/{}), targetId: {}, error: {}",
                        attempt, maxAttempts, target.getId(), e.getMessage());
            }
            if (attempt < maxAttempts && config.getInterval() > 0) {
                Thread.sleep(config.getInterval());
            }
        }
        throw new HealthCheckFailureException(target.getId(), maxAttempts, lastStatus);
    }

    /**
     * 自动回滚：最多尝试 maxAttempts 次，首次成功即停止
     */
    private void performRollback(DeploymentTarget target, String artifactPath,
                                 RollbackConfig config, PipelineEngineException originalError) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                logger.info("[DeploymentManager] 自动回滚 ({}/{}), targetId: {}", attempt, maxAttempts, target.getId());
                backend.rollback(target);
                eventPublisher.publish(new DeploymentRolledBackEvent(target, artifactPath, attempt));
                metrics.incrementCounter("deployment_rolled_back");
                logger.info("[DeploymentManager] 回滚成功, targetId: {}", target.getId());
                return;
            } catch (RuntimeException e) {
                lastError = e;
                logger.warn("[DeploymentManager] 回滚失败 ({}/{}), targetId: {}, error: {}",
                        attempt, maxAttempts, target.getId(), e.getMessage());
            }
        }
        logger.error("[DeploymentManager] 回滚全部失败, targetId: {}", target.getId());
        originalError.addSuppressed(new RollbackFailureException(target.getId(), maxAttempts, lastError));
    }
}
