package xyz.firestige.pipeline.infrastructure.deploy;

import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.HealthCheckMethod;

/**
 * 部署后端：平台相关的部署、探活与回滚
 */
public interface DeploymentBackend {

    /**
     * 部署产物到目标，失败时抛出异常
     */
    void deploy(DeploymentTarget target, String artifactPath);

    /**
     * 单次健康探测
     *
     * @return HTTP 状态码；网络不可达等情况抛出异常
     */
    int checkHealth(String url, HealthCheckMethod method, long timeoutMillis);

    void rollback(DeploymentTarget target);
}
