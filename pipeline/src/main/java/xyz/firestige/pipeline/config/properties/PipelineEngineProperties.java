package xyz.firestige.pipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 流水线引擎配置属性
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * pipeline:
 *   engine:
 *     max-concurrency: 4
 *     default-stage-timeout: 30m
 *     workspace-root: .
 *     execution-history-limit: 200
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline.engine")
public class PipelineEngineProperties {

    /**
     * 同时运行的执行数上限（引擎线程池大小）
     */
    private int maxConcurrency = 4;

    /**
     * 阶段未配置 timeout 时使用的阶段超时（含重试）
     */
    private Duration defaultStageTimeout = Duration.ofMinutes(30);

    /**
     * 工作区根目录：相对工作目录、产物模式和 package.json 检查都以此为基准
     */
    private String workspaceRoot = ".";

    /**
     * 内存中保留的执行记录上限，超出后淘汰最早的已结束执行；0 表示不限制
     */
    private int executionHistoryLimit = 200;

    /**
     * Webhook / Slack / Teams 通知的连接与读取超时
     */
    private Duration webhookTimeout = Duration.ofSeconds(5);

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getDefaultStageTimeout() {
        return defaultStageTimeout;
    }

    public void setDefaultStageTimeout(Duration defaultStageTimeout) {
        this.defaultStageTimeout = defaultStageTimeout;
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public int getExecutionHistoryLimit() {
        return executionHistoryLimit;
    }

    public void setExecutionHistoryLimit(int executionHistoryLimit) {
        this.executionHistoryLimit = executionHistoryLimit;
    }

    public Duration getWebhookTimeout() {
        return webhookTimeout;
    }

    public void setWebhookTimeout(Duration webhookTimeout) {
        this.webhookTimeout = webhookTimeout;
    }
}
