package xyz.firestige.pipeline.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.pipeline.config.properties.PipelinePersistenceProperties;
import xyz.firestige.pipeline.domain.execution.ExecutionRepository;
import xyz.firestige.pipeline.domain.pipeline.PipelineRepository;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.target.DeploymentTargetRepository;
import xyz.firestige.pipeline.infrastructure.persistence.execution.InMemoryExecutionRepository;
import xyz.firestige.pipeline.infrastructure.persistence.pipeline.InMemoryPipelineRepository;
import xyz.firestige.pipeline.infrastructure.persistence.store.InMemoryPipelineStore;
import xyz.firestige.pipeline.infrastructure.persistence.store.JsonFilePipelineStore;
import xyz.firestige.pipeline.infrastructure.persistence.store.RedisPipelineStore;
import xyz.firestige.pipeline.infrastructure.persistence.target.InMemoryDeploymentTargetRepository;

import java.nio.file.Paths;

/**
 * 流水线持久化自动配置
 * <p>
 * 职责：
 * - 根据配置装配 Redis / JSON 文件 / 内存定义存储
 * - 提供内存仓储 Bean（注册表工作集与执行记录）
 * - 支持条件注入，允许用户自定义实现
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * pipeline:
 *   persistence:
 *     store-type: file  # memory / file / redis，默认 memory
 *     file: pipelines.json
 *     namespace: "pipeline:"  # Redis Key 前缀
 * </pre>
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(PipelinePersistenceProperties.class)
public class PipelinePersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PipelinePersistenceAutoConfiguration.class);

    // ========== Definition Store ==========

    /**
     * Redis 定义存储
     */
    @Bean
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnMissingBean(PipelineStore.class)
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "store-type", havingValue = "redis")
    public PipelineStore redisPipelineStore(StringRedisTemplate stringRedisTemplate,
                                            PipelinePersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 定义存储, namespace: {}", properties.getNamespace());
        return new RedisPipelineStore(stringRedisTemplate, properties.getNamespace());
    }

    /**
     * JSON 文件定义存储
     */
    @Bean
    @ConditionalOnMissingBean(PipelineStore.class)
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "store-type", havingValue = "file")
    public PipelineStore jsonFilePipelineStore(PipelinePersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 JSON 文件定义存储, file: {}", properties.getFile());
        return new JsonFilePipelineStore(Paths.get(properties.getFile()));
    }

    /**
     * 内存定义存储（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(PipelineStore.class)
    public PipelineStore inMemoryPipelineStore() {
        logger.warn("[AutoConfig] 装配 InMemory 定义存储（Fallback，重启后丢失）");
        return new InMemoryPipelineStore();
    }

    // ========== Repositories ==========

    @Bean
    @ConditionalOnMissingBean
    public PipelineRepository pipelineRepository() {
        return new InMemoryPipelineRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentTargetRepository deploymentTargetRepository() {
        return new InMemoryDeploymentTargetRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRepository executionRepository() {
        return new InMemoryExecutionRepository();
    }
}
