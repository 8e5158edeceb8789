package xyz.firestige.pipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 定义存储配置属性
 * <p>
 * 支持配置：
 * - 存储类型（memory/file/redis）
 * - JSON 文件路径
 * - Redis Key 前缀
 */
@ConfigurationProperties(prefix = "pipeline.persistence")
public class PipelinePersistenceProperties {

    /**
     * 存储类型
     */
    private StoreType storeType = StoreType.memory;

    /**
     * file 模式下的 JSON 文件路径
     */
    private String file = "pipelines.json";

    /**
     * Redis Key 命名空间前缀
     */
    private String namespace = "pipeline:";

    public enum StoreType {
        /**
         * 内存存储（默认，重启后丢失）
         */
        memory,

        /**
         * 单个 JSON 文件
         */
        file,

        /**
         * Redis 存储
         */
        redis
    }

    // Getters and Setters

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }
}
