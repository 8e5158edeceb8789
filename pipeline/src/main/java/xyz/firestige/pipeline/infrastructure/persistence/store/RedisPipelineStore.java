package xyz.firestige.pipeline.infrastructure.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Redis 存储：每个集合一个 key，值为 JSON 数组
 */
public class RedisPipelineStore implements PipelineStore {

    private static final String DEFAULT_NAMESPACE = "pipeline:";

    private final StringRedisTemplate redisTemplate;
    private final String pipelinesKey;
    private final String targetsKey;
    private final ObjectMapper mapper = PipelineStoreMapper.create();

    public RedisPipelineStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_NAMESPACE);
    }

    public RedisPipelineStore(StringRedisTemplate redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        String ns = Objects.requireNonNullElse(namespace, DEFAULT_NAMESPACE);
        this.pipelinesKey = ns + "definitions";
        this.targetsKey = ns + "targets";
    }

    @Override
    public List<Pipeline> loadPipelines() {
        return read(pipelinesKey, new TypeReference<List<Pipeline>>() { });
    }

    @Override
    public void savePipelines(List<Pipeline> pipelines) {
        write(pipelinesKey, pipelines);
    }

    @Override
    public List<DeploymentTarget> loadDeploymentTargets() {
        return read(targetsKey, new TypeReference<List<DeploymentTarget>>() { });
    }

    @Override
    public void saveDeploymentTargets(List<DeploymentTarget> targets) {
        write(targetsKey, targets);
    }

    private <T> List<T> read(String key, TypeReference<List<T>> type) {
        String data = redisTemplate.opsForValue().get(key);
        if (data == null || data.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return mapper.readValue(data, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize " + key, e);
        }
    }

    private void write(String key, List<?> values) {
        try {
            redisTemplate.opsForValue().set(key, mapper.writeValueAsString(values));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + key, e);
        }
    }

    public String getPipelinesKey() {
        return pipelinesKey;
    }

    public String getTargetsKey() {
        return targetsKey;
    }
}
