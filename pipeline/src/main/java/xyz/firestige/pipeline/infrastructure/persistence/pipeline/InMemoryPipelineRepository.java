package xyz.firestige.pipeline.infrastructure.persistence.pipeline;

import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 流水线定义内存索引
 * <p>
 * 持久化由 PipelineStore 负责，这里只是进程内的查询索引
 */
public class InMemoryPipelineRepository implements PipelineRepository {

    private final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();

    @Override
    public void save(Pipeline pipeline) {
        if (pipeline == null || pipeline.getId() == null) {
            throw new IllegalArgumentException("Pipeline or pipelineId cannot be null");
        }
        pipelines.put(pipeline.getId(), pipeline);
    }

    @Override
    public Optional<Pipeline> findById(String pipelineId) {
        return Optional.ofNullable(pipelines.get(pipelineId));
    }

    @Override
    public List<Pipeline> findAll() {
        return new ArrayList<>(pipelines.values());
    }

    @Override
    public boolean exists(String pipelineId) {
        return pipelines.containsKey(pipelineId);
    }

    @Override
    public void remove(String pipelineId) {
        pipelines.remove(pipelineId);
    }
}
