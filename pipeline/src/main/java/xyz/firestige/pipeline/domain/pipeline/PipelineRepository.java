package xyz.firestige.pipeline.domain.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * 流水线定义仓储（内存索引）
 */
public interface PipelineRepository {

    void save(Pipeline pipeline);

    Optional<Pipeline> findById(String pipelineId);

    List<Pipeline> findAll();

    boolean exists(String pipelineId);

    void remove(String pipelineId);
}
