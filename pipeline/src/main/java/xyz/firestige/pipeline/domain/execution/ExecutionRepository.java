package xyz.firestige.pipeline.domain.execution;

import java.util.List;
import java.util.Optional;

/**
 * 执行记录仓储
 */
public interface ExecutionRepository {

    void save(PipelineExecution execution);

    Optional<PipelineExecution> findById(String executionId);

    /**
     * 按创建先后返回全部执行记录
     */
    List<PipelineExecution> findAll();

    List<PipelineExecution> findByPipelineId(String pipelineId);

    void remove(String executionId);
}
