package xyz.firestige.pipeline.infrastructure.persistence.execution;

import xyz.firestige.pipeline.domain.execution.ExecutionRepository;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 执行记录内存实现
 * <p>
 * 执行记录是运行时状态，不做持久化；按保存先后保留顺序
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, PipelineExecution> executions = new LinkedHashMap<>();

    @Override
    public synchronized void save(PipelineExecution execution) {
        if (execution == null || execution.getId() == null) {
            throw new IllegalArgumentException("Execution or executionId cannot be null");
        }
        executions.put(execution.getId(), execution);
    }

    @Override
    public synchronized Optional<PipelineExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public synchronized List<PipelineExecution> findAll() {
        return new ArrayList<>(executions.values());
    }

    @Override
    public synchronized List<PipelineExecution> findByPipelineId(String pipelineId) {
        return executions.values().stream()
                .filter(e -> e.getPipelineId().equals(pipelineId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void remove(String executionId) {
        executions.remove(executionId);
    }
}
