package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;

/**
 * 执行循环工厂
 */
public class PipelineExecutorFactory {

    private final ExecutionDependencies dependencies;

    public PipelineExecutorFactory(ExecutionDependencies dependencies) {
        this.dependencies = dependencies;
    }

    public PipelineExecutor create(Pipeline snapshot, PipelineExecution execution, ExecutionHandle handle) {
        return new PipelineExecutor(snapshot, execution, handle, dependencies);
    }

    public ExecutionDependencies getDependencies() {
        return dependencies;
    }
}
