package xyz.firestige.pipeline.infrastructure.persistence.store;

import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 内存存储（默认），进程退出即丢失
 */
public class InMemoryPipelineStore implements PipelineStore {

    private volatile List<Pipeline> pipelines = new ArrayList<>();
    private volatile List<DeploymentTarget> targets = new ArrayList<>();

    @Override
    public List<Pipeline> loadPipelines() {
        return pipelines.stream().map(Pipeline::copy).collect(Collectors.toList());
    }

    @Override
    public void savePipelines(List<Pipeline> pipelines) {
        this.pipelines = pipelines.stream().map(Pipeline::copy).collect(Collectors.toList());
    }

    @Override
    public List<DeploymentTarget> loadDeploymentTargets() {
        return targets.stream().map(DeploymentTarget::copy).collect(Collectors.toList());
    }

    @Override
    public void saveDeploymentTargets(List<DeploymentTarget> targets) {
        this.targets = targets.stream().map(DeploymentTarget::copy).collect(Collectors.toList());
    }
}
