package xyz.firestige.pipeline.domain.pipeline;

import xyz.firestige.pipeline.domain.target.DeploymentTarget;

import java.util.List;

/**
 * 定义持久化出口
 * <p>
 * 注册表启动时整体加载，每次变更后整体保存
 */
public interface PipelineStore {

    List<Pipeline> loadPipelines();

    void savePipelines(List<Pipeline> pipelines);

    List<DeploymentTarget> loadDeploymentTargets();

    void saveDeploymentTargets(List<DeploymentTarget> targets);
}
