package xyz.firestige.pipeline.domain.target;

import java.util.List;
import java.util.Optional;

/**
 * 部署目标仓储
 */
public interface DeploymentTargetRepository {

    void save(DeploymentTarget target);

    Optional<DeploymentTarget> findById(String targetId);

    List<DeploymentTarget> findAll();

    boolean exists(String targetId);

    void remove(String targetId);
}
