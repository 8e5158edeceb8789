package xyz.firestige.pipeline.infrastructure.persistence.target;

import xyz.firestige.pipeline.domain.target.DeploymentTarget;
import xyz.firestige.pipeline.domain.target.DeploymentTargetRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeploymentTargetRepository implements DeploymentTargetRepository {

    private final Map<String, DeploymentTarget> targets = new ConcurrentHashMap<>();

    @Override
    public void save(DeploymentTarget target) {
        if (target == null || target.getId() == null) {
            throw new IllegalArgumentException("DeploymentTarget or targetId cannot be null");
        }
        targets.put(target.getId(), target);
    }

    @Override
    public Optional<DeploymentTarget> findById(String targetId) {
        return Optional.ofNullable(targets.get(targetId));
    }

    @Override
    public List<DeploymentTarget> findAll() {
        return new ArrayList<>(targets.values());
    }

    @Override
    public boolean exists(String targetId) {
        return targets.containsKey(targetId);
    }

    @Override
    public void remove(String targetId) {
        targets.remove(targetId);
    }
}
