package xyz.firestige.pipeline.domain.target;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * 部署目标
 */
public class DeploymentTarget {

    private String id;

    @NotBlank
    private String name;

    @NotNull
    private PlatformType platform = PlatformType.CUSTOM;

    /**
     * 平台相关配置（token、bucket、host 等），由部署后端解释
     */
    private Map<String, String> configuration = new HashMap<>();

    @NotNull
    private TargetEnvironment environment = TargetEnvironment.DEVELOPMENT;
    private String url;

    @Valid
    private HealthCheckConfig healthCheck;

    @Valid
    private RollbackConfig rollback;
    private boolean enabled = true;

    public DeploymentTarget() {
    }

    public DeploymentTarget copy() {
        DeploymentTarget c = new DeploymentTarget();
        c.id = id;
        c.name = name;
        c.platform = platform;
        c.configuration = new HashMap<>(configuration);
        c.environment = environment;
        c.url = url;
        c.healthCheck = healthCheck != null ? healthCheck.copy() : null;
        c.rollback = rollback != null ? rollback.copy() : null;
        c.enabled = enabled;
        return c;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public PlatformType getPlatform() { return platform; }
    public void setPlatform(PlatformType platform) { this.platform = platform; }
    public Map<String, String> getConfiguration() { return configuration; }
    public void setConfiguration(Map<String, String> configuration) { this.configuration = configuration != null ? configuration : new HashMap<>(); }
    public TargetEnvironment getEnvironment() { return environment; }
    public void setEnvironment(TargetEnvironment environment) { this.environment = environment; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }
    public RollbackConfig getRollback() { return rollback; }
    public void setRollback(RollbackConfig rollback) { this.rollback = rollback; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public String toString() {
        return "DeploymentTarget{id='" + id + "', name='" + name + "', platform=" + platform
                + ", environment=" + environment + ", enabled=" + enabled + '}';
    }

    public static class Builder {
        private final DeploymentTarget target = new DeploymentTarget();

        private Builder(String name) {
            target.name = name;
        }

        public Builder id(String id) { target.id = id; return this; }
        public Builder platform(PlatformType platform) { target.platform = platform; return this; }
        public Builder config(String key, String value) { target.configuration.put(key, value); return this; }
        public Builder environment(TargetEnvironment environment) { target.environment = environment; return this; }
        public Builder url(String url) { target.url = url; return this; }
        public Builder healthCheck(HealthCheckConfig healthCheck) { target.healthCheck = healthCheck; return this; }
        public Builder rollback(RollbackConfig rollback) { target.rollback = rollback; return this; }
        public Builder enabled(boolean enabled) { target.enabled = enabled; return this; }

        public DeploymentTarget build() {
            return target;
        }
    }
}
