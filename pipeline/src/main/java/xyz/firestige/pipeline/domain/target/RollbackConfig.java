package xyz.firestige.pipeline.domain.target;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * 回滚配置
 */
public class RollbackConfig {

    private boolean enabled = true;

    @NotNull
    private RollbackStrategy strategy = RollbackStrategy.AUTOMATIC;

    /**
     * 描述性的回滚条件，仅存档
     */
    private List<String> conditions = new ArrayList<>();

    @Min(1)
    private int maxAttempts = 1;

    public RollbackConfig() {
    }

    public RollbackConfig(boolean enabled, RollbackStrategy strategy, int maxAttempts) {
        this.enabled = enabled;
        this.strategy = strategy;
        this.maxAttempts = maxAttempts;
    }

    public static RollbackConfig automatic(int maxAttempts) {
        return new RollbackConfig(true, RollbackStrategy.AUTOMATIC, maxAttempts);
    }

    public RollbackConfig copy() {
        RollbackConfig c = new RollbackConfig(enabled, strategy, maxAttempts);
        c.conditions = new ArrayList<>(conditions);
        return c;
    }

    public boolean shouldRollbackAutomatically() {
        return enabled && strategy == RollbackStrategy.AUTOMATIC;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public RollbackStrategy getStrategy() { return strategy; }
    public void setStrategy(RollbackStrategy strategy) { this.strategy = strategy; }
    public List<String> getConditions() { return conditions; }
    public void setConditions(List<String> conditions) { this.conditions = conditions != null ? conditions : new ArrayList<>(); }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
}
