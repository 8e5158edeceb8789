package xyz.firestige.pipeline.domain.pipeline;

import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * 触发器配置
 * <p>
 * 仅作为定义数据保存；引擎执行时只使用调用方传入的触发器名称
 */
public class TriggerConfig {

    @NotNull
    private TriggerType type = TriggerType.MANUAL;
    private String condition;
    private List<String> branches = new ArrayList<>();
    private List<String> tags = new ArrayList<>();

    /**
     * cron 表达式（SCHEDULE 类型）
     */
    private String schedule;
    private List<String> filePatterns = new ArrayList<>();
    private boolean enabled = true;

    public TriggerConfig() {
    }

    public TriggerConfig(TriggerType type, boolean enabled) {
        this.type = type;
        this.enabled = enabled;
    }

    public TriggerConfig copy() {
        TriggerConfig c = new TriggerConfig(type, enabled);
        c.condition = condition;
        c.branches = new ArrayList<>(branches);
        c.tags = new ArrayList<>(tags);
        c.schedule = schedule;
        c.filePatterns = new ArrayList<>(filePatterns);
        return c;
    }

    public static TriggerConfig manual() {
        return new TriggerConfig(TriggerType.MANUAL, true);
    }

    public TriggerType getType() { return type; }
    public void setType(TriggerType type) { this.type = type; }
    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = condition; }
    public List<String> getBranches() { return branches; }
    public void setBranches(List<String> branches) { this.branches = branches != null ? branches : new ArrayList<>(); }
    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags != null ? tags : new ArrayList<>(); }
    public String getSchedule() { return schedule; }
    public void setSchedule(String schedule) { this.schedule = schedule; }
    public List<String> getFilePatterns() { return filePatterns; }
    public void setFilePatterns(List<String> filePatterns) { this.filePatterns = filePatterns != null ? filePatterns : new ArrayList<>(); }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
