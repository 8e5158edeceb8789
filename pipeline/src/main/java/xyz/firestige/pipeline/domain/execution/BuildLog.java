package xyz.firestige.pipeline.domain.execution;

import java.time.LocalDateTime;

/**
 * 执行日志条目（只追加，不修改）
 */
public final class BuildLog {

    private final LocalDateTime timestamp;
    private final LogLevel level;
    private final String stage;
    private final String message;

    public BuildLog(LogLevel level, String stage, String message) {
        this.timestamp = LocalDateTime.now();
        this.level = level;
        this.stage = stage;
        this.message = message;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public LogLevel getLevel() { return level; }
    public String getStage() { return stage; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return timestamp + " [" + level + "]" + (stage != null ? " [" + stage + "] " : " ") + message;
    }
}
