package xyz.firestige.pipeline.domain.target;

/**
 * 部署环境
 */
public enum TargetEnvironment {

    DEVELOPMENT("开发"),

    STAGING("预发"),

    PRODUCTION("生产");

    private final String description;

    TargetEnvironment(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
