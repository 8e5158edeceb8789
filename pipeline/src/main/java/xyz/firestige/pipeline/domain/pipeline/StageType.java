package xyz.firestige.pipeline.domain.pipeline;

/**
 * 阶段类型
 */
public enum StageType {
    BUILD,
    TEST,
    LINT,
    SECURITY,
    DEPLOY,
    CUSTOM
}
