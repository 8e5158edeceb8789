package xyz.firestige.pipeline.domain.pipeline;

/**
 * 触发器类型
 */
public enum TriggerType {
    MANUAL,
    GIT_PUSH,
    GIT_TAG,
    SCHEDULE,
    FILE_CHANGE
}
