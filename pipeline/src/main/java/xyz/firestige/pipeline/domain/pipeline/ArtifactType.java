package xyz.firestige.pipeline.domain.pipeline;

/**
 * 产物类型
 */
public enum ArtifactType {
    FILE,
    DIRECTORY,
    ARCHIVE
}
