package xyz.firestige.pipeline.domain.pipeline;

/**
 * 流水线所属项目类型
 */
public enum ProjectType {
    NPM,
    ANDROID,
    IOS,
    FLUTTER,
    REACT_NATIVE,
    ELECTRON,
    WEB,
    CUSTOM
}
