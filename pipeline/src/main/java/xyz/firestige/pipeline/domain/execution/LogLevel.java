package xyz.firestige.pipeline.domain.execution;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
