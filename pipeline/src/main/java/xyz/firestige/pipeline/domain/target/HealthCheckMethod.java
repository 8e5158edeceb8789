package xyz.firestige.pipeline.domain.target;

public enum HealthCheckMethod {
    GET,
    POST,
    HEAD
}
