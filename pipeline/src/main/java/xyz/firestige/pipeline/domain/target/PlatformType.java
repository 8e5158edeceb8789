package xyz.firestige.pipeline.domain.target;

/**
 * 部署平台
 */
public enum PlatformType {
    VERCEL,
    NETLIFY,
    AWS,
    AZURE,
    GCP,
    DOCKER,
    FTP,
    CUSTOM
}
