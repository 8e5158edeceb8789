package xyz.firestige.pipeline.domain.execution;

import java.time.LocalDateTime;

/**
 * 阶段产出的产物
 */
public class GeneratedArtifact {

    private String name;
    private String path;
    private long size;

    /**
     * SHA-256 十六进制摘要
     */
    private String checksum;
    private LocalDateTime createdAt;
    private boolean published;
    private String publishUrl;
    private String stageId;

    public GeneratedArtifact() {
    }

    public GeneratedArtifact(String name, String path, long size, String checksum, String stageId) {
        this.name = name;
        this.path = path;
        this.size = size;
        this.checksum = checksum;
        this.stageId = stageId;
        this.createdAt = LocalDateTime.now();
    }

    public void markPublished(String publishUrl) {
        this.published = true;
        this.publishUrl = publishUrl;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public boolean isPublished() { return published; }
    public void setPublished(boolean published) { this.published = published; }
    public String getPublishUrl() { return publishUrl; }
    public void setPublishUrl(String publishUrl) { this.publishUrl = publishUrl; }
    public String getStageId() { return stageId; }
    public void setStageId(String stageId) { this.stageId = stageId; }
}
