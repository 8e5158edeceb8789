package xyz.firestige.pipeline.infrastructure.persistence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineStore;
import xyz.firestige.pipeline.domain.target.DeploymentTarget;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 文件存储：整个注册表保存为一个 JSON 文档
 * <p>
 * 写入先落临时文件再原子替换
 */
public class JsonFilePipelineStore implements PipelineStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePipelineStore.class);

    private final Path file;
    private final ObjectMapper mapper = PipelineStoreMapper.create()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public JsonFilePipelineStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized List<Pipeline> loadPipelines() {
        return read().getPipelines();
    }

    @Override
    public synchronized void savePipelines(List<Pipeline> pipelines) {
        Document document = read();
        document.setPipelines(new ArrayList<>(pipelines));
        write(document);
    }

    @Override
    public synchronized List<DeploymentTarget> loadDeploymentTargets() {
        return read().getDeploymentTargets();
    }

    @Override
    public synchronized void saveDeploymentTargets(List<DeploymentTarget> targets) {
        Document document = read();
        document.setDeploymentTargets(new ArrayList<>(targets));
        write(document);
    }

    private Document read() {
        if (!Files.exists(file)) {
            return new Document();
        }
        try {
            return mapper.readValue(file.toFile(), Document.class);
        } catch (IOException e) {
            throw new UncheckedIOException("读取流水线存储文件失败: " + file, e);
        }
    }

    private void write(Document document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("流水线存储已写入, file: {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("写入流水线存储文件失败: " + file, e);
        }
    }

    /**
     * 文件内容
     */
    public static class Document {
        private List<Pipeline> pipelines = new ArrayList<>();
        private List<DeploymentTarget> deploymentTargets = new ArrayList<>();

        public List<Pipeline> getPipelines() { return pipelines; }
        public void setPipelines(List<Pipeline> pipelines) { this.pipelines = pipelines != null ? pipelines : new ArrayList<>(); }
        public List<DeploymentTarget> getDeploymentTargets() { return deploymentTargets; }
        public void setDeploymentTargets(List<DeploymentTarget> deploymentTargets) { this.deploymentTargets = deploymentTargets != null ? deploymentTargets : new ArrayList<>(); }
    }
}
