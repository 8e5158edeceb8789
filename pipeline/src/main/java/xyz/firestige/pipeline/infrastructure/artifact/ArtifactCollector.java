package xyz.firestige.pipeline.infrastructure.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.execution.GeneratedArtifact;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 产物收集器
 * <p>
 * 按 glob 模式（相对阶段工作目录，未指定时相对工作区根目录）匹配普通文件，
 * 计算大小和 SHA-256 摘要。I/O 异常只记录 WARN，不影响阶段结果。
 */
public class ArtifactCollector {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCollector.class);

    private final Path workspaceRoot;

    public ArtifactCollector(String workspaceRoot) {
        this.workspaceRoot = Paths.get(workspaceRoot != null ? workspaceRoot : ".").toAbsolutePath().normalize();
    }

    public List<GeneratedArtifact> collect(String stageId, String workingDirectory, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return List.of();
        }
        Path baseDir = resolveBaseDir(workingDirectory);
        if (!Files.isDirectory(baseDir)) {
            log.warn("产物目录不存在, stageId: {}, dir: {}", stageId, baseDir);
            return List.of();
        }

        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                matchers.add(matcher(pattern));
            } catch (IllegalArgumentException e) {
                log.warn("产物模式无效，已忽略, stageId: {}, pattern: {}, error: {}", stageId, pattern, e.getMessage());
            }
        }
        if (matchers.isEmpty()) {
            return List.of();
        }

        Set<Path> matched = new LinkedHashSet<>();
        try (Stream<Path> files = Files.walk(baseDir)) {
            files.filter(Files::isRegularFile)
                    .filter(file -> {
                        Path relative = baseDir.relativize(file);
                        return matchers.stream().anyMatch(m -> m.matches(relative));
                    })
                    .sorted()
                    .forEach(matched::add);
        } catch (IOException | UncheckedIOException e) {
            log.warn("扫描产物失败, stageId: {}, dir: {}, error: {}", stageId, baseDir, e.getMessage());
            return List.of();
        }

        List<GeneratedArtifact> artifacts = new ArrayList<>();
        for (Path file : matched) {
            try {
                String relativeName = baseDir.relativize(file).toString();
                artifacts.add(new GeneratedArtifact(relativeName, file.toString(), Files.size(file), sha256(file), stageId));
            } catch (IOException e) {
                log.warn("读取产物失败, stageId: {}, file: {}, error: {}", stageId, file, e.getMessage());
            }
        }
        log.info("产物收集完成, stageId: {}, count: {}", stageId, artifacts.size());
        return artifacts;
    }

    /**
     * 编译 glob 模式
     *
     * @throws IllegalArgumentException 模式语法错误（含 PatternSyntaxException）
     */
    public static PathMatcher matcher(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("产物模式不能为空");
        }
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    /**
     * 相对路径按工作区根目录解析
     */
    public Path resolveBaseDir(String workingDirectory) {
        if (workingDirectory == null || workingDirectory.isBlank()) {
            return workspaceRoot;
        }
        Path dir = Paths.get(workingDirectory);
        return dir.isAbsolute() ? dir.normalize() : workspaceRoot.resolve(dir).normalize();
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
