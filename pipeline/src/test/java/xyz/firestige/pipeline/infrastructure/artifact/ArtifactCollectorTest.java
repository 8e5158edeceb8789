package xyz.firestige.pipeline.infrastructure.artifact;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.pipeline.domain.execution.GeneratedArtifact;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactCollectorTest {

    @TempDir
    Path workspace;

    @Test
    void collectsMatchingFilesWithSizeAndChecksum() throws Exception {
        Files.createDirectories(workspace.resolve("dist/js"));
        Files.writeString(workspace.resolve("dist/index.html"), "hello");
        Files.writeString(workspace.resolve("dist/js/app.js"), "x");
        Files.writeString(workspace.resolve("README.md"), "docs");
        ArtifactCollector collector = new ArtifactCollector(workspace.toString());

        List<GeneratedArtifact> artifacts = collector.collect("build", null, List.of("dist/**"));

        assertThat(artifacts).extracting(GeneratedArtifact::getName)
                .containsExactly("dist/index.html", "dist/js/app.js");
        GeneratedArtifact index = artifacts.get(0);
        assertThat(index.getSize()).isEqualTo(5);
        assertThat(index.getChecksum())
                .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        assertThat(index.getStageId()).isEqualTo("build");
    }

    @Test
    void patternsResolveAgainstWorkingDirectory() throws Exception {
        Files.createDirectories(workspace.resolve("app/build"));
        Files.writeString(workspace.resolve("app/build/app.apk"), "apk");
        ArtifactCollector collector = new ArtifactCollector(workspace.toString());

        List<GeneratedArtifact> artifacts = collector.collect("gradle-build", "app", List.of("build/*.apk"));

        assertThat(artifacts).singleElement().satisfies(a -> assertThat(a.getName()).isEqualTo("build/app.apk"));
        assertThat(collector.resolveBaseDir("app")).isEqualTo(workspace.toAbsolutePath().normalize().resolve("app"));
    }

    @Test
    void missingDirectoryOrNoPatternsYieldsNothing() {
        ArtifactCollector collector = new ArtifactCollector(workspace.toString());

        assertThat(collector.collect("build", "does-not-exist", List.of("**"))).isEmpty();
        assertThat(collector.collect("build", null, List.of())).isEmpty();
        assertThat(collector.collect("build", null, null)).isEmpty();
    }

    @Test
    void malformedPatternIsSkipped() throws Exception {
        Files.createDirectories(workspace.resolve("dist"));
        Files.writeString(workspace.resolve("dist/app.js"), "x");
        ArtifactCollector collector = new ArtifactCollector(workspace.toString());

        assertThat(collector.collect("build", null, List.of("dist/[abc"))).isEmpty();
        assertThat(collector.collect("build", null, List.of("dist/[abc", "dist/*.js")))
                .extracting(GeneratedArtifact::getName)
                .containsExactly("dist/app.js");
    }
}
