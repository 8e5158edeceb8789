package xyz.firestige.pipeline.application.template;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.application.registry.PipelineDefinitionValidator;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.ProjectType;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.infrastructure.condition.SpelConditionEvaluator;
import xyz.firestige.pipeline.infrastructure.execution.StageScheduler;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PipelineTemplatesTest {

    private final PipelineTemplates templates = new PipelineTemplates();
    private final PipelineDefinitionValidator validator =
            new PipelineDefinitionValidator(new SpelConditionEvaluator(), new StageScheduler());

    @Test
    void npmTemplateUsesDefaults() {
        Pipeline pipeline = templates.npmPipeline(null, " ");

        assertThat(pipeline.getName()).isEqualTo("NPM build");
        assertThat(pipeline.getProjectType()).isEqualTo(ProjectType.NPM);
        assertThat(pipeline.getStages()).extracting(StageDefinition::getId).containsExactly("install", "build");
        StageDefinition build = pipeline.findStage("build").orElseThrow();
        assertThat(build.getCommands()).containsExactly("npm run build");
        assertThat(build.getEnvironment()).containsEntry("NODE_ENV", "production");
        assertThat(build.getDependencies()).containsExactly("install");
        assertThatCode(() -> validator.validate(pipeline)).doesNotThrowAnyException();
    }

    @Test
    void npmTemplateHonoursCommandAndEnvironment() {
        Pipeline pipeline = templates.npmPipeline("test", "development");

        assertThat(pipeline.findStage("build").orElseThrow().getCommands()).containsExactly("npm run test");
        assertThat(pipeline.getEnvironment()).containsEntry("NODE_ENV", "development");
    }

    @Test
    void androidTemplateDerivesTaskFromBuildType() {
        Pipeline release = templates.androidPipeline("release", null);
        Pipeline custom = templates.androidPipeline(null, List.of("lint", "assembleDebug"));

        assertThat(release.getStages()).singleElement()
                .satisfies(s -> assertThat(s.getCommands()).containsExactly("./gradlew assembleRelease"));
        assertThat(custom.getName()).isEqualTo("Android debug");
        assertThat(custom.getStages().get(0).getCommands()).containsExactly("./gradlew lint", "./gradlew assembleDebug");
        assertThatCode(() -> validator.validate(release)).doesNotThrowAnyException();
    }
}
