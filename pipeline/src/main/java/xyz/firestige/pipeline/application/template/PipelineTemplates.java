package xyz.firestige.pipeline.application.template;

import xyz.firestige.pipeline.domain.pipeline.ArtifactConfig;
import xyz.firestige.pipeline.domain.pipeline.ArtifactType;
import xyz.firestige.pipeline.domain.pipeline.NotificationChannelType;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.ProjectType;
import xyz.firestige.pipeline.domain.pipeline.StageDefinition;
import xyz.firestige.pipeline.domain.pipeline.StageType;
import xyz.firestige.pipeline.domain.pipeline.TriggerConfig;

import java.util.List;

/**
 * 常用项目类型的流水线模板
 */
public class PipelineTemplates {

    public static final String DEFAULT_NPM_COMMAND = "build";
    public static final String DEFAULT_NPM_ENVIRONMENT = "production";
    public static final String DEFAULT_ANDROID_BUILD_TYPE = "debug";

    /**
     * NPM 项目：install → build
     *
     * @param command     npm run 的脚本名，为空时使用 build
     * @param environment NODE_ENV，为空时使用 production
     */
    public Pipeline npmPipeline(String command, String environment) {
        String script = isBlank(command) ? DEFAULT_NPM_COMMAND : command;
        String nodeEnv = isBlank(environment) ? DEFAULT_NPM_ENVIRONMENT : environment;

        StageDefinition install = StageDefinition.builder("install")
                .name("安装依赖")
                .description("安装 NPM 依赖")
                .type(StageType.BUILD)
                .commands("npm ci")
                .timeout(300_000)
                .retryCount(2)
                .order(1)
                .build();
        StageDefinition build = StageDefinition.builder("build")
                .name("构建项目")
                .description("执行 npm run " + script)
                .type(StageType.BUILD)
                .commands("npm run " + script)
                .env("NODE_ENV", nodeEnv)
                .timeout(600_000)
                .retryCount(1)
                .dependsOn("install")
                .artifacts("dist/**", "build/**")
                .order(2)
                .build();

        return Pipeline.builder("NPM " + script)
                .description("NPM 项目 " + script + " 构建")
                .projectType(ProjectType.NPM)
                .stage(install)
                .stage(build)
                .env("NODE_ENV", nodeEnv)
                .trigger(TriggerConfig.manual())
                .notification(defaultNotification())
                .artifact(new ArtifactConfig("build-output", "dist", ArtifactType.DIRECTORY))
                .build();
    }

    /**
     * Android 项目：单个 Gradle 构建阶段
     *
     * @param buildType debug / release，为空时使用 debug
     * @param tasks     Gradle 任务列表，为空时使用 assemble&lt;BuildType&gt;
     */
    public Pipeline androidPipeline(String buildType, List<String> tasks) {
        String type = isBlank(buildType) ? DEFAULT_ANDROID_BUILD_TYPE : buildType;
        List<String> gradleTasks = tasks == null || tasks.isEmpty()
                ? List.of("assemble" + Character.toUpperCase(type.charAt(0)) + type.substring(1))
                : tasks;

        StageDefinition gradleBuild = StageDefinition.builder("gradle-build")
                .name("Gradle 构建")
                .description("执行 Gradle 构建任务")
                .type(StageType.BUILD)
                .commands(gradleTasks.stream().map(t -> "./gradlew " + t).toArray(String[]::new))
                .timeout(1_800_000)
                .retryCount(1)
                .artifacts("app/build/outputs/**")
                .order(1)
                .build();

        return Pipeline.builder("Android " + type)
                .description("Android 项目 " + type + " 构建")
                .projectType(ProjectType.ANDROID)
                .stage(gradleBuild)
                .env("ANDROID_BUILD_TYPE", type)
                .trigger(TriggerConfig.manual())
                .notification(defaultNotification())
                .artifact(new ArtifactConfig("android-apk", "app/build/outputs/apk", ArtifactType.DIRECTORY))
                .build();
    }

    private static NotificationConfig defaultNotification() {
        return new NotificationConfig(NotificationChannelType.LOG, "user",
                List.of(NotificationEvent.SUCCESS, NotificationEvent.FAILURE));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
