package xyz.firestige.pipeline.application.notification;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.pipeline.NotificationChannelType;
import xyz.firestige.pipeline.domain.pipeline.NotificationConfig;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.testutil.RecordingNotificationChannel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.pipeline;
import static xyz.firestige.pipeline.testutil.factory.PipelineTestFactory.stage;

class NotificationDispatcherTest {

    private final RecordingNotificationChannel slack = new RecordingNotificationChannel(NotificationChannelType.SLACK, true);
    private final RecordingNotificationChannel webhook = new RecordingNotificationChannel(NotificationChannelType.WEBHOOK);
    private final NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(slack, webhook));

    @Test
    void sendsOnlySubscribedEvents() {
        Pipeline pipeline = pipelineWith(
                new NotificationConfig(NotificationChannelType.WEBHOOK, "http://hooks/a", List.of(NotificationEvent.FAILURE)));
        PipelineExecution execution = PipelineExecution.create("exec-1", pipeline, "manual");

        dispatcher.notify(pipeline, NotificationEvent.START, execution);
        dispatcher.notify(pipeline, NotificationEvent.FAILURE, execution);

        assertThat(webhook.getEvents()).containsExactly(NotificationEvent.FAILURE);
        assertThat(webhook.getSent().get(0).getTarget()).isEqualTo("http://hooks/a");
    }

    @Test
    void failingChannelDoesNotAffectOthers() {
        Pipeline pipeline = pipelineWith(
                new NotificationConfig(NotificationChannelType.SLACK, "#ci", List.of(NotificationEvent.SUCCESS)),
                new NotificationConfig(NotificationChannelType.WEBHOOK, "http://hooks/b", List.of(NotificationEvent.SUCCESS)));
        PipelineExecution execution = PipelineExecution.create("exec-2", pipeline, "manual");

        assertThatCode(() -> dispatcher.notify(pipeline, NotificationEvent.SUCCESS, execution))
                .doesNotThrowAnyException();

        assertThat(slack.getSent()).hasSize(1);
        assertThat(webhook.getSent()).hasSize(1);
    }

    @Test
    void skipsDisabledConfigAndMissingChannel() {
        NotificationConfig disabled = new NotificationConfig(NotificationChannelType.WEBHOOK, "http://hooks/c",
                List.of(NotificationEvent.START));
        disabled.setEnabled(false);
        Pipeline pipeline = pipelineWith(disabled,
                new NotificationConfig(NotificationChannelType.EMAIL, "dev@example.com", List.of(NotificationEvent.START)));
        PipelineExecution execution = PipelineExecution.create("exec-3", pipeline, "manual");

        assertThatCode(() -> dispatcher.notify(pipeline, NotificationEvent.START, execution))
                .doesNotThrowAnyException();
        assertThat(webhook.getSent()).isEmpty();
    }

    @Test
    void rendersTemplatePlaceholders() {
        Pipeline pipeline = pipeline("web-app", stage("build", 1));
        PipelineExecution execution = PipelineExecution.create("exec-42", pipeline, "webhook");

        String message = NotificationDispatcher.render(
                "${pipeline} ${event} ${status} ${executionId} ${trigger} ${unknown}",
                pipeline, NotificationEvent.START, execution);

        assertThat(message).isEqualTo("web-app START QUEUED exec-42 webhook ${unknown}");
    }

    @Test
    void rendersDefaultMessageWithoutTemplate() {
        Pipeline pipeline = pipeline("web-app", stage("build", 1));
        PipelineExecution execution = PipelineExecution.create("exec-43", pipeline, "manual");

        String message = NotificationDispatcher.render(null, pipeline, NotificationEvent.START, execution);

        assertThat(message).contains("web-app", "exec-43", "manual", NotificationEvent.START.getDescription());
    }

    private static Pipeline pipelineWith(NotificationConfig... configs) {
        Pipeline pipeline = pipeline("demo", stage("build", 1));
        pipeline.setId("demo-1");
        for (NotificationConfig config : configs) {
            pipeline.getNotifications().add(config);
        }
        return pipeline;
    }
}
