package xyz.firestige.pipeline.domain.execution;

import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;

/**
 * 执行生命周期通知出口
 * <p>
 * 实现不得抛出异常影响执行状态
 */
public interface ExecutionNotifier {

    void notify(Pipeline pipeline, NotificationEvent event, PipelineExecution execution);
}
