package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.execution.PipelineExecution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * 运行中执行的控制句柄
 * <p>
 * 持有取消标记、当前正在执行的命令 Future，以及调用方可订阅的完成通知
 */
public class ExecutionHandle {

    private final String executionId;
    private final CompletableFuture<PipelineExecution> completion = new CompletableFuture<>();
    private volatile boolean cancelRequested;
    private volatile Future<?> inFlight;

    public ExecutionHandle(String executionId) {
        this.executionId = executionId;
    }

    /**
     * 请求取消并中断正在执行的命令
     */
    public void requestCancel() {
        cancelRequested = true;
        Future<?> current = inFlight;
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * 登记正在执行的命令；若取消请求先于登记到达，立即中断
     */
    void attach(Future<?> future) {
        this.inFlight = future;
        if (cancelRequested) {
            future.cancel(true);
        }
    }

    void detach() {
        this.inFlight = null;
    }

    void complete(PipelineExecution execution) {
        completion.complete(execution);
    }

    public CompletableFuture<PipelineExecution> getCompletion() {
        return completion;
    }

    public String getExecutionId() {
        return executionId;
    }
}
