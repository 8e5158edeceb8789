package xyz.firestige.pipeline.infrastructure.execution;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * 活跃执行登记表
 * <p>
 * 句柄在后台任务退出时才释放；已请求取消的句柄不再算作活跃。
 * 仅做簿记，不提供互斥，执行记录自身的状态转换负责一致性。
 */
public class ActiveExecutionRegistry {

    private final ConcurrentMap<String, ExecutionHandle> handles = new ConcurrentHashMap<>();

    public ExecutionHandle register(String executionId) {
        ExecutionHandle handle = new ExecutionHandle(executionId);
        handles.put(executionId, handle);
        return handle;
    }

    /**
     * 后台任务尚未退出的句柄（包括已请求取消的）
     */
    public Optional<ExecutionHandle> find(String executionId) {
        return Optional.ofNullable(handles.get(executionId));
    }

    public Optional<ExecutionHandle> findActive(String executionId) {
        return find(executionId).filter(h -> !h.isCancelRequested());
    }

    public void release(String executionId) {
        handles.remove(executionId);
    }

    public Set<String> activeIds() {
        return handles.values().stream()
                .filter(h -> !h.isCancelRequested())
                .map(ExecutionHandle::getExecutionId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int activeCount() {
        return (int) handles.values().stream().filter(h -> !h.isCancelRequested()).count();
    }
}
