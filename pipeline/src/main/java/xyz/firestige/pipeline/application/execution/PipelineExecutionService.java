package xyz.firestige.pipeline.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.application.registry.PipelineRegistry;
import xyz.firestige.pipeline.domain.execution.ExecutionNotFoundException;
import xyz.firestige.pipeline.domain.execution.ExecutionRepository;
import xyz.firestige.pipeline.domain.execution.LogLevel;
import xyz.firestige.pipeline.domain.execution.PipelineExecution;
import xyz.firestige.pipeline.domain.execution.event.ExecutionQueuedEvent;
import xyz.firestige.pipeline.domain.pipeline.NotificationEvent;
import xyz.firestige.pipeline.domain.pipeline.Pipeline;
import xyz.firestige.pipeline.domain.pipeline.PipelineDisabledException;
import xyz.firestige.pipeline.domain.pipeline.PipelineNotFoundException;
import xyz.firestige.pipeline.infrastructure.execution.ActiveExecutionRegistry;
import xyz.firestige.pipeline.infrastructure.execution.ExecutionDependencies;
import xyz.firestige.pipeline.infrastructure.execution.ExecutionHandle;
import xyz.firestige.pipeline.infrastructure.execution.PipelineExecutor;
import xyz.firestige.pipeline.infrastructure.execution.PipelineExecutorFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 流水线执行服务
 * <p>
 * 职责：
 * 1. 创建执行记录并提交到引擎线程池，立即返回执行 ID
 * 2. 取消运行中的执行（中断正在执行的命令）
 * 3. 执行记录查询与完成订阅
 * <p>
 * 同一流水线的多次执行互不影响，各自持有独立的执行记录和流水线快照
 */
public class PipelineExecutionService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutionService.class);

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final PipelineRegistry registry;
    private final ExecutionRepository executionRepository;
    private final PipelineExecutorFactory executorFactory;
    private final ExecutorService enginePool;
    private final ExecutorService commandPool;
    private final int historyLimit;

    public PipelineExecutionService(PipelineRegistry registry,
                                    ExecutionRepository executionRepository,
                                    PipelineExecutorFactory executorFactory,
                                    ExecutorService enginePool,
                                    ExecutorService commandPool,
                                    int historyLimit) {
        this.registry = registry;
        this.executionRepository = executionRepository;
        this.executorFactory = executorFactory;
        this.enginePool = enginePool;
        this.commandPool = commandPool;
        this.historyLimit = historyLimit;

        logger.info("[PipelineExecutionService] 初始化完成, historyLimit: {}", historyLimit);
    }

    /**
     * 启动一次执行，不等待任何阶段运行
     *
     * @return 执行 ID
     * @throws PipelineNotFoundException 流水线不存在
     * @throws PipelineDisabledException 流水线已禁用
     */
    public String executePipeline(String pipelineId, String trigger) {
        Pipeline snapshot = registry.getPipeline(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        if (!snapshot.isEnabled()) {
            throw new PipelineDisabledException(pipelineId);
        }

        ExecutionDependencies dependencies = executorFactory.getDependencies();
        ActiveExecutionRegistry activeExecutions = dependencies.getActiveExecutions();

        PipelineExecution execution = PipelineExecution.create(generateExecutionId(), snapshot, trigger);
        execution.addLog(LogLevel.INFO, "执行已入队, trigger: " + trigger);
        executionRepository.save(execution);
        ExecutionHandle handle = activeExecutions.register(execution.getId());
        evictHistory();

        // 先提交再对外通知；运行循环等到入队通知发出后才开始，保证 Queued 先于 Started
        PipelineExecutor executor = executorFactory.create(snapshot, execution, handle);
        CompletableFuture<Void> announced = new CompletableFuture<>();
        try {
            enginePool.submit(() -> {
                announced.join();
                executor.execute();
            });
        } catch (RejectedExecutionException e) {
            activeExecutions.release(execution.getId());
            executionRepository.remove(execution.getId());
            logger.error("[PipelineExecutionService] 引擎线程池拒绝执行, executionId: {}", execution.getId(), e);
            throw new IllegalStateException("执行引擎已关闭", e);
        }

        try {
            logger.info("[PipelineExecutionService] 执行已入队, executionId: {}, pipelineId: {}, trigger: {}",
                    execution.getId(), pipelineId, trigger);
            dependencies.getNotifier().notify(snapshot, NotificationEvent.START, execution);
            dependencies.getEventPublisher().publish(new ExecutionQueuedEvent(execution));
            dependencies.getMetrics().setGauge("pipeline_execution_active", activeExecutions.activeCount());
        } finally {
            announced.complete(null);
        }
        return execution.getId();
    }

    /**
     * 取消运行中的执行
     *
     * @return false 表示执行不在活跃状态（不存在、已结束或已取消），本次调用为空操作
     */
    public boolean cancelExecution(String executionId) {
        ActiveExecutionRegistry activeExecutions = executorFactory.getDependencies().getActiveExecutions();
        Optional<ExecutionHandle> handle = activeExecutions.findActive(executionId);
        if (handle.isEmpty()) {
            logger.info("[PipelineExecutionService] 执行不在活跃状态，忽略取消, executionId: {}", executionId);
            return false;
        }
        PipelineExecution execution = executionRepository.findById(executionId).orElse(null);
        if (execution == null || !execution.cancel()) {
            return false;
        }
        execution.addLog(LogLevel.WARN, "执行已取消");
        handle.get().requestCancel();
        executorFactory.getDependencies().getMetrics()
                .setGauge("pipeline_execution_active", activeExecutions.activeCount());
        logger.info("[PipelineExecutionService] 执行已取消, executionId: {}", executionId);
        return true;
    }

    public Optional<PipelineExecution> getExecution(String executionId) {
        return executionRepository.findById(executionId);
    }

    public List<PipelineExecution> getExecutions() {
        return executionRepository.findAll();
    }

    public List<PipelineExecution> getExecutions(String pipelineId) {
        return executionRepository.findByPipelineId(pipelineId);
    }

    /**
     * 执行结束（后台任务退出）时完成的 Future；已结束的执行返回已完成的 Future
     *
     * @throws ExecutionNotFoundException 执行记录不存在
     */
    public CompletableFuture<PipelineExecution> awaitCompletion(String executionId) {
        Optional<ExecutionHandle> handle = executorFactory.getDependencies().getActiveExecutions().find(executionId);
        if (handle.isPresent()) {
            return handle.get().getCompletion();
        }
        PipelineExecution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        return CompletableFuture.completedFuture(execution);
    }

    public Set<String> getActiveExecutionIds() {
        return executorFactory.getDependencies().getActiveExecutions().activeIds();
    }

    /**
     * 取消全部活跃执行并停止线程池
     */
    public void shutdown() {
        Set<String> active = getActiveExecutionIds();
        logger.info("[PipelineExecutionService] 关闭执行引擎, 活跃执行数: {}", active.size());
        active.forEach(this::cancelExecution);
        enginePool.shutdown();
        try {
            if (!enginePool.awaitTermination(5, TimeUnit.SECONDS)) {
                enginePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            enginePool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        commandPool.shutdownNow();
    }

    /**
     * 超出历史上限时淘汰最早的已结束执行
     */
    private void evictHistory() {
        if (historyLimit <= 0) {
            return;
        }
        List<PipelineExecution> all = executionRepository.findAll();
        int overflow = all.size() - historyLimit;
        if (overflow <= 0) {
            return;
        }
        List<PipelineExecution> evictable = all.stream()
                .filter(e -> e.getStatus().isTerminal())
                .sorted(Comparator.comparing(PipelineExecution::getStartTime))
                .limit(overflow)
                .collect(Collectors.toList());
        evictable.forEach(e -> executionRepository.remove(e.getId()));
        logger.debug("[PipelineExecutionService] 淘汰历史执行记录: {}", evictable.size());
    }

    static String generateExecutionId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "exec-" + System.currentTimeMillis() + "-" + suffix;
    }
}
