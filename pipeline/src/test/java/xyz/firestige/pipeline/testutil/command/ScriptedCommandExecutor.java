package xyz.firestige.pipeline.testutil.command;

import xyz.firestige.pipeline.infrastructure.command.CommandExecutor;
import xyz.firestige.pipeline.infrastructure.command.CommandResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按命令文本返回预设结果的命令执行器
 * <p>
 * 未登记的命令默认成功，输出为命令本身。支持：
 * - 固定失败 / 前 N 次失败
 * - 休眠（可被中断）
 * - 阻塞直到被中断，并通过 latch 通知已开始
 */
public class ScriptedCommandExecutor implements CommandExecutor {

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, String>> sessionEnvironments = Collections.synchronizedList(new ArrayList<>());
    private final List<String> sessionDirectories = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger openSessions = new AtomicInteger();
    private final AtomicInteger interrupted = new AtomicInteger();

    public ScriptedCommandExecutor fail(String command, int exitCode) {
        behaviors.put(command, new Behavior(Integer.MAX_VALUE, exitCode, 0, null));
        return this;
    }

    public ScriptedCommandExecutor failTimes(String command, int times, int exitCode) {
        behaviors.put(command, new Behavior(times, exitCode, 0, null));
        return this;
    }

    public ScriptedCommandExecutor sleep(String command, long millis) {
        behaviors.put(command, new Behavior(0, 0, millis, null));
        return this;
    }

    /**
     * 命令阻塞直到线程被中断；开始执行时 countDown
     */
    public ScriptedCommandExecutor block(String command, CountDownLatch started) {
        behaviors.put(command, new Behavior(0, 0, Long.MAX_VALUE, started));
        return this;
    }

    @Override
    public String createSession(String workingDirectory, Map<String, String> environment) {
        openSessions.incrementAndGet();
        sessionDirectories.add(workingDirectory);
        sessionEnvironments.add(new HashMap<>(environment));
        return "scripted-" + sessionEnvironments.size();
    }

    @Override
    public CommandResult execute(String sessionId, String command) throws InterruptedException {
        executed.add(command);
        int count = invocations.computeIfAbsent(command, c -> new AtomicInteger()).incrementAndGet();
        Behavior behavior = behaviors.get(command);
        if (behavior == null) {
            return CommandResult.ok(command);
        }
        if (behavior.started != null) {
            behavior.started.countDown();
        }
        if (behavior.sleepMillis > 0) {
            try {
                Thread.sleep(behavior.sleepMillis);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                throw e;
            }
        }
        if (count <= behavior.failTimes) {
            return CommandResult.fail(behavior.exitCode, "failed: " + command);
        }
        return CommandResult.ok(command);
    }

    @Override
    public void closeSession(String sessionId) {
        openSessions.decrementAndGet();
    }

    public List<String> getExecuted() {
        synchronized (executed) {
            return new ArrayList<>(executed);
        }
    }

    public int invocations(String command) {
        AtomicInteger count = invocations.get(command);
        return count == null ? 0 : count.get();
    }

    public List<Map<String, String>> getSessionEnvironments() {
        synchronized (sessionEnvironments) {
            return new ArrayList<>(sessionEnvironments);
        }
    }

    public List<String> getSessionDirectories() {
        synchronized (sessionDirectories) {
            return new ArrayList<>(sessionDirectories);
        }
    }

    public int getOpenSessions() {
        return openSessions.get();
    }

    public int getInterruptedCount() {
        return interrupted.get();
    }

    private static final class Behavior {
        private final int failTimes;
        private final int exitCode;
        private final long sleepMillis;
        private final CountDownLatch started;

        private Behavior(int failTimes, int exitCode, long sleepMillis, CountDownLatch started) {
            this.failTimes = failTimes;
            this.exitCode = exitCode;
            this.sleepMillis = sleepMillis;
            this.started = started;
        }
    }
}
