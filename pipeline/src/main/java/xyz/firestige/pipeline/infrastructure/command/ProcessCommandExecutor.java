package xyz.firestige.pipeline.infrastructure.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于 ProcessBuilder 的命令执行器，每条命令以 {@code sh -c} 运行
 * <p>
 * 调用线程被中断时强制销毁子进程。
 * stdout/stderr 在独立的读取线程池上排空，线程池必须不限大小：
 * 每个运行中的进程占用两个读取线程，读取被阻塞时子进程会因管道写满而挂起。
 */
public class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final ExecutorService streamPool;

    public ProcessCommandExecutor() {
        this(Executors.newCachedThreadPool(streamThreadFactory()));
    }

    public ProcessCommandExecutor(ExecutorService streamPool) {
        this.streamPool = streamPool;
    }

    @Override
    public String createSession(String workingDirectory, Map<String, String> environment) {
        String sessionId = "session-" + UUID.randomUUID();
        sessions.put(sessionId, new Session(workingDirectory, environment));
        log.debug("创建命令会话, sessionId: {}, workingDirectory: {}", sessionId, workingDirectory);
        return sessionId;
    }

    @Override
    public CommandResult execute(String sessionId, String command) throws InterruptedException {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new IllegalStateException("命令会话不存在: " + sessionId);
        }

        ProcessBuilder builder = new ProcessBuilder("sh", "-c", command);
        if (session.workingDirectory != null) {
            builder.directory(new File(session.workingDirectory));
        }
        builder.environment().putAll(session.environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("命令启动失败, command: {}, error: {}", command, e.getMessage());
            return new CommandResult(false, "", "命令启动失败: " + e.getMessage(), null);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), streamPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), streamPool);
        try {
            int exitCode = process.waitFor();
            String output = stdout.join();
            String error = stderr.join();
            return new CommandResult(exitCode == 0, output, error, exitCode);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            log.info("命令被中断，已销毁进程, command: {}", command);
            throw e;
        }
    }

    @Override
    public void closeSession(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.debug("关闭命令会话, sessionId: {}", sessionId);
        }
    }

    private static String drain(InputStream in) {
        try (InputStream stream = in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ThreadFactory streamThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pipeline-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Session {
        private final String workingDirectory;
        private final Map<String, String> environment;

        private Session(String workingDirectory, Map<String, String> environment) {
            this.workingDirectory = workingDirectory;
            this.environment = environment != null ? new HashMap<>(environment) : new HashMap<>();
        }
    }
}
