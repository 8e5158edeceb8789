package xyz.firestige.pipeline.infrastructure.command;

import java.util.Map;

/**
 * 外部命令执行器
 * <p>
 * 调用线程被中断即为取消信号，实现需尽快终止正在执行的命令并抛出 InterruptedException
 */
public interface CommandExecutor {

    /**
     * 创建命令会话
     *
     * @param workingDirectory 工作目录，可为 null（使用进程当前目录）
     * @param environment 合并后的环境变量
     * @return 会话 ID
     */
    String createSession(String workingDirectory, Map<String, String> environment);

    CommandResult execute(String sessionId, String command) throws InterruptedException;

    /**
     * 关闭会话（尽力而为，不抛异常）
     */
    void closeSession(String sessionId);
}
