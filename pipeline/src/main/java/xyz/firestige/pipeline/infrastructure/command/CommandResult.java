package xyz.firestige.pipeline.infrastructure.command;

/**
 * 单条命令的执行结果
 */
public final class CommandResult {

    private final boolean success;
    private final String output;
    private final String error;
    private final Integer exitCode;

    public CommandResult(boolean success, String output, String error, Integer exitCode) {
        this.success = success;
        this.output = output != null ? output : "";
        this.error = error != null ? error : "";
        this.exitCode = exitCode;
    }

    public static CommandResult ok(String output) {
        return new CommandResult(true, output, "", 0);
    }

    public static CommandResult fail(int exitCode, String error) {
        return new CommandResult(false, "", error, exitCode);
    }

    public boolean isSuccess() { return success; }
    public String getOutput() { return output; }
    public String getError() { return error; }
    public Integer getExitCode() { return exitCode; }

    @Override
    public String toString() {
        return "CommandResult{success=" + success + ", exitCode=" + exitCode + '}';
    }
}
