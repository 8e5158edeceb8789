package xyz.firestige.pipeline.domain.target;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 健康检查配置
 * <p>
 * 最多探测 retries 次，每次间隔 interval 毫秒，单次探测受 timeout 毫秒约束
 */
public class HealthCheckConfig {

    @NotBlank
    private String url;

    @NotNull
    private HealthCheckMethod method = HealthCheckMethod.GET;
    private int expectedStatus = 200;

    @Positive
    private long timeout = 5000;

    @Min(1)
    private int retries = 3;

    @PositiveOrZero
    private long interval = 2000;

    public HealthCheckConfig() {
    }

    public HealthCheckConfig(String url, int expectedStatus, long timeout, int retries, long interval) {
        this.url = url;
        this.expectedStatus = expectedStatus;
        this.timeout = timeout;
        this.retries = retries;
        this.interval = interval;
    }

    public HealthCheckConfig copy() {
        HealthCheckConfig c = new HealthCheckConfig(url, expectedStatus, timeout, retries, interval);
        c.method = method;
        return c;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public HealthCheckMethod getMethod() { return method; }
    public void setMethod(HealthCheckMethod method) { this.method = method; }
    public int getExpectedStatus() { return expectedStatus; }
    public void setExpectedStatus(int expectedStatus) { this.expectedStatus = expectedStatus; }
    public long getTimeout() { return timeout; }
    public void setTimeout(long timeout) { this.timeout = timeout; }
    public int getRetries() { return retries; }
    public void setRetries(int retries) { this.retries = retries; }
    public long getInterval() { return interval; }
    public void setInterval(long interval) { this.interval = interval; }
}
