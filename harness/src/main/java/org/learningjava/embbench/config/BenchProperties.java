package org.learningjava.embbench.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Component
@Validated
@ConfigurationProperties(prefix = "bench")
public class BenchProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8000";
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(300);
    @Min(0)
    private int connectionHeadroom = 4;
    private long seed = 42L;
    @Valid
    private Power power = new Power();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String v) { this.baseUrl = v; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration v) { this.requestTimeout = v; }
    public int getConnectionHeadroom() { return connectionHeadroom; }
    public void setConnectionHeadroom(int v) { this.connectionHeadroom = v; }
    public long getSeed() { return seed; }
    public void setSeed(long v) { this.seed = v; }
    public Power getPower() { return power; }
    public void setPower(Power v) { this.power = v; }

    public static class Power {
        private boolean enabled = true;
        @NotBlank
        private String command = "nvidia-smi";
        @NotNull
        private Duration pollInterval = Duration.ofMillis(100);
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(2);
        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public String getCommand() { return command; }
        public void setCommand(String v) { this.command = v; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration v) { this.pollInterval = v; }
        public Duration getStopTimeout() { return stopTimeout; }
        public void setStopTimeout(Duration v) { this.stopTimeout = v; }
        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration v) { this.probeTimeout = v; }
    }
}
