package io.minicron4j.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "minicron")
public class SchedulerProperties {
    private boolean enabled = true;
    private String dataDir = "./data";
    private String jobsFile = "jobs/jobs.json"; // relative to dataDir
    private Duration minDelay = Duration.ofMinutes(1);
    private int maxConcurrency = 4;
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Location of the persisted job list.
     */
    public Path resolveJobsPath() {
        return Path.of(dataDir).resolve(jobsFile).normalize();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getJobsFile() {
        return jobsFile;
    }

    public void setJobsFile(String jobsFile) {
        this.jobsFile = jobsFile;
    }

    public Duration getMinDelay() {
        return minDelay;
    }

    public void setMinDelay(Duration minDelay) {
        this.minDelay = minDelay;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
