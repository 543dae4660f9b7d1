package io.sendflow.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for schedule evaluation and bulk dispatch.
 */
@ConfigurationProperties(prefix = "sendflow")
public class SendFlowProperties {
    private Duration processEvery = Duration.ofSeconds(10);
    private int batchSize = 20; // schedules claimed per query
    private Duration lockLifetime = Duration.ofMinutes(10);
    private String workerId;
    private String defaultTimezone; // null = system default
    private String defaultCountryCode = "55";
    private Duration maxRunAtLag = Duration.ofMinutes(5);
    private boolean ensureIndexesOnStartup = false;
    private int messageLogCapacity = 10_000; // in-memory send history only
    private final Dispatch dispatch = new Dispatch();

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public String getDefaultCountryCode() {
        return defaultCountryCode;
    }

    public void setDefaultCountryCode(String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode;
    }

    public Duration getMaxRunAtLag() {
        return maxRunAtLag;
    }

    public void setMaxRunAtLag(Duration maxRunAtLag) {
        this.maxRunAtLag = maxRunAtLag;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public int getMessageLogCapacity() {
        return messageLogCapacity;
    }

    public void setMessageLogCapacity(int messageLogCapacity) {
        this.messageLogCapacity = messageLogCapacity;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public static class Dispatch {
        private int maxConcurrentJobs = 4;
        private int senderThreads = 8;
        private Duration sendTimeout = Duration.ofSeconds(30);
        private Duration delayBetweenSends = Duration.ofSeconds(3); // provider rate limit
        private Duration jobRetention; // null = finished jobs are kept for the life of the process

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        public int getSenderThreads() {
            return senderThreads;
        }

        public void setSenderThreads(int senderThreads) {
            this.senderThreads = senderThreads;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public Duration getDelayBetweenSends() {
            return delayBetweenSends;
        }

        public void setDelayBetweenSends(Duration delayBetweenSends) {
            this.delayBetweenSends = delayBetweenSends;
        }

        public Duration getJobRetention() {
            return jobRetention;
        }

        public void setJobRetention(Duration jobRetention) {
            this.jobRetention = jobRetention;
        }
    }
}
