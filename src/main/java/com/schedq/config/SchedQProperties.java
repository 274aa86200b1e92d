package com.schedq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "schedq")
public class SchedQProperties {

    private boolean enabled = true;
    private String timezone = "Asia/Shanghai";
    private Store store = Store.MEMORY;
    private String storePath = "schedq-jobs.json";
    private int maxWorkers = 10;
    private Duration misfireGraceTime = Duration.ofSeconds(60);
    private boolean coalesce = true;
    private boolean shutdownWait = true;
    private final Lock lock = new Lock();
    private final History history = new History();

    public enum Store {
        MEMORY,
        PERSISTENT
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public Duration getMisfireGraceTime() {
        return misfireGraceTime;
    }

    public void setMisfireGraceTime(Duration misfireGraceTime) {
        this.misfireGraceTime = misfireGraceTime;
    }

    public boolean isCoalesce() {
        return coalesce;
    }

    public void setCoalesce(boolean coalesce) {
        this.coalesce = coalesce;
    }

    public boolean isShutdownWait() {
        return shutdownWait;
    }

    public void setShutdownWait(boolean shutdownWait) {
        this.shutdownWait = shutdownWait;
    }

    public Lock getLock() {
        return lock;
    }

    public History getHistory() {
        return history;
    }

    public static class Lock {
        private boolean enabled = false;
        private String backendUrl;
        private String prefix = "schedq:lock:";
        private Duration timeout = Duration.ofSeconds(300);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBackendUrl() {
            return backendUrl;
        }

        public void setBackendUrl(String backendUrl) {
            this.backendUrl = backendUrl;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class History {
        private boolean enabled = true;
        private int retentionDays = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }
}
