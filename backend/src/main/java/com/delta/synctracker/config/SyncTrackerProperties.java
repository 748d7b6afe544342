package com.delta.synctracker.config;

import com.delta.synctracker.sync.model.QuotaPolicy;
import com.delta.synctracker.sync.model.SyncSchedule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "sync-tracker")
public class SyncTrackerProperties {
    private Workers workers = new Workers();
    private Health health = new Health();
    private Map<String, Provider> providers = new LinkedHashMap<>();
    private Map<String, Quota> quotas = new LinkedHashMap<>();
    private Map<String, Availability> availability = new LinkedHashMap<>();
    private RateLimiting rateLimiting = new RateLimiting();
    private Jobs jobs = new Jobs();

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public Map<String, Quota> getQuotas() {
        return quotas;
    }

    public void setQuotas(Map<String, Quota> quotas) {
        this.quotas = quotas == null ? new LinkedHashMap<>() : quotas;
    }

    public Map<String, Availability> getAvailability() {
        return availability;
    }

    public void setAvailability(Map<String, Availability> availability) {
        this.availability = availability == null ? new LinkedHashMap<>() : availability;
    }

    public RateLimiting getRateLimiting() {
        return rateLimiting;
    }

    public void setRateLimiting(RateLimiting rateLimiting) {
        this.rateLimiting = rateLimiting;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public boolean isKnownProvider(String name) {
        return name != null && providers.containsKey(name);
    }

    public Duration staleThresholdFor(String providerName) {
        Provider provider = providers.get(providerName);
        Integer hours = provider == null ? null : provider.getStaleAfterHours();
        int safeHours = hours == null ? health.getDefaultStaleAfterHours() : Math.max(1, hours);
        return Duration.ofHours(safeHours);
    }

    public String quotaCategoryFor(String providerName) {
        Provider provider = providers.get(providerName);
        if (provider == null || provider.getQuotaCategory() == null || provider.getQuotaCategory().isBlank()) {
            return providerName;
        }
        return provider.getQuotaCategory().trim();
    }

    public static class Workers {
        private boolean enabled = true;
        private int shutdownTimeoutSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, shutdownTimeoutSeconds);
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = Math.max(1, shutdownTimeoutSeconds);
        }
    }

    public static class Health {
        private int degradedAfterFailures = 1;
        private int defaultStaleAfterHours = 48;

        public int getDegradedAfterFailures() {
            return Math.max(1, degradedAfterFailures);
        }

        public void setDegradedAfterFailures(int degradedAfterFailures) {
            this.degradedAfterFailures = Math.max(1, degradedAfterFailures);
        }

        public int getDefaultStaleAfterHours() {
            return Math.max(1, defaultStaleAfterHours);
        }

        public void setDefaultStaleAfterHours(int defaultStaleAfterHours) {
            this.defaultStaleAfterHours = Math.max(1, defaultStaleAfterHours);
        }
    }

    public static class Provider {
        private boolean enabled = true;
        private int syncHourUtc = 3;
        private DayOfWeek syncWeekday;
        private Integer staleAfterHours;
        private String quotaCategory;
        private List<String> followOnJobTypes = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getSyncHourUtc() {
            return syncHourUtc;
        }

        public void setSyncHourUtc(int syncHourUtc) {
            this.syncHourUtc = syncHourUtc;
        }

        public DayOfWeek getSyncWeekday() {
            return syncWeekday;
        }

        public void setSyncWeekday(DayOfWeek syncWeekday) {
            this.syncWeekday = syncWeekday;
        }

        public Integer getStaleAfterHours() {
            return staleAfterHours;
        }

        public void setStaleAfterHours(Integer staleAfterHours) {
            this.staleAfterHours = staleAfterHours;
        }

        public String getQuotaCategory() {
            return quotaCategory;
        }

        public void setQuotaCategory(String quotaCategory) {
            this.quotaCategory = quotaCategory;
        }

        public List<String> getFollowOnJobTypes() {
            return followOnJobTypes;
        }

        public void setFollowOnJobTypes(List<String> followOnJobTypes) {
            this.followOnJobTypes = followOnJobTypes == null ? new ArrayList<>() : followOnJobTypes;
        }

        public SyncSchedule toSchedule() {
            return syncWeekday == null
                ? SyncSchedule.daily(syncHourUtc)
                : SyncSchedule.weekly(syncWeekday, syncHourUtc);
        }
    }

    public static class Quota {
        private int hardDailyLimit;
        private int operationalCap;
        private int safetyReserve;
        private int resetHourUtc;
        private Map<String, Integer> subFeatures = new LinkedHashMap<>();

        public int getHardDailyLimit() {
            return hardDailyLimit;
        }

        public void setHardDailyLimit(int hardDailyLimit) {
            this.hardDailyLimit = hardDailyLimit;
        }

        public int getOperationalCap() {
            return operationalCap;
        }

        public void setOperationalCap(int operationalCap) {
            this.operationalCap = operationalCap;
        }

        public int getSafetyReserve() {
            return safetyReserve;
        }

        public void setSafetyReserve(int safetyReserve) {
            this.safetyReserve = safetyReserve;
        }

        public int getResetHourUtc() {
            return resetHourUtc;
        }

        public void setResetHourUtc(int resetHourUtc) {
            this.resetHourUtc = resetHourUtc;
        }

        public Map<String, Integer> getSubFeatures() {
            return subFeatures;
        }

        public void setSubFeatures(Map<String, Integer> subFeatures) {
            this.subFeatures = subFeatures == null ? new LinkedHashMap<>() : subFeatures;
        }

        public QuotaPolicy toPolicy(String category) {
            return new QuotaPolicy(
                category,
                hardDailyLimit,
                operationalCap,
                safetyReserve,
                resetHourUtc,
                subFeatures
            );
        }
    }

    public static class Availability {
        private List<String> fresh = new ArrayList<>();
        private List<String> operational = new ArrayList<>();

        public List<String> getFresh() {
            return fresh;
        }

        public void setFresh(List<String> fresh) {
            this.fresh = fresh == null ? new ArrayList<>() : fresh;
        }

        public List<String> getOperational() {
            return operational;
        }

        public void setOperational(List<String> operational) {
            this.operational = operational == null ? new ArrayList<>() : operational;
        }
    }

    public static class RateLimiting {
        private boolean enabled = true;
        private int tokenLimit = 100;
        private int tokensPerPeriod = 100;
        private int replenishPeriodSeconds = 60;
        private int queueLimit = 0;
        private List<String> exemptPaths = new ArrayList<>(List.of("/health", "/actuator/health"));
        private long partitionCacheMaxSize = 10_000;
        private int partitionIdleMinutes = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTokenLimit() {
            return Math.max(1, tokenLimit);
        }

        public void setTokenLimit(int tokenLimit) {
            this.tokenLimit = Math.max(1, tokenLimit);
        }

        public int getTokensPerPeriod() {
            return Math.max(1, tokensPerPeriod);
        }

        public void setTokensPerPeriod(int tokensPerPeriod) {
            this.tokensPerPeriod = Math.max(1, tokensPerPeriod);
        }

        public int getReplenishPeriodSeconds() {
            return Math.max(1, replenishPeriodSeconds);
        }

        public void setReplenishPeriodSeconds(int replenishPeriodSeconds) {
            this.replenishPeriodSeconds = Math.max(1, replenishPeriodSeconds);
        }

        public int getQueueLimit() {
            return Math.max(0, queueLimit);
        }

        public void setQueueLimit(int queueLimit) {
            this.queueLimit = Math.max(0, queueLimit);
        }

        public List<String> getExemptPaths() {
            return exemptPaths;
        }

        public void setExemptPaths(List<String> exemptPaths) {
            this.exemptPaths = exemptPaths == null ? new ArrayList<>() : exemptPaths;
        }

        public long getPartitionCacheMaxSize() {
            return Math.max(1, partitionCacheMaxSize);
        }

        public void setPartitionCacheMaxSize(long partitionCacheMaxSize) {
            this.partitionCacheMaxSize = Math.max(1, partitionCacheMaxSize);
        }

        public int getPartitionIdleMinutes() {
            return Math.max(1, partitionIdleMinutes);
        }

        public void setPartitionIdleMinutes(int partitionIdleMinutes) {
            this.partitionIdleMinutes = Math.max(1, partitionIdleMinutes);
        }
    }

    public static class Jobs {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private int maxErrorLength = 4000;
        private Worker worker = new Worker();

        public int getDefaultPageSize() {
            return Math.max(1, Math.min(defaultPageSize, getMaxPageSize()));
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }

        public int getMaxPageSize() {
            return Math.max(1, maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = Math.max(1, maxPageSize);
        }

        public int getMaxErrorLength() {
            return Math.max(1, maxErrorLength);
        }

        public void setMaxErrorLength(int maxErrorLength) {
            this.maxErrorLength = Math.max(1, maxErrorLength);
        }

        public Worker getWorker() {
            return worker;
        }

        public void setWorker(Worker worker) {
            this.worker = worker;
        }
    }

    public static class Worker {
        private boolean enabled = false;
        private int pollIntervalMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }
}
