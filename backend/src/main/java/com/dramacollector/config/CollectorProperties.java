package com.dramacollector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {
    private static final String DEFAULT_USER_AGENT = "drama-collector/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Processing processing = new Processing();
    private Aggregation aggregation = new Aggregation();
    private Scheduler scheduler = new Scheduler();
    private History history = new History();
    private Export export = new Export();
    private Cli cli = new Cli();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Processing getProcessing() {
        return processing;
    }

    public void setProcessing(Processing processing) {
        this.processing = processing;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Processing {
        private int maxConcurrentJobs = 1;
        private double qualityThreshold = 7.0;
        private String validationLevel = "MODERATE";
        private int defaultRequestedCount = 20;

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }

        public double getQualityThreshold() {
            return Math.max(0.0, Math.min(10.0, qualityThreshold));
        }

        public void setQualityThreshold(double qualityThreshold) {
            this.qualityThreshold = Math.max(0.0, Math.min(10.0, qualityThreshold));
        }

        public String getValidationLevel() {
            return validationLevel;
        }

        public void setValidationLevel(String validationLevel) {
            this.validationLevel = validationLevel;
        }

        public int getDefaultRequestedCount() {
            return Math.max(1, defaultRequestedCount);
        }

        public void setDefaultRequestedCount(int defaultRequestedCount) {
            this.defaultRequestedCount = Math.max(1, defaultRequestedCount);
        }
    }

    public static class Aggregation {
        private boolean enrichDetails = false;
        private double corroborationBonus = 0.05;
        private long maxRetryDelayMs = 30_000;

        public boolean isEnrichDetails() {
            return enrichDetails;
        }

        public void setEnrichDetails(boolean enrichDetails) {
            this.enrichDetails = enrichDetails;
        }

        public double getCorroborationBonus() {
            return Math.max(0.0, corroborationBonus);
        }

        public void setCorroborationBonus(double corroborationBonus) {
            this.corroborationBonus = Math.max(0.0, corroborationBonus);
        }

        public long getMaxRetryDelayMs() {
            return Math.max(0, maxRetryDelayMs);
        }

        public void setMaxRetryDelayMs(long maxRetryDelayMs) {
            this.maxRetryDelayMs = Math.max(0, maxRetryDelayMs);
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int collectionIntervalHours = 6;
        private int maintenanceHour = 2;
        private boolean autoRetryFailedJobs = true;
        private int scheduledRetryAttempts = 1;
        private int scheduledCount = 50;
        private int tickSeconds = 60;
        private int maxCollectionDurationHours = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCollectionIntervalHours() {
            return Math.max(1, collectionIntervalHours);
        }

        public void setCollectionIntervalHours(int collectionIntervalHours) {
            this.collectionIntervalHours = Math.max(1, collectionIntervalHours);
        }

        public int getMaintenanceHour() {
            return Math.floorMod(maintenanceHour, 24);
        }

        public void setMaintenanceHour(int maintenanceHour) {
            this.maintenanceHour = Math.floorMod(maintenanceHour, 24);
        }

        public boolean isAutoRetryFailedJobs() {
            return autoRetryFailedJobs;
        }

        public void setAutoRetryFailedJobs(boolean autoRetryFailedJobs) {
            this.autoRetryFailedJobs = autoRetryFailedJobs;
        }

        public int getScheduledRetryAttempts() {
            return Math.max(0, scheduledRetryAttempts);
        }

        public void setScheduledRetryAttempts(int scheduledRetryAttempts) {
            this.scheduledRetryAttempts = Math.max(0, scheduledRetryAttempts);
        }

        public int getScheduledCount() {
            return Math.max(1, scheduledCount);
        }

        public void setScheduledCount(int scheduledCount) {
            this.scheduledCount = Math.max(1, scheduledCount);
        }

        public int getTickSeconds() {
            return Math.max(1, tickSeconds);
        }

        public void setTickSeconds(int tickSeconds) {
            this.tickSeconds = Math.max(1, tickSeconds);
        }

        public int getMaxCollectionDurationHours() {
            return Math.max(1, maxCollectionDurationHours);
        }

        public void setMaxCollectionDurationHours(int maxCollectionDurationHours) {
            this.maxCollectionDurationHours = Math.max(1, maxCollectionDurationHours);
        }
    }

    public static class History {
        private int retentionHours = 24;
        private int maxJobs = 100;

        public int getRetentionHours() {
            return Math.max(1, retentionHours);
        }

        public void setRetentionHours(int retentionHours) {
            this.retentionHours = Math.max(1, retentionHours);
        }

        public int getMaxJobs() {
            return Math.max(1, maxJobs);
        }

        public void setMaxJobs(int maxJobs) {
            this.maxJobs = Math.max(1, maxJobs);
        }
    }

    public static class Export {
        private boolean enabled = true;
        private List<String> formats = new ArrayList<>(List.of("json", "csv"));
        private String outputDirectory = "./data/exports";
        private boolean includeMetadata = true;
        private boolean compress = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getFormats() {
            return formats;
        }

        public void setFormats(List<String> formats) {
            this.formats = formats == null ? new ArrayList<>() : formats;
        }

        public String getOutputDirectory() {
            return outputDirectory;
        }

        public void setOutputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
        }

        public boolean isIncludeMetadata() {
            return includeMetadata;
        }

        public void setIncludeMetadata(boolean includeMetadata) {
            this.includeMetadata = includeMetadata;
        }

        public boolean isCompress() {
            return compress;
        }

        public void setCompress(boolean compress) {
            this.compress = compress;
        }
    }

    public static class Cli {
        private boolean run = false;
        private int count = 20;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getCount() {
            return Math.max(1, count);
        }

        public void setCount(int count) {
            this.count = Math.max(1, count);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Source {
        private String type = "api";
        private String baseUrl;
        private String apiKey;
        private int priority = 100;
        private double rateLimit = 1.0;
        private int burst = 1;
        private int maxRetries = 3;
        private long retryDelayMs = 1000;
        private int timeoutSeconds = 30;
        private boolean enabled = true;
        private int maxPages = 5;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public double getRateLimit() {
            return Math.max(0.0, rateLimit);
        }

        public void setRateLimit(double rateLimit) {
            this.rateLimit = Math.max(0.0, rateLimit);
        }

        public int getBurst() {
            return Math.max(1, burst);
        }

        public void setBurst(int burst) {
            this.burst = Math.max(1, burst);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public long getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }
}
