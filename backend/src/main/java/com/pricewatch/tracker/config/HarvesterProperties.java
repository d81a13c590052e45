package com.pricewatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";
    private static final String DEFAULT_ZONE = "Europe/Budapest";

    private String zoneId = DEFAULT_ZONE;
    private int workerCount = 5;
    private int freshnessWindowHours = 12;
    private int drainGraceSeconds = 60;
    private int requestTimeoutSeconds = 30;
    private Catalog catalog = new Catalog();
    private Fetch fetch = new Fetch();
    private Cli cli = new Cli();
    private Schedule schedule = new Schedule();

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId == null || zoneId.isBlank() ? DEFAULT_ZONE : zoneId.trim();
    }

    public ZoneId zone() {
        return ZoneId.of(getZoneId());
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getFreshnessWindowHours() {
        return Math.max(0, freshnessWindowHours);
    }

    public void setFreshnessWindowHours(int freshnessWindowHours) {
        this.freshnessWindowHours = Math.max(0, freshnessWindowHours);
    }

    public int getDrainGraceSeconds() {
        return Math.max(1, drainGraceSeconds);
    }

    public void setDrainGraceSeconds(int drainGraceSeconds) {
        this.drainGraceSeconds = Math.max(1, drainGraceSeconds);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Catalog {
        private String apiUrl = "https://xapi.tesco.com/v1/graphql";
        private String apiKey;
        private String region = "HU";
        private String language = "hu-HU";
        private String userAgent;
        private String mfeName = "mfe-pdp";
        private String sitemapIndexUrl = "https://bevasarlas.tesco.hu/sitemaps/hu-HU/groceries/products-index.xml";
        private String productPathSegment = "products";
        private String loyaltyAttribute = "CLUBCARD_PRICING";
        private String currencySuffix = "Ft";

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public String getMfeName() {
            return mfeName;
        }

        public void setMfeName(String mfeName) {
            this.mfeName = mfeName;
        }

        public String getSitemapIndexUrl() {
            return sitemapIndexUrl;
        }

        public void setSitemapIndexUrl(String sitemapIndexUrl) {
            this.sitemapIndexUrl = sitemapIndexUrl;
        }

        public String getProductPathSegment() {
            return productPathSegment;
        }

        public void setProductPathSegment(String productPathSegment) {
            this.productPathSegment = productPathSegment;
        }

        public String getLoyaltyAttribute() {
            return loyaltyAttribute;
        }

        public void setLoyaltyAttribute(String loyaltyAttribute) {
            this.loyaltyAttribute = loyaltyAttribute;
        }

        public String getCurrencySuffix() {
            return currencySuffix;
        }

        public void setCurrencySuffix(String currencySuffix) {
            this.currencySuffix = currencySuffix;
        }
    }

    public static class Fetch {
        private int maxAttempts = 5;
        private int retryBaseDelayMs = 2000;
        private int retryJitterMaxMs = 1000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryJitterMaxMs() {
            return Math.max(0, retryJitterMaxMs);
        }

        public void setRetryJitterMaxMs(int retryJitterMaxMs) {
            this.retryJitterMaxMs = Math.max(0, retryJitterMaxMs);
        }
    }

    public static class Cli {
        private boolean run;
        private String items = "";
        private boolean force;
        private int workers;
        private boolean exitAfterRun = true;
        private String legacyImportDir;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getItems() {
            return items;
        }

        public void setItems(String items) {
            this.items = items;
        }

        public boolean isForce() {
            return force;
        }

        public void setForce(boolean force) {
            this.force = force;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getLegacyImportDir() {
            return legacyImportDir;
        }

        public void setLegacyImportDir(String legacyImportDir) {
            this.legacyImportDir = legacyImportDir;
        }
    }

    public static class Schedule {
        private boolean enabled;
        private boolean runOnStartup;
        private String cron = "0 0 5 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }
}
