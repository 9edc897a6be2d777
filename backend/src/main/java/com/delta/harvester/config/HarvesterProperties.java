package com.delta.harvester.config;

import com.delta.harvester.harvest.model.StalePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "delta-listing-harvester/0.1 (+contact)";

    private Source source = new Source();
    private Scan scan = new Scan();
    private Retry retry = new Retry();
    private Breaker breaker = new Breaker();
    private FailedPages failedPages = new FailedPages();
    private Extraction extraction = new Extraction();
    private Filter filter = new Filter();
    private Delta delta = new Delta();
    private Storage storage = new Storage();
    private Cli cli = new Cli();

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public FailedPages getFailedPages() {
        return failedPages;
    }

    public void setFailedPages(FailedPages failedPages) {
        this.failedPages = failedPages;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Delta getDelta() {
        return delta;
    }

    public void setDelta(Delta delta) {
        this.delta = delta;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private String baseUrl = "https://bis.gov.lv";
        private String pageUrlTemplate = "https://bis.gov.lv/bisp/lv/planned_constructions?page={page}";
        private List<String> userAgents = new ArrayList<>();
        private int requestTimeoutSeconds = 30;
        private int minRequestIntervalMs = 1200;
        private List<String> errorPagePhrases = new ArrayList<>(List.of(
            "Serviss īslaicīgi nav pieejams",
            "Notikusi kļūda",
            "Service Unavailable",
            "Bad Gateway",
            "under maintenance"
        ));

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPageUrlTemplate() {
            return pageUrlTemplate;
        }

        public void setPageUrlTemplate(String pageUrlTemplate) {
            this.pageUrlTemplate = pageUrlTemplate;
        }

        public List<String> getUserAgents() {
            List<String> normalized = userAgents == null
                ? List.of()
                : userAgents.stream().filter(ua -> ua != null && !ua.isBlank()).map(String::trim).toList();
            return normalized.isEmpty() ? List.of(DEFAULT_USER_AGENT) : normalized;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMinRequestIntervalMs() {
            return Math.max(0, minRequestIntervalMs);
        }

        public void setMinRequestIntervalMs(int minRequestIntervalMs) {
            this.minRequestIntervalMs = Math.max(0, minRequestIntervalMs);
        }

        public List<String> getErrorPagePhrases() {
            return errorPagePhrases == null ? List.of() : errorPagePhrases;
        }

        public void setErrorPagePhrases(List<String> errorPagePhrases) {
            this.errorPagePhrases = errorPagePhrases;
        }
    }

    public static class Scan {
        private int pageCeiling = 300;
        private int buildPagesPerRun = 40;
        private int deltaWindowSize = 20;
        private int frontRefreshSize = 3;
        private int emptyPageTolerance = 2;
        private int runBudgetSeconds = 1500;

        public int getPageCeiling() {
            return Math.max(1, pageCeiling);
        }

        public void setPageCeiling(int pageCeiling) {
            this.pageCeiling = Math.max(1, pageCeiling);
        }

        public int getBuildPagesPerRun() {
            return Math.max(1, buildPagesPerRun);
        }

        public void setBuildPagesPerRun(int buildPagesPerRun) {
            this.buildPagesPerRun = Math.max(1, buildPagesPerRun);
        }

        /** Steady-state runs rescan pages 1 through this page, both ends included. */
        public int getDeltaWindowSize() {
            return Math.max(1, deltaWindowSize);
        }

        public void setDeltaWindowSize(int deltaWindowSize) {
            this.deltaWindowSize = Math.max(1, deltaWindowSize);
        }

        public int getFrontRefreshSize() {
            return Math.max(0, frontRefreshSize);
        }

        public void setFrontRefreshSize(int frontRefreshSize) {
            this.frontRefreshSize = Math.max(0, frontRefreshSize);
        }

        public int getEmptyPageTolerance() {
            return Math.max(1, emptyPageTolerance);
        }

        public void setEmptyPageTolerance(int emptyPageTolerance) {
            this.emptyPageTolerance = Math.max(1, emptyPageTolerance);
        }

        public int getRunBudgetSeconds() {
            return Math.max(1, runBudgetSeconds);
        }

        public void setRunBudgetSeconds(int runBudgetSeconds) {
            this.runBudgetSeconds = Math.max(1, runBudgetSeconds);
        }
    }

    public static class Retry {
        private int maxRetries = 2;
        private int baseDelayMs = 2000;
        private int maxDelayMs = 30000;
        private int maxJitterMs = 1000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getMaxJitterMs() {
            return Math.max(0, maxJitterMs);
        }

        public void setMaxJitterMs(int maxJitterMs) {
            this.maxJitterMs = Math.max(0, maxJitterMs);
        }
    }

    public static class Breaker {
        private int windowSize = 10;
        private double errorRatioThreshold = 0.6;
        private double backendErrorWeight = 1.5;
        private int cooldownSeconds = 60;
        private int maxCooldownsPerRun = 2;

        public int getWindowSize() {
            return Math.max(1, windowSize);
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = Math.max(1, windowSize);
        }

        public double getErrorRatioThreshold() {
            return Math.min(1.0, Math.max(0.01, errorRatioThreshold));
        }

        public void setErrorRatioThreshold(double errorRatioThreshold) {
            this.errorRatioThreshold = errorRatioThreshold;
        }

        public double getBackendErrorWeight() {
            return Math.max(1.0, backendErrorWeight);
        }

        public void setBackendErrorWeight(double backendErrorWeight) {
            this.backendErrorWeight = backendErrorWeight;
        }

        public int getCooldownSeconds() {
            return Math.max(0, cooldownSeconds);
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = Math.max(0, cooldownSeconds);
        }

        public int getMaxCooldownsPerRun() {
            return Math.max(0, maxCooldownsPerRun);
        }

        public void setMaxCooldownsPerRun(int maxCooldownsPerRun) {
            this.maxCooldownsPerRun = Math.max(0, maxCooldownsPerRun);
        }
    }

    public static class FailedPages {
        private int batchSize = 20;
        private int maxAttempts = 5;

        public int getBatchSize() {
            return Math.max(0, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(0, batchSize);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }
    }

    public static class Extraction {
        private String naturalKeyField = "bis_number";
        private List<String> hashFields = new ArrayList<>(List.of(
            "bis_number",
            "authority",
            "address",
            "object",
            "phase",
            "construction_type",
            "usage_code",
            "published"
        ));

        public String getNaturalKeyField() {
            return naturalKeyField;
        }

        public void setNaturalKeyField(String naturalKeyField) {
            this.naturalKeyField = naturalKeyField;
        }

        public List<String> getHashFields() {
            return hashFields == null ? List.of() : hashFields;
        }

        public void setHashFields(List<String> hashFields) {
            this.hashFields = hashFields;
        }
    }

    public static class Filter {
        private boolean enabled = true;
        private Set<String> authorities = new LinkedHashSet<>();
        private Set<String> phases = new LinkedHashSet<>();
        private Set<String> constructionTypes = new LinkedHashSet<>();
        private Set<String> excludedPhases = new LinkedHashSet<>(Set.of("Būvdarbi"));
        private List<String> excludedUsageCodePrefixes = new ArrayList<>(List.of("2"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Set<String> getAuthorities() {
            return authorities == null ? Set.of() : authorities;
        }

        public void setAuthorities(Set<String> authorities) {
            this.authorities = authorities;
        }

        public Set<String> getPhases() {
            return phases == null ? Set.of() : phases;
        }

        public void setPhases(Set<String> phases) {
            this.phases = phases;
        }

        public Set<String> getConstructionTypes() {
            return constructionTypes == null ? Set.of() : constructionTypes;
        }

        public void setConstructionTypes(Set<String> constructionTypes) {
            this.constructionTypes = constructionTypes;
        }

        public Set<String> getExcludedPhases() {
            return excludedPhases == null ? Set.of() : excludedPhases;
        }

        public void setExcludedPhases(Set<String> excludedPhases) {
            this.excludedPhases = excludedPhases;
        }

        public List<String> getExcludedUsageCodePrefixes() {
            return excludedUsageCodePrefixes == null ? List.of() : excludedUsageCodePrefixes;
        }

        public void setExcludedUsageCodePrefixes(List<String> excludedUsageCodePrefixes) {
            this.excludedUsageCodePrefixes = excludedUsageCodePrefixes;
        }
    }

    public static class Delta {
        private List<String> significantFields = new ArrayList<>(List.of(
            "phase",
            "construction_type",
            "intention_type",
            "usage_code",
            "address",
            "object"
        ));
        private boolean suppressUntilBaselineComplete = true;
        private StalePolicy stalePolicy = StalePolicy.KEEP;
        private int staleAfterDays = 90;

        public List<String> getSignificantFields() {
            return significantFields == null ? List.of() : significantFields;
        }

        public void setSignificantFields(List<String> significantFields) {
            this.significantFields = significantFields;
        }

        public boolean isSuppressUntilBaselineComplete() {
            return suppressUntilBaselineComplete;
        }

        public void setSuppressUntilBaselineComplete(boolean suppressUntilBaselineComplete) {
            this.suppressUntilBaselineComplete = suppressUntilBaselineComplete;
        }

        public StalePolicy getStalePolicy() {
            return stalePolicy == null ? StalePolicy.KEEP : stalePolicy;
        }

        public void setStalePolicy(StalePolicy stalePolicy) {
            this.stalePolicy = stalePolicy;
        }

        public int getStaleAfterDays() {
            return Math.max(1, staleAfterDays);
        }

        public void setStaleAfterDays(int staleAfterDays) {
            this.staleAfterDays = Math.max(1, staleAfterDays);
        }
    }

    public static class Storage {
        private String dataDir = "./data";
        private String reportsDir = "./reports";
        private boolean writeChangelog = true;
        private boolean writeSnapshotCsv = true;

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getReportsDir() {
            return reportsDir;
        }

        public void setReportsDir(String reportsDir) {
            this.reportsDir = reportsDir;
        }

        public boolean isWriteChangelog() {
            return writeChangelog;
        }

        public void setWriteChangelog(boolean writeChangelog) {
            this.writeChangelog = writeChangelog;
        }

        public boolean isWriteSnapshotCsv() {
            return writeSnapshotCsv;
        }

        public void setWriteSnapshotCsv(boolean writeSnapshotCsv) {
            this.writeSnapshotCsv = writeSnapshotCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
