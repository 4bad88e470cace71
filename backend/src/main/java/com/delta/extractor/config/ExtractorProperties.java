package com.delta.extractor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {
    private static final String DEFAULT_USER_AGENT = "resilient-extractor/0.1 (+contact)";

    private Http http = new Http();
    private Retry retry = new Retry();
    private Breaker breaker = new Breaker();
    private Transfer transfer = new Transfer();
    private Artifact artifact = new Artifact();
    private State state = new State();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
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

    public Transfer getTransfer() {
        return transfer;
    }

    public void setTransfer(Transfer transfer) {
        this.transfer = transfer;
    }

    public Artifact getArtifact() {
        return artifact;
    }

    public void setArtifact(Artifact artifact) {
        this.artifact = artifact;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
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

    public static class Http {
        private String userAgent;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;
        private int globalConcurrency = 5;
        private int perHostDelayMs = 800;
        private int rateLimitBackoffSeconds = 30;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(0, perHostDelayMs);
        }

        public int getRateLimitBackoffSeconds() {
            return Math.max(0, rateLimitBackoffSeconds);
        }

        public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
            this.rateLimitBackoffSeconds = rateLimitBackoffSeconds;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private double backoffBase = 2.0;
        private double jitterMaxSeconds = 1.0;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public double getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(double backoffBase) {
            this.backoffBase = Math.max(0.0, backoffBase);
        }

        public double getJitterMaxSeconds() {
            return jitterMaxSeconds;
        }

        public void setJitterMaxSeconds(double jitterMaxSeconds) {
            this.jitterMaxSeconds = Math.max(0.0, jitterMaxSeconds);
        }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private long recoveryTimeoutSeconds = 60;
        private int recoveryThreshold = 2;

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public long getRecoveryTimeoutSeconds() {
            return Math.max(0, recoveryTimeoutSeconds);
        }

        public void setRecoveryTimeoutSeconds(long recoveryTimeoutSeconds) {
            this.recoveryTimeoutSeconds = Math.max(0, recoveryTimeoutSeconds);
        }

        public int getRecoveryThreshold() {
            return Math.max(1, recoveryThreshold);
        }

        public void setRecoveryThreshold(int recoveryThreshold) {
            this.recoveryThreshold = Math.max(1, recoveryThreshold);
        }
    }

    public static class Transfer {
        private int chunkSizeBytes = 1024 * 1024;
        private int checkpointIntervalChunks = 10;
        private int maxConcurrentTransfers = 3;
        private String partSuffix = ".part";
        private String outputDir = "./downloads";
        private int drainTimeoutSeconds = 30;

        public int getChunkSizeBytes() {
            return Math.max(1, chunkSizeBytes);
        }

        public void setChunkSizeBytes(int chunkSizeBytes) {
            this.chunkSizeBytes = Math.max(1, chunkSizeBytes);
        }

        public int getCheckpointIntervalChunks() {
            return Math.max(1, checkpointIntervalChunks);
        }

        public void setCheckpointIntervalChunks(int checkpointIntervalChunks) {
            this.checkpointIntervalChunks = Math.max(1, checkpointIntervalChunks);
        }

        public int getMaxConcurrentTransfers() {
            return Math.max(1, maxConcurrentTransfers);
        }

        public void setMaxConcurrentTransfers(int maxConcurrentTransfers) {
            this.maxConcurrentTransfers = Math.max(1, maxConcurrentTransfers);
        }

        public String getPartSuffix() {
            return partSuffix == null || partSuffix.isBlank() ? ".part" : partSuffix;
        }

        public void setPartSuffix(String partSuffix) {
            this.partSuffix = partSuffix;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public int getDrainTimeoutSeconds() {
            return Math.max(1, drainTimeoutSeconds);
        }

        public void setDrainTimeoutSeconds(int drainTimeoutSeconds) {
            this.drainTimeoutSeconds = drainTimeoutSeconds;
        }
    }

    public static class Artifact {
        private String documentUrl = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
        private String baseUrl = "https://www.youtube.com";
        private long ttlSeconds = 3600;
        private int cacheSize = 10;
        private int maxWorkers = 2;
        private int extractionTimeoutSeconds = 10;
        private String extractionMethodVersion = "2.0";
        private String defaultSignatureTimestamp = "19000";
        private List<String> referencePatterns = new ArrayList<>(List.of(
            "\"jsUrl\"\\s*:\\s*\"(/s/player/[^\"]+/player[^\"]+\\.js)\""
        ));
        private String referenceScriptSrcPattern = "/s/player/[^\"']+\\.js";
        private List<String> signatureTimestampPatterns = new ArrayList<>(List.of(
            "sts[\"']?\\s*:\\s*(\\d+)",
            "signatureTimestamp[\"']?\\s*:\\s*(\\d+)"
        ));
        private List<String> decipherPatterns = new ArrayList<>(List.of(
            "\\.sig\\|\\|([a-zA-Z0-9$]+)\\(",
            "signature=([a-zA-Z0-9$]+)\\(",
            "\\.s\\)\\s*&&\\s*\\w+\\.set\\([^,]+,\\s*([a-zA-Z0-9$]+)\\("
        ));
        private List<String> throttlePatterns = new ArrayList<>(List.of(
            "&&\\(b=([a-zA-Z0-9$]+)(\\[[\\w\\d]+\\])\\([a-zA-Z]\\)",
            "\\(b\\.s\\|\\|([a-zA-Z0-9$]+)\\["
        ));
        private double driftFailureThreshold = 0.2;
        private int driftMinSamples = 10;

        public String getDocumentUrl() {
            return documentUrl;
        }

        public void setDocumentUrl(String documentUrl) {
            this.documentUrl = documentUrl;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getTtlSeconds() {
            return Math.max(0, ttlSeconds);
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = Math.max(0, ttlSeconds);
        }

        public int getCacheSize() {
            return Math.max(1, cacheSize);
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = Math.max(1, cacheSize);
        }

        public int getMaxWorkers() {
            return Math.max(1, maxWorkers);
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(1, maxWorkers);
        }

        public int getExtractionTimeoutSeconds() {
            return Math.max(1, extractionTimeoutSeconds);
        }

        public void setExtractionTimeoutSeconds(int extractionTimeoutSeconds) {
            this.extractionTimeoutSeconds = extractionTimeoutSeconds;
        }

        public String getExtractionMethodVersion() {
            return extractionMethodVersion;
        }

        public void setExtractionMethodVersion(String extractionMethodVersion) {
            this.extractionMethodVersion = extractionMethodVersion;
        }

        public String getDefaultSignatureTimestamp() {
            return defaultSignatureTimestamp;
        }

        public void setDefaultSignatureTimestamp(String defaultSignatureTimestamp) {
            this.defaultSignatureTimestamp = defaultSignatureTimestamp;
        }

        public List<String> getReferencePatterns() {
            return referencePatterns;
        }

        public void setReferencePatterns(List<String> referencePatterns) {
            this.referencePatterns = referencePatterns;
        }

        public String getReferenceScriptSrcPattern() {
            return referenceScriptSrcPattern;
        }

        public void setReferenceScriptSrcPattern(String referenceScriptSrcPattern) {
            this.referenceScriptSrcPattern = referenceScriptSrcPattern;
        }

        public List<String> getSignatureTimestampPatterns() {
            return signatureTimestampPatterns;
        }

        public void setSignatureTimestampPatterns(List<String> signatureTimestampPatterns) {
            this.signatureTimestampPatterns = signatureTimestampPatterns;
        }

        public List<String> getDecipherPatterns() {
            return decipherPatterns;
        }

        public void setDecipherPatterns(List<String> decipherPatterns) {
            this.decipherPatterns = decipherPatterns;
        }

        public List<String> getThrottlePatterns() {
            return throttlePatterns;
        }

        public void setThrottlePatterns(List<String> throttlePatterns) {
            this.throttlePatterns = throttlePatterns;
        }

        public double getDriftFailureThreshold() {
            return driftFailureThreshold;
        }

        public void setDriftFailureThreshold(double driftFailureThreshold) {
            this.driftFailureThreshold = driftFailureThreshold;
        }

        public int getDriftMinSamples() {
            return Math.max(1, driftMinSamples);
        }

        public void setDriftMinSamples(int driftMinSamples) {
            this.driftMinSamples = driftMinSamples;
        }
    }

    public static class State {
        private String dir = "./.extractor-state";
        private boolean cleanupEnabled = false;
        private int artifactMaxAgeHours = 24;
        private long cleanupInitialDelayMs = 60_000L;
        private long cleanupIntervalMs = 3_600_000L;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public int getArtifactMaxAgeHours() {
            return Math.max(1, artifactMaxAgeHours);
        }

        public void setArtifactMaxAgeHours(int artifactMaxAgeHours) {
            this.artifactMaxAgeHours = artifactMaxAgeHours;
        }

        public long getCleanupInitialDelayMs() {
            return Math.max(0L, cleanupInitialDelayMs);
        }

        public void setCleanupInitialDelayMs(long cleanupInitialDelayMs) {
            this.cleanupInitialDelayMs = cleanupInitialDelayMs;
        }

        public long getCleanupIntervalMs() {
            return Math.max(1_000L, cleanupIntervalMs);
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean resumeIncomplete;
        private String url = "";
        private String target = "";
        private String jobId = "";
        private String resourceId = "";
        private String variantId = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isResumeIncomplete() {
            return resumeIncomplete;
        }

        public void setResumeIncomplete(boolean resumeIncomplete) {
            this.resumeIncomplete = resumeIncomplete;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public String getJobId() {
            return jobId;
        }

        public void setJobId(String jobId) {
            this.jobId = jobId;
        }

        public String getResourceId() {
            return resourceId;
        }

        public void setResourceId(String resourceId) {
            this.resourceId = resourceId;
        }

        public String getVariantId() {
            return variantId;
        }

        public void setVariantId(String variantId) {
            this.variantId = variantId;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
