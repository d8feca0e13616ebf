package de.mirkosertic.sheetwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the spreadsheet monitor.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.sheetwatch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_WATCH_FOLDERS = "SHEETWATCH_WATCH_FOLDERS";
    private static final String ENV_BASELINE_FOLDER = "SHEETWATCH_BASELINE_FOLDER";
    private static final String PROP_BASELINE_FOLDER = "sheetwatch.baseline.folder";
    private static final String PROP_MODE = "sheetwatch.mode";
    private static final String CONFIG_DIR = ".sheetwatch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Watch settings
    private List<String> watchFolders = new ArrayList<>();
    private List<String> supportedExtensions = List.of(".xlsx", ".xlsm");
    private List<String> lockFilePrefixes = List.of("~$");
    private long debounceMs = 2000;
    private long createSettleDelayMs = 100;
    private long watchPollIntervalMs = 2000;
    private int dispatchThreads = 2;

    // Baseline store settings
    private String baselineFolder;
    private String defaultCodec = "gzip";
    private String archiveCodec = "deflate";
    private int archiveAfterDays = 30;
    private int saveMaxAttempts = 5;
    private long saveBaseDelayMs = 200;

    // Polling settings
    private double pollingSizeThresholdMb = 10;
    private long densePollingIntervalMs = 5000;
    private long densePollingDurationMs = 15000;
    private long sparsePollingIntervalMs = 15000;
    private int maxConsecutiveFailedPolls = 3;
    private int pollingThreads = 4;

    // Extraction settings
    private long extractionTimeoutMs = 120_000;
    private boolean useLocalCache = true;
    private String cacheFolder;
    private long watchdogIntervalMs = 10_000;

    // Batch baseline settings
    private boolean scanAllOnStartup = true;
    private List<String> manualBaselineTargets = new ArrayList<>();
    private long memoryLimitMb = 2048;
    private long memoryPauseMs = 10_000;
    private boolean resumeEnabled = true;
    private String progressFile;

    // Audit settings
    private String auditFolder;
    private boolean reportIndirectChanges = false;
    private boolean refreshAuthorOnUnchanged = false;
    private List<String> whitelistUsers = new ArrayList<>();
    private boolean logWhitelistUserChanges = true;
    private List<String> forceBaselineOnFirstSeen = new ArrayList<>();

    // Mode
    private boolean serviceMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine mode
        config.determineMode();

        logger.info("Configuration loaded: baselineFolder={}, watchFolders={}, serviceMode={}",
                config.baselineFolder, config.watchFolders.size(), config.serviceMode);

        return config;
    }

    /**
     * Built-in defaults only, with all folders placed below the given root. Used by tests and tooling
     * that must not pick up the user's configuration.
     */
    public static ApplicationConfig defaults(final Path root) {
        final ApplicationConfig config = new ApplicationConfig();
        config.baselineFolder = root.resolve("baselines").toString();
        config.cacheFolder = root.resolve("cache").toString();
        config.auditFolder = root.resolve("audit").toString();
        config.progressFile = root.resolve("progress").resolve("baseline-progress.yaml").toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("sheetwatch");
        if (root == null) {
            return;
        }

        final Map<String, Object> watch = (Map<String, Object>) root.get("watch");
        if (watch != null) {
            applyWatchConfig(watch);
        }
        final Map<String, Object> baseline = (Map<String, Object>) root.get("baseline");
        if (baseline != null) {
            applyBaselineConfig(baseline);
        }
        final Map<String, Object> polling = (Map<String, Object>) root.get("polling");
        if (polling != null) {
            applyPollingConfig(polling);
        }
        final Map<String, Object> extraction = (Map<String, Object>) root.get("extraction");
        if (extraction != null) {
            applyExtractionConfig(extraction);
        }
        final Map<String, Object> batch = (Map<String, Object>) root.get("batch");
        if (batch != null) {
            applyBatchConfig(batch);
        }
        final Map<String, Object> audit = (Map<String, Object>) root.get("audit");
        if (audit != null) {
            applyAuditConfig(audit);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyWatchConfig(final Map<String, Object> watch) {
        if (watch.get("folders") instanceof List) {
            this.watchFolders = resolveAll((List<String>) watch.get("folders"));
        }
        if (watch.get("supported-extensions") instanceof List) {
            this.supportedExtensions = new ArrayList<>((List<String>) watch.get("supported-extensions"));
        }
        if (watch.get("lock-file-prefixes") instanceof List) {
            this.lockFilePrefixes = new ArrayList<>((List<String>) watch.get("lock-file-prefixes"));
        }
        if (watch.containsKey("debounce-ms")) {
            this.debounceMs = ((Number) watch.get("debounce-ms")).longValue();
        }
        if (watch.containsKey("create-settle-delay-ms")) {
            this.createSettleDelayMs = ((Number) watch.get("create-settle-delay-ms")).longValue();
        }
        if (watch.containsKey("poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) watch.get("poll-interval-ms")).longValue();
        }
        if (watch.containsKey("dispatch-threads")) {
            this.dispatchThreads = ((Number) watch.get("dispatch-threads")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyBaselineConfig(final Map<String, Object> baseline) {
        if (baseline.get("folder") != null) {
            this.baselineFolder = resolveVariables(baseline.get("folder").toString());
        }
        if (baseline.get("default-codec") != null) {
            this.defaultCodec = baseline.get("default-codec").toString();
        }
        if (baseline.get("archive-codec") != null) {
            this.archiveCodec = baseline.get("archive-codec").toString();
        }
        if (baseline.containsKey("archive-after-days")) {
            this.archiveAfterDays = ((Number) baseline.get("archive-after-days")).intValue();
        }
        if (baseline.containsKey("save-max-attempts")) {
            this.saveMaxAttempts = ((Number) baseline.get("save-max-attempts")).intValue();
        }
        if (baseline.containsKey("save-base-delay-ms")) {
            this.saveBaseDelayMs = ((Number) baseline.get("save-base-delay-ms")).longValue();
        }
        if (baseline.get("force-on-first-seen") instanceof List) {
            this.forceBaselineOnFirstSeen = new ArrayList<>((List<String>) baseline.get("force-on-first-seen"));
        }
    }

    private void applyPollingConfig(final Map<String, Object> polling) {
        if (polling.containsKey("size-threshold-mb")) {
            this.pollingSizeThresholdMb = ((Number) polling.get("size-threshold-mb")).doubleValue();
        }
        if (polling.containsKey("dense-interval-ms")) {
            this.densePollingIntervalMs = ((Number) polling.get("dense-interval-ms")).longValue();
        }
        if (polling.containsKey("dense-duration-ms")) {
            this.densePollingDurationMs = ((Number) polling.get("dense-duration-ms")).longValue();
        }
        if (polling.containsKey("sparse-interval-ms")) {
            this.sparsePollingIntervalMs = ((Number) polling.get("sparse-interval-ms")).longValue();
        }
        if (polling.containsKey("max-consecutive-failures")) {
            this.maxConsecutiveFailedPolls = ((Number) polling.get("max-consecutive-failures")).intValue();
        }
        if (polling.containsKey("threads")) {
            this.pollingThreads = ((Number) polling.get("threads")).intValue();
        }
    }

    private void applyExtractionConfig(final Map<String, Object> extraction) {
        if (extraction.containsKey("timeout-ms")) {
            this.extractionTimeoutMs = ((Number) extraction.get("timeout-ms")).longValue();
        }
        if (extraction.containsKey("use-local-cache")) {
            this.useLocalCache = (Boolean) extraction.get("use-local-cache");
        }
        if (extraction.get("cache-folder") != null) {
            this.cacheFolder = resolveVariables(extraction.get("cache-folder").toString());
        }
        if (extraction.containsKey("watchdog-interval-ms")) {
            this.watchdogIntervalMs = ((Number) extraction.get("watchdog-interval-ms")).longValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyBatchConfig(final Map<String, Object> batch) {
        if (batch.containsKey("scan-all-on-startup")) {
            this.scanAllOnStartup = (Boolean) batch.get("scan-all-on-startup");
        }
        if (batch.get("manual-targets") instanceof List) {
            this.manualBaselineTargets = resolveAll((List<String>) batch.get("manual-targets"));
        }
        if (batch.containsKey("memory-limit-mb")) {
            this.memoryLimitMb = ((Number) batch.get("memory-limit-mb")).longValue();
        }
        if (batch.containsKey("memory-pause-ms")) {
            this.memoryPauseMs = ((Number) batch.get("memory-pause-ms")).longValue();
        }
        if (batch.containsKey("resume-enabled")) {
            this.resumeEnabled = (Boolean) batch.get("resume-enabled");
        }
        if (batch.get("progress-file") != null) {
            this.progressFile = resolveVariables(batch.get("progress-file").toString());
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAuditConfig(final Map<String, Object> audit) {
        if (audit.get("folder") != null) {
            this.auditFolder = resolveVariables(audit.get("folder").toString());
        }
        if (audit.containsKey("report-indirect-changes")) {
            this.reportIndirectChanges = (Boolean) audit.get("report-indirect-changes");
        }
        if (audit.containsKey("refresh-author-on-unchanged")) {
            this.refreshAuthorOnUnchanged = (Boolean) audit.get("refresh-author-on-unchanged");
        }
        if (audit.get("whitelist-users") instanceof List) {
            this.whitelistUsers = new ArrayList<>((List<String>) audit.get("whitelist-users"));
        }
        if (audit.containsKey("log-whitelist-user-changes")) {
            this.logWhitelistUserChanges = (Boolean) audit.get("log-whitelist-user-changes");
        }
    }

    private void applyEnvironmentOverrides() {
        final String envBaselineFolder = System.getenv(ENV_BASELINE_FOLDER);
        if (envBaselineFolder != null && !envBaselineFolder.trim().isEmpty()) {
            this.baselineFolder = envBaselineFolder.trim();
            logger.info("Baseline folder from environment: {}", this.baselineFolder);
        }

        // Watch folders from environment (overrides all other sources)
        final String envFolders = System.getenv(ENV_WATCH_FOLDERS);
        if (envFolders != null && !envFolders.trim().isEmpty()) {
            this.watchFolders = new ArrayList<>();
            for (final String folder : envFolders.split(",")) {
                final String trimmed = folder.trim();
                if (!trimmed.isEmpty()) {
                    this.watchFolders.add(trimmed);
                }
            }
            logger.info("Watch folders from environment: {}", this.watchFolders);
        }

        final String propBaselineFolder = System.getProperty(PROP_BASELINE_FOLDER);
        if (propBaselineFolder != null && !propBaselineFolder.isEmpty()) {
            this.baselineFolder = propBaselineFolder;
        }

        // Defaults for every folder that is still unset
        final Path configDirectory = getConfigDirectory();
        if (this.baselineFolder == null || this.baselineFolder.isEmpty()) {
            this.baselineFolder = configDirectory.resolve("baselines").toString();
        }
        if (this.cacheFolder == null || this.cacheFolder.isEmpty()) {
            this.cacheFolder = configDirectory.resolve("cache").toString();
        }
        if (this.auditFolder == null || this.auditFolder.isEmpty()) {
            this.auditFolder = configDirectory.resolve("audit").toString();
        }
        if (this.progressFile == null || this.progressFile.isEmpty()) {
            this.progressFile = configDirectory.resolve("baseline-progress.yaml").toString();
        }
    }

    private void determineMode() {
        this.serviceMode = isServiceModeRequested();
    }

    /**
     * Whether {@code -Dsheetwatch.mode=service} was given. Readable before any configuration is loaded.
     */
    public static boolean isServiceModeRequested() {
        return "service".equalsIgnoreCase(System.getProperty(PROP_MODE, "console"));
    }

    private List<String> resolveAll(final List<String> values) {
        final List<String> result = new ArrayList<>();
        for (final String value : values) {
            result.add(resolveVariables(value));
        }
        return result;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters and setters

    public List<String> getWatchFolders() {
        return watchFolders;
    }

    public void setWatchFolders(final List<String> watchFolders) {
        this.watchFolders = new ArrayList<>(watchFolders);
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public void setSupportedExtensions(final List<String> supportedExtensions) {
        this.supportedExtensions = new ArrayList<>(supportedExtensions);
    }

    public List<String> getLockFilePrefixes() {
        return lockFilePrefixes;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(final long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public long getCreateSettleDelayMs() {
        return createSettleDelayMs;
    }

    public void setCreateSettleDelayMs(final long createSettleDelayMs) {
        this.createSettleDelayMs = createSettleDelayMs;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public void setWatchPollIntervalMs(final long watchPollIntervalMs) {
        this.watchPollIntervalMs = watchPollIntervalMs;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public String getBaselineFolder() {
        return baselineFolder;
    }

    public String getDefaultCodec() {
        return defaultCodec;
    }

    public void setDefaultCodec(final String defaultCodec) {
        this.defaultCodec = defaultCodec;
    }

    public String getArchiveCodec() {
        return archiveCodec;
    }

    public int getArchiveAfterDays() {
        return archiveAfterDays;
    }

    public void setArchiveAfterDays(final int archiveAfterDays) {
        this.archiveAfterDays = archiveAfterDays;
    }

    public int getSaveMaxAttempts() {
        return saveMaxAttempts;
    }

    public void setSaveMaxAttempts(final int saveMaxAttempts) {
        this.saveMaxAttempts = saveMaxAttempts;
    }

    public long getSaveBaseDelayMs() {
        return saveBaseDelayMs;
    }

    public void setSaveBaseDelayMs(final long saveBaseDelayMs) {
        this.saveBaseDelayMs = saveBaseDelayMs;
    }

    public double getPollingSizeThresholdMb() {
        return pollingSizeThresholdMb;
    }

    public void setPollingSizeThresholdMb(final double pollingSizeThresholdMb) {
        this.pollingSizeThresholdMb = pollingSizeThresholdMb;
    }

    public long getDensePollingIntervalMs() {
        return densePollingIntervalMs;
    }

    public void setDensePollingIntervalMs(final long densePollingIntervalMs) {
        this.densePollingIntervalMs = densePollingIntervalMs;
    }

    public long getDensePollingDurationMs() {
        return densePollingDurationMs;
    }

    public void setDensePollingDurationMs(final long densePollingDurationMs) {
        this.densePollingDurationMs = densePollingDurationMs;
    }

    public long getSparsePollingIntervalMs() {
        return sparsePollingIntervalMs;
    }

    public void setSparsePollingIntervalMs(final long sparsePollingIntervalMs) {
        this.sparsePollingIntervalMs = sparsePollingIntervalMs;
    }

    public int getMaxConsecutiveFailedPolls() {
        return maxConsecutiveFailedPolls;
    }

    public void setMaxConsecutiveFailedPolls(final int maxConsecutiveFailedPolls) {
        this.maxConsecutiveFailedPolls = maxConsecutiveFailedPolls;
    }

    public int getPollingThreads() {
        return pollingThreads;
    }

    public long getExtractionTimeoutMs() {
        return extractionTimeoutMs;
    }

    public void setExtractionTimeoutMs(final long extractionTimeoutMs) {
        this.extractionTimeoutMs = extractionTimeoutMs;
    }

    public boolean isUseLocalCache() {
        return useLocalCache;
    }

    public void setUseLocalCache(final boolean useLocalCache) {
        this.useLocalCache = useLocalCache;
    }

    public String getCacheFolder() {
        return cacheFolder;
    }

    public long getWatchdogIntervalMs() {
        return watchdogIntervalMs;
    }

    public boolean isScanAllOnStartup() {
        return scanAllOnStartup;
    }

    public void setScanAllOnStartup(final boolean scanAllOnStartup) {
        this.scanAllOnStartup = scanAllOnStartup;
    }

    public List<String> getManualBaselineTargets() {
        return manualBaselineTargets;
    }

    public void setManualBaselineTargets(final List<String> manualBaselineTargets) {
        this.manualBaselineTargets = new ArrayList<>(manualBaselineTargets);
    }

    public long getMemoryLimitMb() {
        return memoryLimitMb;
    }

    public void setMemoryLimitMb(final long memoryLimitMb) {
        this.memoryLimitMb = memoryLimitMb;
    }

    public long getMemoryPauseMs() {
        return memoryPauseMs;
    }

    public void setMemoryPauseMs(final long memoryPauseMs) {
        this.memoryPauseMs = memoryPauseMs;
    }

    public boolean isResumeEnabled() {
        return resumeEnabled;
    }

    public void setResumeEnabled(final boolean resumeEnabled) {
        this.resumeEnabled = resumeEnabled;
    }

    public String getProgressFile() {
        return progressFile;
    }

    public String getAuditFolder() {
        return auditFolder;
    }

    public boolean isReportIndirectChanges() {
        return reportIndirectChanges;
    }

    public void setReportIndirectChanges(final boolean reportIndirectChanges) {
        this.reportIndirectChanges = reportIndirectChanges;
    }

    public boolean isRefreshAuthorOnUnchanged() {
        return refreshAuthorOnUnchanged;
    }

    public void setRefreshAuthorOnUnchanged(final boolean refreshAuthorOnUnchanged) {
        this.refreshAuthorOnUnchanged = refreshAuthorOnUnchanged;
    }

    public List<String> getWhitelistUsers() {
        return whitelistUsers;
    }

    public void setWhitelistUsers(final List<String> whitelistUsers) {
        this.whitelistUsers = new ArrayList<>(whitelistUsers);
    }

    public boolean isLogWhitelistUserChanges() {
        return logWhitelistUserChanges;
    }

    public void setLogWhitelistUserChanges(final boolean logWhitelistUserChanges) {
        this.logWhitelistUserChanges = logWhitelistUserChanges;
    }

    public List<String> getForceBaselineOnFirstSeen() {
        return forceBaselineOnFirstSeen;
    }

    public void setForceBaselineOnFirstSeen(final List<String> forceBaselineOnFirstSeen) {
        this.forceBaselineOnFirstSeen = new ArrayList<>(forceBaselineOnFirstSeen);
    }

    public boolean isServiceMode() {
        return serviceMode;
    }
}
