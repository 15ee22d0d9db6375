package de.mirkosertic.imagelocator.config;

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
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the image locator.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System property imagelocator.index.path
 * 2. Environment variable IMAGELOCATOR_INDEX_PATH
 * 3. User config file (~/.imagelocator/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * Malformed values are logged and ignored, the previous value stays in effect.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "IMAGELOCATOR_INDEX_PATH";
    private static final String PROP_INDEX_PATH = "imagelocator.index.path";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".imagelocator";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Index settings
    private String indexPath;

    // Scanner settings
    private List<String> imageExtensions = List.of("tif", "tiff");
    private List<String> excludePatterns = List.of();
    private int scanBatchSize = 1000;

    // Import settings
    private String identifierColumn = "hh_id";

    // Search settings
    private double defaultThreshold = 0.7;
    private int pageSize = 500;

    // Thread pools
    private int taskPoolSize = 4;
    private int workerPoolSize = 0;

    // Interactive loop
    private long pollIntervalMs = 50;

    // Profile settings
    private boolean deployedMode = false;

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

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: indexPath={}, extensions={}, deployedMode={}",
                config.indexPath, config.imageExtensions, config.deployedMode);

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
        final Map<String, Object> locatorConfig = (Map<String, Object>) config.get("locator");
        if (locatorConfig == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) locatorConfig.get("index");
        if (indexConfig != null) {
            final Object path = indexConfig.get("path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> scannerConfig = (Map<String, Object>) locatorConfig.get("scanner");
        if (scannerConfig != null) {
            applyScannerConfig(scannerConfig);
        }

        final Map<String, Object> importConfig = (Map<String, Object>) locatorConfig.get("import");
        if (importConfig != null && importConfig.get("identifier-column") != null) {
            this.identifierColumn = importConfig.get("identifier-column").toString().trim();
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) locatorConfig.get("search");
        if (searchConfig != null) {
            this.defaultThreshold = readNumber(searchConfig, "search", "default-threshold", defaultThreshold).doubleValue();
            this.pageSize = readNumber(searchConfig, "search", "page-size", pageSize).intValue();
        }

        final Map<String, Object> workersConfig = (Map<String, Object>) locatorConfig.get("workers");
        if (workersConfig != null) {
            this.taskPoolSize = readNumber(workersConfig, "workers", "task-pool-size", taskPoolSize).intValue();
            this.workerPoolSize = readNumber(workersConfig, "workers", "worker-pool-size", workerPoolSize).intValue();
        }

        final Map<String, Object> uiConfig = (Map<String, Object>) locatorConfig.get("ui");
        if (uiConfig != null) {
            this.pollIntervalMs = readNumber(uiConfig, "ui", "poll-interval-ms", pollIntervalMs).longValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyScannerConfig(final Map<String, Object> scannerConfig) {
        if (scannerConfig.containsKey("extensions")) {
            final Object extensions = scannerConfig.get("extensions");
            if (extensions instanceof List) {
                final List<String> normalized = new ArrayList<>();
                for (final Object extension : (List<Object>) extensions) {
                    normalized.add(normalizeExtension(String.valueOf(extension)));
                }
                this.imageExtensions = normalized;
            }
        }
        if (scannerConfig.containsKey("exclude-patterns")) {
            final Object patterns = scannerConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        this.scanBatchSize = readNumber(scannerConfig, "scanner", "batch-size", scanBatchSize).intValue();
    }

    private static Number readNumber(final Map<String, Object> section, final String sectionName,
                                     final String key, final Number current) {
        final Object value = section.get(key);
        if (value == null) {
            return current;
        }
        if (value instanceof final Number number) {
            return number;
        }
        logger.warn("Ignoring non-numeric value '{}' for locator.{}.{}, keeping {}", value, sectionName, key, current);
        return current;
    }

    private static String normalizeExtension(final String extension) {
        String result = extension.trim().toLowerCase(Locale.ROOT);
        while (result.startsWith(".")) {
            result = result.substring(1);
        }
        return result;
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        // Default index path if not set
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "index").toString();
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
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

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public List<String> getImageExtensions() {
        return imageExtensions;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public int getScanBatchSize() {
        return scanBatchSize;
    }

    public String getIdentifierColumn() {
        return identifierColumn;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getTaskPoolSize() {
        return taskPoolSize;
    }

    /**
     * Size of the pool used for scan filtering and search scoring.
     * A configured value of 0 or less means one thread per available processor.
     */
    public int getWorkerPoolSize() {
        if (workerPoolSize <= 0) {
            return Runtime.getRuntime().availableProcessors();
        }
        return workerPoolSize;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
