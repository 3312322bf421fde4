package im.arun.jsonnav.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final JsonNavConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private JsonNavConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), JsonNavConfig.class);
                }
                logger.warn("Config file {} does not exist, falling back to classpath", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, JsonNavConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new JsonNavConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new JsonNavConfig();
        }
    }

    public JsonNavConfig load() {
        return load(null);
    }

    public JsonNavConfig load(Map<String, Object> userOptions) {
        JsonNavConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "max_document_bytes":
                    case "maxDocumentBytes":
                        config.setMaxDocumentBytes(toLong(value));
                        break;
                    case "max_depth":
                    case "maxDepth":
                        config.setMaxDepth(toInt(value));
                        break;
                    case "allow_comments":
                    case "allowComments":
                        config.setAllowComments(parseBoolean(value));
                        break;
                    case "allow_trailing_commas":
                    case "allowTrailingCommas":
                        config.setAllowTrailingCommas(parseBoolean(value));
                        break;
                    case "child_limit":
                    case "childLimit":
                        config.setChildLimit(toInt(value));
                        break;
                    case "batch_size":
                    case "batchSize":
                        config.setBatchSize(toInt(value));
                        break;
                    case "display_value_max_length":
                    case "displayValueMaxLength":
                        config.setDisplayValueMaxLength(toInt(value));
                        break;
                    case "max_concurrent_loads":
                    case "maxConcurrentLoads":
                        config.setMaxConcurrentLoads(toInt(value));
                        break;
                    case "load_timeout_millis":
                    case "loadTimeoutMillis":
                        config.setLoadTimeoutMillis(toLong(value));
                        break;
                    case "memory_monitor_enabled":
                    case "memoryMonitorEnabled":
                        config.setMemoryMonitorEnabled(parseBoolean(value));
                        break;
                    case "sampling_interval_millis":
                    case "samplingIntervalMillis":
                        config.setSamplingIntervalMillis(toLong(value));
                        break;
                    case "warning_threshold_bytes":
                    case "warningThresholdBytes":
                        config.setWarningThresholdBytes(toLong(value));
                        break;
                    case "critical_threshold_bytes":
                    case "criticalThresholdBytes":
                        config.setCriticalThresholdBytes(toLong(value));
                        break;
                    case "aggressive_after_warnings":
                    case "aggressiveAfterWarnings":
                        config.setAggressiveAfterWarnings(toInt(value));
                        break;
                    case "aggressive_cooldown_millis":
                    case "aggressiveCooldownMillis":
                        config.setAggressiveCooldownMillis(toLong(value));
                        break;
                    case "regular_idle_millis":
                    case "regularIdleMillis":
                        config.setRegularIdleMillis(toLong(value));
                        break;
                    case "node_cache_capacity":
                    case "nodeCacheCapacity":
                        config.setNodeCacheCapacity(toInt(value));
                        break;
                    case "max_search_results":
                    case "maxSearchResults":
                        config.setMaxSearchResults(toInt(value));
                        break;
                    case "ngram_size":
                    case "ngramSize":
                        config.setNgramSize(toInt(value));
                        break;
                    case "ngram_min_value_length":
                    case "ngramMinValueLength":
                        config.setNgramMinValueLength(toInt(value));
                        break;
                    case "search_timeout_millis":
                    case "searchTimeoutMillis":
                        config.setSearchTimeoutMillis(toLong(value));
                        break;
                    case "context_radius":
                    case "contextRadius":
                        config.setContextRadius(toInt(value));
                        break;
                    case "journal_directory":
                    case "journalDirectory":
                        config.setJournalDirectory(value != null ? value.toString() : null);
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    private JsonNavConfig copyConfig(JsonNavConfig source) {
        JsonNavConfig copy = new JsonNavConfig();
        copy.setMaxDocumentBytes(source.getMaxDocumentBytes());
        copy.setMaxDepth(source.getMaxDepth());
        copy.setAllowComments(source.isAllowComments());
        copy.setAllowTrailingCommas(source.isAllowTrailingCommas());
        copy.setChildLimit(source.getChildLimit());
        copy.setBatchSize(source.getBatchSize());
        copy.setDisplayValueMaxLength(source.getDisplayValueMaxLength());
        copy.setMaxConcurrentLoads(source.getMaxConcurrentLoads());
        copy.setLoadTimeoutMillis(source.getLoadTimeoutMillis());
        copy.setMemoryMonitorEnabled(source.isMemoryMonitorEnabled());
        copy.setSamplingIntervalMillis(source.getSamplingIntervalMillis());
        copy.setWarningThresholdBytes(source.getWarningThresholdBytes());
        copy.setCriticalThresholdBytes(source.getCriticalThresholdBytes());
        copy.setAggressiveAfterWarnings(source.getAggressiveAfterWarnings());
        copy.setAggressiveCooldownMillis(source.getAggressiveCooldownMillis());
        copy.setRegularIdleMillis(source.getRegularIdleMillis());
        copy.setNodeCacheCapacity(source.getNodeCacheCapacity());
        copy.setMaxSearchResults(source.getMaxSearchResults());
        copy.setNgramSize(source.getNgramSize());
        copy.setNgramMinValueLength(source.getNgramMinValueLength());
        copy.setSearchTimeoutMillis(source.getSearchTimeoutMillis());
        copy.setContextRadius(source.getContextRadius());
        copy.setJournalDirectory(source.getJournalDirectory());
        return copy;
    }
}
