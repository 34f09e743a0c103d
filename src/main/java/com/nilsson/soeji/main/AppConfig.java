package com.nilsson.soeji.main;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 <h2>AppConfig</h2>
 <p>
 Runtime settings. Defaults are overridden by the classpath resource {@code soeji.properties},
 which in turn is overridden by JVM system properties of the same name, e.g.
 {@code -Dsoeji.blob.root=/srv/soeji/blobs}.
 </p>
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String RESOURCE = "soeji.properties";

    public static final String DB_URL = "soeji.db.url";
    public static final String SEARCH_URL = "soeji.search.url";
    public static final String BLOB_ROOT = "soeji.blob.root";
    public static final String LOSSLESS_ENABLED = "soeji.lossless.enabled";
    public static final String LOSSLESS_FAILURE_FATAL = "soeji.lossless.failureFatal";
    public static final String TAG_CACHE_STALE_AFTER = "soeji.tagCache.staleAfterSeconds";
    public static final String TAG_LOOKUP_MAX_ATTEMPTS = "soeji.tagLookup.maxAttempts";

    private final String dbUrl;
    private final String searchUrl;
    private final String blobRoot;
    private final boolean losslessEnabled;
    private final boolean losslessFailureFatal;
    private final Duration tagCacheStaleAfter;
    private final int tagLookupMaxAttempts;

    public AppConfig(Properties properties) {
        this.dbUrl = properties.getProperty(DB_URL, "jdbc:sqlite:data/soeji.db");
        this.searchUrl = properties.getProperty(SEARCH_URL, "jdbc:sqlite:data/search.db");
        this.blobRoot = properties.getProperty(BLOB_ROOT, "data/blobs");
        this.losslessEnabled = Boolean.parseBoolean(properties.getProperty(LOSSLESS_ENABLED, "true"));
        this.losslessFailureFatal = Boolean.parseBoolean(properties.getProperty(LOSSLESS_FAILURE_FATAL, "true"));
        this.tagCacheStaleAfter = Duration.ofSeconds(parsePositive(properties, TAG_CACHE_STALE_AFTER, 300));
        this.tagLookupMaxAttempts = (int) parsePositive(properties, TAG_LOOKUP_MAX_ATTEMPTS, 3);
    }

    /**
     Defaults, then {@value #RESOURCE} from the classpath, then system properties.
     */
    public static AppConfig load() {
        Properties properties = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults", RESOURCE, e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("soeji.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new AppConfig(properties);
    }

    private static long parsePositive(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            long value = Long.parseLong(raw.trim());
            if (value > 0) return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}={}", key, raw);
            return defaultValue;
        }
        logger.warn("Ignoring non-positive {}={}", key, raw);
        return defaultValue;
    }

    // --- Accessors ---

    public String getDbUrl() {
        return dbUrl;
    }

    public String getSearchUrl() {
        return searchUrl;
    }

    public String getBlobRoot() {
        return blobRoot;
    }

    public boolean isLosslessEnabled() {
        return losslessEnabled;
    }

    public boolean isLosslessFailureFatal() {
        return losslessFailureFatal;
    }

    public Duration getTagCacheStaleAfter() {
        return tagCacheStaleAfter;
    }

    public int getTagLookupMaxAttempts() {
        return tagLookupMaxAttempts;
    }
}
