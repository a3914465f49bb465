package com.pandaduck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable runtime configuration of a frame session.
 *
 * <p>Read from JVM system properties, falling back to defaults for absent or
 * invalid values:
 * <ul>
 *   <li>{@code pandaduck.jdbc.url}: DuckDB JDBC URL (default in-memory {@code jdbc:duckdb:})</li>
 *   <li>{@code pandaduck.groupmap.parallelism}: worker threads for grouped-map
 *       functions (default available processors)</li>
 *   <li>{@code pandaduck.groupmap.timeout.seconds}: timeout of one grouped-map stage (default 600)</li>
 * </ul>
 */
public final class FrameConfig {

    private static final Logger logger = LoggerFactory.getLogger(FrameConfig.class);

    public static final String PROP_JDBC_URL = "pandaduck.jdbc.url";
    public static final String PROP_GROUPMAP_PARALLELISM = "pandaduck.groupmap.parallelism";
    public static final String PROP_GROUPMAP_TIMEOUT_SECONDS = "pandaduck.groupmap.timeout.seconds";

    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";
    public static final long DEFAULT_GROUPMAP_TIMEOUT_SECONDS = 600;

    private final String jdbcUrl;
    private final int groupMapParallelism;
    private final long groupMapTimeoutSeconds;

    private FrameConfig(String jdbcUrl, int groupMapParallelism, long groupMapTimeoutSeconds) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("jdbcUrl must not be empty");
        }
        if (groupMapParallelism <= 0) {
            throw new IllegalArgumentException("groupMapParallelism must be positive: " + groupMapParallelism);
        }
        if (groupMapTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("groupMapTimeoutSeconds must be positive: " + groupMapTimeoutSeconds);
        }
        this.jdbcUrl = jdbcUrl;
        this.groupMapParallelism = groupMapParallelism;
        this.groupMapTimeoutSeconds = groupMapTimeoutSeconds;
    }

    /**
     * Returns the default configuration, ignoring system properties.
     *
     * @return the defaults
     */
    public static FrameConfig defaults() {
        return new FrameConfig(DEFAULT_JDBC_URL, Runtime.getRuntime().availableProcessors(),
            DEFAULT_GROUPMAP_TIMEOUT_SECONDS);
    }

    /**
     * Reads the configuration from system properties.
     *
     * @return the configuration
     */
    public static FrameConfig fromSystemProperties() {
        String url = System.getProperty(PROP_JDBC_URL, DEFAULT_JDBC_URL);
        int parallelism = (int) getPositiveLong(PROP_GROUPMAP_PARALLELISM,
            Runtime.getRuntime().availableProcessors());
        long timeout = getPositiveLong(PROP_GROUPMAP_TIMEOUT_SECONDS, DEFAULT_GROUPMAP_TIMEOUT_SECONDS);
        return new FrameConfig(url, parallelism, timeout);
    }

    private static long getPositiveLong(String property, long defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed > 0 && parsed <= Integer.MAX_VALUE) {
                    return parsed;
                }
                logger.warn("Ignoring out of range value {}={}", property, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid value {}={}", property, value);
            }
        }
        return defaultValue;
    }

    public FrameConfig withJdbcUrl(String jdbcUrl) {
        return new FrameConfig(jdbcUrl, groupMapParallelism, groupMapTimeoutSeconds);
    }

    public FrameConfig withGroupMapParallelism(int parallelism) {
        return new FrameConfig(jdbcUrl, parallelism, groupMapTimeoutSeconds);
    }

    public FrameConfig withGroupMapTimeoutSeconds(long timeoutSeconds) {
        return new FrameConfig(jdbcUrl, groupMapParallelism, timeoutSeconds);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public int groupMapParallelism() {
        return groupMapParallelism;
    }

    public long groupMapTimeoutSeconds() {
        return groupMapTimeoutSeconds;
    }

    @Override
    public String toString() {
        return String.format("FrameConfig(url=%s, parallelism=%d, timeout=%ds)",
            jdbcUrl, groupMapParallelism, groupMapTimeoutSeconds);
    }
}
