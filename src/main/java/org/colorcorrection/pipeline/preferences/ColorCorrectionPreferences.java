package org.colorcorrection.pipeline.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Preferences for the color correction pipeline client.
 * <p>
 * Defaults are read from {@code colorcorrection.properties} on the classpath. A JVM
 * system property with the same key overrides the file, and the setters override
 * both for the lifetime of the process.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class ColorCorrectionPreferences {

    private static final Logger logger = LoggerFactory.getLogger(ColorCorrectionPreferences.class);

    private static final String RESOURCE = "/colorcorrection.properties";
    private static final String PREFIX = "colorcorrection.";

    // Server settings
    static final String SERVER_HOST = PREFIX + "serverHost";
    static final String SERVER_PORT = PREFIX + "serverPort";
    static final String CONNECT_TIMEOUT = PREFIX + "connectTimeoutSeconds";
    static final String READ_TIMEOUT = PREFIX + "readTimeoutSeconds";
    static final String WRITE_TIMEOUT = PREFIX + "writeTimeoutSeconds";

    // Batch settings
    static final String POLL_INTERVAL = PREFIX + "pollIntervalMillis";
    static final String MAX_POLL_WAIT = PREFIX + "maxPollWaitMinutes";
    static final String PARALLEL_THRESHOLD = PREFIX + "parallelThreshold";
    static final String DEFAULT_WORKERS = PREFIX + "defaultWorkerCount";
    static final String RESET_GRACE = PREFIX + "resetGraceMillis";

    // Selection
    static final String SELECTION_FALLBACK = PREFIX + "selectionFallback";

    private static final Properties defaults = loadDefaults();
    private static final Map<String, String> overrides = new ConcurrentHashMap<>();

    private ColorCorrectionPreferences() {
        // Utility class - no instantiation
    }

    private static Properties loadDefaults() {
        Properties props = new Properties();
        // Built-in values in case the resource is missing from the classpath
        props.setProperty(SERVER_HOST, "localhost");
        props.setProperty(SERVER_PORT, "5000");
        props.setProperty(CONNECT_TIMEOUT, "30");
        props.setProperty(READ_TIMEOUT, "300");
        props.setProperty(WRITE_TIMEOUT, "60");
        props.setProperty(POLL_INTERVAL, "200");
        props.setProperty(MAX_POLL_WAIT, "30");
        props.setProperty(PARALLEL_THRESHOLD, "4");
        props.setProperty(DEFAULT_WORKERS, "2");
        props.setProperty(RESET_GRACE, "3000");
        props.setProperty(SELECTION_FALLBACK, "FIRST_IMAGE");

        try (InputStream in = ColorCorrectionPreferences.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
                logger.debug("Loaded preferences from {}", RESOURCE);
            } else {
                logger.debug("{} not found, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
        }
        return props;
    }

    private static String get(String key) {
        String value = overrides.get(key);
        if (value != null) {
            return value;
        }
        value = System.getProperty(key);
        if (value != null) {
            return value;
        }
        return defaults.getProperty(key);
    }

    private static int getInt(String key) {
        String value = get(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            int fallback = Integer.parseInt(defaults.getProperty(key).trim());
            logger.warn("Invalid value '{}' for {}, using {}", value, key, fallback);
            return fallback;
        }
    }

    private static void set(String key, Object value) {
        overrides.put(key, String.valueOf(value));
    }

    /**
     * Drops all values set through the setters.
     */
    public static void resetOverrides() {
        overrides.clear();
    }

    // ==================== Server ====================

    public static String getServerHost() {
        return get(SERVER_HOST);
    }

    public static void setServerHost(String host) {
        set(SERVER_HOST, host);
    }

    public static int getServerPort() {
        return getInt(SERVER_PORT);
    }

    public static void setServerPort(int port) {
        set(SERVER_PORT, port);
    }

    public static int getConnectTimeoutSeconds() {
        return getInt(CONNECT_TIMEOUT);
    }

    public static int getReadTimeoutSeconds() {
        return getInt(READ_TIMEOUT);
    }

    public static void setReadTimeoutSeconds(int seconds) {
        set(READ_TIMEOUT, seconds);
    }

    public static int getWriteTimeoutSeconds() {
        return getInt(WRITE_TIMEOUT);
    }

    // ==================== Batch ====================

    public static int getPollIntervalMillis() {
        return getInt(POLL_INTERVAL);
    }

    public static void setPollIntervalMillis(int millis) {
        set(POLL_INTERVAL, millis);
    }

    public static int getMaxPollWaitMinutes() {
        return getInt(MAX_POLL_WAIT);
    }

    public static void setMaxPollWaitMinutes(int minutes) {
        set(MAX_POLL_WAIT, minutes);
    }

    /**
     * Image count at which "process all" switches from sequential to parallel training.
     */
    public static int getParallelThreshold() {
        return getInt(PARALLEL_THRESHOLD);
    }

    public static void setParallelThreshold(int threshold) {
        set(PARALLEL_THRESHOLD, threshold);
    }

    public static int getDefaultWorkerCount() {
        return getInt(DEFAULT_WORKERS);
    }

    public static void setDefaultWorkerCount(int workers) {
        set(DEFAULT_WORKERS, workers);
    }

    /**
     * Delay before a finished batch job is cleared, so the final progress stays visible.
     */
    public static int getResetGraceMillis() {
        return getInt(RESET_GRACE);
    }

    public static void setResetGraceMillis(int millis) {
        set(RESET_GRACE, millis);
    }

    // ==================== Selection ====================

    /**
     * @return name of the policy used when a single run has no explicit selection
     */
    public static String getSelectionFallback() {
        return get(SELECTION_FALLBACK);
    }

    public static void setSelectionFallback(String policy) {
        set(SELECTION_FALLBACK, policy);
    }
}
