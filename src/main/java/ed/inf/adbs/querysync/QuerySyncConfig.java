package ed.inf.adbs.querysync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunable names used by the engine: the time column, the column filtered as a
 * numeric range, and the stream of the scratch statement labels are built on.
 * Values come from the classpath resource {@value #RESOURCE_NAME}; JVM system
 * properties with the same keys take precedence.
 */
public class QuerySyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(QuerySyncConfig.class);

    public static final String RESOURCE_NAME = "querysync.properties";

    public static final String TIME_FIELD_KEY = "querysync.time-field";
    public static final String DURATION_FIELD_KEY = "querysync.duration-field";
    public static final String DUMMY_STREAM_KEY = "querysync.dummy-stream";

    private final String timeField;
    private final String durationField;
    private final String dummyStream;

    public QuerySyncConfig(String timeField, String durationField, String dummyStream) {
        this.timeField = requireName(timeField, TIME_FIELD_KEY);
        this.durationField = requireName(durationField, DURATION_FIELD_KEY);
        this.dummyStream = requireName(dummyStream, DUMMY_STREAM_KEY);
    }

    /**
     * @return a configuration holding only the built-in defaults
     */
    public static QuerySyncConfig defaults() {
        return new QuerySyncConfig(Constants.DEFAULT_TIME_FIELD, Constants.DEFAULT_DURATION_FIELD,
                Constants.DEFAULT_DUMMY_STREAM);
    }

    /**
     * Loads the configuration from the classpath resource and system properties.
     * A missing or unreadable resource is not an error; defaults are used instead.
     * @return the loaded configuration
     */
    public static QuerySyncConfig load() {
        Properties properties = new Properties();
        try (InputStream in = QuerySyncConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warn("Error loading {}, using defaults: {}", RESOURCE_NAME, e.getMessage());
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from explicit properties, letting system properties override them.
     * @param properties the base properties
     * @return the resulting configuration
     */
    public static QuerySyncConfig fromProperties(Properties properties) {
        return new QuerySyncConfig(
                lookup(properties, TIME_FIELD_KEY, Constants.DEFAULT_TIME_FIELD),
                lookup(properties, DURATION_FIELD_KEY, Constants.DEFAULT_DURATION_FIELD),
                lookup(properties, DUMMY_STREAM_KEY, Constants.DEFAULT_DUMMY_STREAM));
    }

    private static String lookup(Properties properties, String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = properties.getProperty(key);
        }
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static String requireName(String value, String key) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
        return value;
    }

    public String getTimeField() {
        return timeField;
    }

    public String getDurationField() {
        return durationField;
    }

    public String getDummyStream() {
        return dummyStream;
    }

    @Override
    public String toString() {
        return "QuerySyncConfig{timeField=" + timeField + ", durationField=" + durationField
                + ", dummyStream=" + dummyStream + "}";
    }
}
