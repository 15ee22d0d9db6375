package de.mirkosertic.imagelocator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running image locator, taken from the Maven-filtered
 * build-info.properties. The software version is written into every index commit.
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String RESOURCE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final BuildInfo CURRENT = load(RESOURCE);

    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("No {} on the classpath, running an unpackaged build", resource);
                return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
            }
            final Properties properties = new Properties();
            properties.load(input);
            return fromProperties(properties);
        } catch (final IOException e) {
            logger.warn("Failed to read {}, using development build info", resource, e);
            return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
        }
    }

    static BuildInfo fromProperties(final Properties properties) {
        return new BuildInfo(
                filteredOr(properties.getProperty("build.version"), DEV_VERSION),
                filteredOr(properties.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP));
    }

    // A copy that skipped resource filtering still holds the ${...} placeholder
    private static String filteredOr(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }
}
