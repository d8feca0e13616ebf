package de.mirkosertic.sheetwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the running monitor, read from the Maven-filtered
 * build-info.properties. Outside a Maven build (IDE runs) the values are "dev" and "unknown".
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String UNFILTERED_MARKER = "${";

    private static final BuildInfo CURRENT = readFromClasspath();

    public static BuildInfo current() {
        return CURRENT;
    }

    /**
     * One-line banner for the startup log.
     */
    public String banner() {
        return "SheetWatch " + version + " (built " + buildTimestamp + ")";
    }

    private static BuildInfo readFromClasspath() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("{} not found, using dev defaults", BUILD_INFO_FILE);
            } else {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to read {}, using dev defaults", BUILD_INFO_FILE, e);
        }
        return new BuildInfo(
                valueOrDefault(props.getProperty("build.version"), "dev"),
                valueOrDefault(props.getProperty("build.timestamp"), "unknown"));
    }

    private static String valueOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains(UNFILTERED_MARKER)) {
            return fallback;
        }
        return value;
    }
}
