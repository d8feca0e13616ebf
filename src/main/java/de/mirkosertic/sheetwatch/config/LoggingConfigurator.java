package de.mirkosertic.sheetwatch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches Logback to the rolling-file setup when the monitor runs unattended.
 * <p>
 * Console mode keeps the automatically loaded {@code logback.xml}. Service mode loads
 * {@code logback-service.xml}, which writes below the directory published in the
 * {@value #LOG_DIR_PROPERTY} system property.
 */
public final class LoggingConfigurator {

    public static final String LOG_DIR_PROPERTY = "sheetwatch.log.dir";

    static final String SERVICE_CONFIG = "logback-service.xml";

    private LoggingConfigurator() {
    }

    public static Path defaultLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    /**
     * Must run before the first logger is used.
     */
    public static boolean configure(final boolean serviceMode) {
        final String override = System.getProperty(LOG_DIR_PROPERTY);
        return configure(serviceMode, override != null ? Paths.get(override) : defaultLogDirectory());
    }

    /**
     * @return true if the service configuration was loaded
     */
    static boolean configure(final boolean serviceMode, final Path logDirectory) {
        if (!serviceMode) {
            return false;
        }
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: cannot create log directory " + logDirectory + ": " + e.getMessage());
        }
        System.setProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());
        return reload(SERVICE_CONFIG);
    }

    private static boolean reload(final String resource) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            System.err.println("Warning: Logback is not the active SLF4J backend, keeping default logging");
            return false;
        }
        try (final InputStream in = LoggingConfigurator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                System.err.println("Warning: " + resource + " not found on classpath");
                return false;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: cannot apply " + resource + ": " + e.getMessage());
            return false;
        }
    }
}
