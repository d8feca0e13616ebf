package de.mirkosertic.sheetwatch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingConfigurator Tests")
class LoggingConfiguratorTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreConsoleLogging() throws Exception {
        System.clearProperty(LoggingConfigurator.LOG_DIR_PROPERTY);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @Test
    @DisplayName("Console mode keeps the default configuration")
    void consoleMode() {
        assertThat(LoggingConfigurator.configure(false, tempDir.resolve("log"))).isFalse();
        assertThat(tempDir.resolve("log")).doesNotExist();
    }

    @Test
    @DisplayName("Service mode logs into the given directory")
    void serviceMode() {
        final Path logDir = tempDir.resolve("log");

        assertThat(LoggingConfigurator.configure(true, logDir)).isTrue();
        LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("service mode active");

        assertThat(System.getProperty(LoggingConfigurator.LOG_DIR_PROPERTY)).isEqualTo(logDir.toAbsolutePath().toString());
        assertThat(logDir.resolve("sheetwatch.log")).exists();
    }
}
