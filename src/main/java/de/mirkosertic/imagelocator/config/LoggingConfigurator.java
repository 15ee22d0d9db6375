package de.mirkosertic.imagelocator.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the rolling log file of the deployed profile.
 * The console setup in logback.xml stays active otherwise.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";

    private LoggingConfigurator() {
    }

    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDirectory = logDirectory(ApplicationConfig.getConfigDirectory());
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            // No logger yet, the console is the only channel
            System.err.println("Cannot create log directory " + logDirectory + ": " + e.getMessage());
        }
        reconfigure(DEPLOYED_CONFIG, logDirectory);
    }

    static Path logDirectory(final Path configDirectory) {
        return configDirectory.resolve("log");
    }

    private static void reconfigure(final String resource, final Path logDirectory) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream configuration = LoggingConfigurator.class.getClassLoader().getResourceAsStream(resource)) {
            if (configuration == null) {
                System.err.println("Logging configuration " + resource + " not found, keeping console logging");
                return;
            }
            context.reset();
            context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configuration);
        } catch (final JoranException | IOException e) {
            System.err.println("Failed to apply " + resource + ": " + e.getMessage());
        }
    }
}
