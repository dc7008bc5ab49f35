package com.chessmind.chess.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads the bundled {@code logging.properties} unless a configuration was given on the command
 * line through {@code java.util.logging.config.file}.
 */
public final class LoggingSetup {

    private static final Logger LOGGER = Logger.getLogger(LoggingSetup.class.getName());
    private static final String RESOURCE = "/logging.properties";

    private LoggingSetup() {
    }

    public static void configure() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = LoggingSetup.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOGGER.warning(() -> "Logging configuration " + RESOURCE + " not found on the classpath");
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }
}
