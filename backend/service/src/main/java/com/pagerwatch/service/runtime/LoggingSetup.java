package com.pagerwatch.service.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class LoggingSetup {
    static final String CONFIG_RESOURCE = "/logging.properties";
    static final String BASE_LOGGER = "com.pagerwatch";
    // held strongly so the level set here is not lost to logger collection
    private static final Logger BASE = Logger.getLogger(BASE_LOGGER);

    private LoggingSetup() {
    }

    /**
     * Loads the bundled logging configuration unless one was given with
     * {@code -Djava.util.logging.config.file}, then applies the verbose switch.
     */
    public static void configure(boolean verbose) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                }
            } catch (IOException e) {
                Logger.getLogger(LoggingSetup.class.getName())
                        .log(Level.WARNING, "Failed reading " + CONFIG_RESOURCE + "; using JDK defaults", e);
            }
        }
        if (verbose) {
            applyLevel(Level.FINE);
        }
    }

    static void applyLevel(Level level) {
        BASE.setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler.getLevel().intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }
}
