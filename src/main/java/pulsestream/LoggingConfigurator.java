package pulsestream;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the Logback root level from command line flags.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Raise the root logger to DEBUG. Other SLF4J backends keep their level and a warning is logged.
     *
     * @return true if the level was changed
     */
    public static boolean enableVerboseLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            Logger root = ((LoggerContext) factory).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
            return true;
        }
        log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
                factory.getClass().getName());
        return false;
    }
}
