package gsecars.tomoxrd.utilities;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Utility for writing a per-collection log next to the acquired data.
 *
 * <p>While a session is open, everything logged under {@code gsecars.tomoxrd} is also
 * appended to {@code <directory>/collection.log}. Use with try-with-resources:</p>
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(filepath)) {
 *     logger.info("Starting collection...");
 *     // ... collection ...
 * }
 * }</pre>
 *
 * @since 0.2
 */
public class RunLogger {
    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(RunLogger.class);

    public static final String LOG_FILE_NAME = "collection.log";
    static final String APPENDER_NAME = "RUN_LOG";
    static final String LOGGER_NAME = "gsecars.tomoxrd";

    private static FileAppender<ILoggingEvent> activeAppender;
    private static String activeDirectory;

    /**
     * Starts writing to {@code <directory>/collection.log}. An already active run log is closed first.
     *
     * @return true if the appender is active
     */
    public static synchronized boolean enable(String directory) {
        if (directory == null || directory.trim().isEmpty()) {
            logger.warn("Cannot enable run logging: path is null or empty");
            return false;
        }
        File dir = new File(directory);
        if (!dir.isDirectory()) {
            logger.warn("Cannot enable run logging: directory does not exist: {}", directory);
            return false;
        }
        if (activeAppender != null) {
            disable();
        }

        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Run logging needs logback as the SLF4J backend");
            return false;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(new File(dir, LOG_FILE_NAME).getAbsolutePath());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        Logger target = context.getLogger(LOGGER_NAME);
        target.addAppender(appender);
        activeAppender = appender;
        activeDirectory = dir.getAbsolutePath();

        logger.info("Run logging enabled: {}", appender.getFile());
        return true;
    }

    /**
     * Stops the active run log, if any.
     */
    public static synchronized void disable() {
        if (activeAppender == null) {
            return;
        }
        logger.info("Run logging disabled: {}", activeAppender.getFile());
        LoggerContext context = activeAppender.getContext() instanceof LoggerContext lc ? lc : null;
        if (context != null) {
            context.getLogger(LOGGER_NAME).detachAppender(activeAppender);
        }
        activeAppender.stop();
        activeAppender = null;
        activeDirectory = null;
    }

    public static synchronized boolean isEnabled() {
        return activeAppender != null;
    }

    public static synchronized String getActiveDirectory() {
        return activeDirectory;
    }

    public static Session start(String directory) {
        return new Session(directory);
    }

    /**
     * Auto-closeable session that disables the run log when closed.
     */
    public static class Session implements AutoCloseable {
        private final boolean active;

        private Session(String directory) {
            this.active = enable(directory);
        }

        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (active) {
                disable();
            }
        }
    }
}
