package org.miniworker.worker;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Log sink of one worker: logger {@code mini_worker.<worker_id>} writing to
 * {@code <log_dir>/<worker_id>.log} (10MB x 5 backups) and to the console.
 * Built once per loop run; any appenders left from an earlier run in the same
 * JVM are detached first.
 */
public final class WorkerLogging implements AutoCloseable {

    public static final String LOGGER_PREFIX = "mini_worker.";

    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - %logger - %level - %msg%n";
    private static final String CONSOLE_PATTERN = "%d{HH:mm:ss} - %level - %msg%n";
    private static final String MAX_FILE_SIZE = "10MB";
    private static final int BACKUP_COUNT = 5;

    private final ch.qos.logback.classic.Logger logger;

    private WorkerLogging(ch.qos.logback.classic.Logger logger) {
        this.logger = logger;
    }

    public static WorkerLogging open(String workerId, Path logDir) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger logger = ctx.getLogger(LOGGER_PREFIX + workerId);
        logger.detachAndStopAllAppenders();
        logger.setLevel(Level.INFO);
        logger.setAdditive(false);

        Path logFile = logDir.resolve(workerId + ".log");

        RollingFileAppender<ILoggingEvent> file = new RollingFileAppender<>();
        file.setContext(ctx);
        file.setName("worker-file");
        file.setFile(logFile.toString());

        FixedWindowRollingPolicy rolling = new FixedWindowRollingPolicy();
        rolling.setContext(ctx);
        rolling.setParent(file);
        rolling.setFileNamePattern(logFile + ".%i");
        rolling.setMinIndex(1);
        rolling.setMaxIndex(BACKUP_COUNT);
        rolling.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> trigger = new SizeBasedTriggeringPolicy<>();
        trigger.setContext(ctx);
        trigger.setMaxFileSize(FileSize.valueOf(MAX_FILE_SIZE));
        trigger.start();

        file.setRollingPolicy(rolling);
        file.setTriggeringPolicy(trigger);
        file.setEncoder(encoder(ctx, FILE_PATTERN));
        file.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(ctx);
        console.setName("worker-console");
        console.setEncoder(encoder(ctx, CONSOLE_PATTERN));
        console.start();

        logger.addAppender(file);
        logger.addAppender(console);

        logger.info("Logging initialized for worker {}", workerId);
        logger.info("Log file: {}", logFile);
        return new WorkerLogging(logger);
    }

    @NotNull
    private static PatternLayoutEncoder encoder(LoggerContext ctx, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(pattern);
        encoder.start();
        return encoder;
    }

    public Logger logger() {
        return logger;
    }

    @Override
    public void close() {
        logger.detachAndStopAllAppenders();
    }
}
