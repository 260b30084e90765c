package com.tyron.multicode.testFramework;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Collects the records a logger emits while attached.
 *
 * <pre>
 * try (LogCapture logs = LogCapture.attach(MetadataStore.class)) {
 *     ...
 *     assertThat(logs.contains(Level.SEVERE, "invalid")).isTrue();
 * }
 * </pre>
 */
public final class LogCapture extends Handler implements AutoCloseable {

    private final Logger logger;
    private final Level previousLevel;
    private final List<LogRecord> records = new ArrayList<>();

    private LogCapture(Logger logger) {
        this.logger = logger;
        this.previousLevel = logger.getLevel();
        setLevel(Level.ALL);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
    }

    public static LogCapture attach(Class<?> owner) {
        return new LogCapture(Logger.getLogger(owner.getName()));
    }

    @Override
    public synchronized void publish(LogRecord record) {
        records.add(record);
    }

    public synchronized List<LogRecord> records() {
        return new ArrayList<>(records);
    }

    public synchronized List<String> messages(Level level) {
        List<String> result = new ArrayList<>();
        for (LogRecord record : records) {
            if (record.getLevel().equals(level)) {
                result.add(record.getMessage());
            }
        }
        return result;
    }

    /**
     * @return whether a record of exactly {@code level} mentions {@code fragment}
     */
    public boolean contains(Level level, String fragment) {
        for (String message : messages(level)) {
            if (message != null && message.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        logger.removeHandler(this);
        logger.setLevel(previousLevel);
    }
}
