package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.logging.ConnectorLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory sink for asserting on emitted log records.
 */
final class RecordingLogger implements ConnectorLogger {

    enum Level { DEBUG, INFO, WARNING, ERROR, FATAL }

    record Entry(Level level, String message) {}

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized void debug(String message) {
        entries.add(new Entry(Level.DEBUG, message));
    }

    @Override
    public synchronized void info(String message) {
        entries.add(new Entry(Level.INFO, message));
    }

    @Override
    public synchronized void warning(String message) {
        entries.add(new Entry(Level.WARNING, message));
    }

    @Override
    public synchronized void error(String message) {
        entries.add(new Entry(Level.ERROR, message));
    }

    @Override
    public synchronized void fatal(String message) {
        entries.add(new Entry(Level.FATAL, message));
    }

    synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    synchronized List<String> messages(Level level) {
        return entries.stream()
                .filter(e -> e.level() == level)
                .map(Entry::message)
                .collect(Collectors.toList());
    }

    synchronized void clear() {
        entries.clear();
    }
}
