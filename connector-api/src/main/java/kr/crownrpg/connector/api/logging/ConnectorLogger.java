package kr.crownrpg.connector.api.logging;

/**
 * Leveled log sink used by the connector. Implementations must be thread-safe.
 */
public interface ConnectorLogger {

    void debug(String message);

    void info(String message);

    void warning(String message);

    void error(String message);

    void fatal(String message);
}
