package kr.crownrpg.connector.api.database;

/**
 * Raised when an operation needs a live session and the connection has none.
 */
public class ConnectionStateException extends DatabaseException {

    public ConnectionStateException(String message) {
        super(message);
    }
}
