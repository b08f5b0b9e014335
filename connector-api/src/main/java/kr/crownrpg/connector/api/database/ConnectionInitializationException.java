package kr.crownrpg.connector.api.database;

/**
 * The driver handle could not be allocated. The connection object is unusable.
 */
public class ConnectionInitializationException extends DatabaseException {

    public ConnectionInitializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConnectionInitializationException(String message) {
        super(message);
    }
}
