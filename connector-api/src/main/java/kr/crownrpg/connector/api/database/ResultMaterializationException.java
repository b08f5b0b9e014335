package kr.crownrpg.connector.api.database;

/**
 * A result-producing statement succeeded but its rows could not be read into memory.
 */
public class ResultMaterializationException extends DatabaseException {

    public ResultMaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
