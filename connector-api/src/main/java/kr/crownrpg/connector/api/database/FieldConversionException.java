package kr.crownrpg.connector.api.database;

/**
 * Thrown by the strict numeric accessors when a field's text is not a number of the requested type.
 */
public class FieldConversionException extends DatabaseException {

    private final String value;

    public FieldConversionException(String message, String value, Throwable cause) {
        super(message, cause);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
