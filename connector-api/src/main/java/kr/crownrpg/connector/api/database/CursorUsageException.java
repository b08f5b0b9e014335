package kr.crownrpg.connector.api.database;

/**
 * Invalid use of a {@link ResultCursor}.
 */
public class CursorUsageException extends DatabaseException {

    public enum Reason {
        INDEX_OUT_OF_RANGE,
        NO_CURRENT_ROW,
        FIELD_NOT_FOUND,
        NO_RESULT_SET
    }

    private final Reason reason;

    public CursorUsageException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
