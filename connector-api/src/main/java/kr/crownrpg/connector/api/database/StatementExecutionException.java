package kr.crownrpg.connector.api.database;

/**
 * The server rejected or failed a statement.
 */
public class StatementExecutionException extends DatabaseException {

    private final String sql;
    private final int errorCode;

    public StatementExecutionException(String message, String sql, int errorCode, Throwable cause) {
        super(message, cause);
        this.sql = sql;
        this.errorCode = errorCode;
    }

    public String sql() {
        return sql;
    }

    /**
     * Vendor error code reported by the driver, 0 when unknown.
     */
    public int errorCode() {
        return errorCode;
    }
}
