package kr.crownrpg.connector.api.database;

/**
 * 커넥터 계층에서 발생하는 모든 하드 실패의 공통 부모.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseException(String message) {
        super(message);
    }
}
