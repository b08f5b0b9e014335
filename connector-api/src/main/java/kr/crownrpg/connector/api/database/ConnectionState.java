package kr.crownrpg.connector.api.database;

/**
 * 단일 커넥션의 수명 상태.
 */
public enum ConnectionState {
    INITIALIZED,
    CONNECTED,
    CLOSED
}
