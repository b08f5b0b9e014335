package kr.crownrpg.connector.api.database;

/**
 * 단일 DB 세션을 감싸는 스레드 안전 커넥션.
 *
 * - 생성 시에는 드라이버 핸들만 준비하고 네트워크 연결은 하지 않는다.
 * - {@link #connect()} 이후 여러 스레드에서 공유할 수 있으며 모든 호출은 하나의 락으로 직렬화된다.
 * - 조회 결과 {@link ResultCursor}는 같은 커넥션에 다음 문장을 보내기 전에 다 읽거나 닫아야 한다.
 */
public interface DbConnection extends AutoCloseable {

    /**
     * Establishes the session. Returns {@code true} immediately if already connected,
     * {@code false} (logged, not thrown) if the handshake fails or the connection was closed.
     */
    boolean connect();

    /**
     * Releases the driver handle. Safe to call any number of times.
     */
    @Override
    void close();

    /**
     * Round-trip liveness probe. Never throws.
     */
    boolean isValid();

    /**
     * Executes a result-producing statement and returns a cursor over the fully materialized rows.
     *
     * @throws ConnectionStateException       if there is no live session
     * @throws StatementExecutionException    if the server rejects the statement
     * @throws ResultMaterializationException if the rows cannot be read
     */
    ResultCursor executeQuery(String sql);

    /**
     * Executes a non-result statement and returns the affected-row count.
     *
     * @throws ConnectionStateException    if there is no live session
     * @throws StatementExecutionException if the server rejects the statement
     */
    long executeUpdate(String sql);

    boolean beginTransaction();

    boolean commit();

    boolean rollback();

    /**
     * Error text of the most recent failed driver call on this connection, empty if the
     * most recent statement succeeded, or a "not connected" sentinel without a live session.
     */
    String getLastError();

    /**
     * Vendor error code matching {@link #getLastError()}; 0 without a live session.
     */
    int getLastErrorCode();

    /**
     * Escapes {@code value} for use inside a quoted SQL string literal. The caller adds the quotes.
     *
     * @throws ConnectionStateException if there is no live session
     */
    String escapeString(String value);

    long getCreationTime();

    long getLastActiveTime();

    String getConnectionId();

    ConnectionState state();
}
