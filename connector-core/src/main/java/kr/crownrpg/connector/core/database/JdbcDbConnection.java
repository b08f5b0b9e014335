package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.database.ConnectionState;
import kr.crownrpg.connector.api.database.ConnectionStateException;
import kr.crownrpg.connector.api.database.DbConfig;
import kr.crownrpg.connector.api.database.DbConnection;
import kr.crownrpg.connector.api.database.ResultCursor;
import kr.crownrpg.connector.api.database.ResultMaterializationException;
import kr.crownrpg.connector.api.database.StatementExecutionException;
import kr.crownrpg.connector.api.logging.ConnectorLogger;
import kr.crownrpg.connector.core.logging.Slf4jConnectorLogger;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC 드라이버 세션 하나를 감싸는 {@link DbConnection} 구현체.
 *
 * - 생성자: 드라이버 핸들 할당 + 타임아웃/문자셋 설정 (네트워크 연결 없음)
 * - connect(): 한 번만 실제 연결, 이후 호출은 그대로 true
 * - 모든 핸들 접근과 가변 상태(handle, connected, lastActiveTime)는 {@link #lock}으로 보호
 *
 * 락을 잡은 상태에서는 public 메서드를 다시 호출하지 않고 {@code *Locked} 헬퍼만 사용한다.
 */
public final class JdbcDbConnection implements DbConnection {

    public static final String NOT_CONNECTED = "Connection not established";

    private static final int VALIDATION_TIMEOUT_SECONDS = 3;

    private final ReentrantLock lock = new ReentrantLock();
    private final ConnectorLogger logger;
    private final String connectionId;
    private final long creationTime;
    private final DbConfig config;

    private DriverHandle handle;
    private boolean connected;
    private long lastActiveTime;

    public JdbcDbConnection(String host, String user, String password, String database) {
        this(host, user, password, database, DbConfig.DEFAULT_PORT);
    }

    public JdbcDbConnection(String host, String user, String password, String database, int port) {
        this(new DbConfig(host, port, database, user, password, DbConfig.DEFAULT_WEIGHT, null, null));
    }

    public JdbcDbConnection(DbConfig config) {
        this(config, Slf4jConnectorLogger.forClass(JdbcDbConnection.class));
    }

    public JdbcDbConnection(DbConfig config, ConnectorLogger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.connectionId = ConnectionIds.next();
        this.creationTime = System.currentTimeMillis();
        this.lastActiveTime = creationTime;

        logger.info("Creating connection [" + connectionId + "] to " + config.connectionString());
        this.handle = DriverHandle.allocate(
                JdbcUrls.resolve(config),
                config.username(),
                config.password(),
                config.properties(),
                connectionId,
                logger);
        logger.info("Driver handle initialized [" + connectionId + "]");
    }

    @Override
    public boolean connect() {
        lock.lock();
        try {
            // 이미 연결된 세션을 다시 열면 진행 중인 작업이 끊기므로 플래그로 막는다
            if (connected) {
                logger.warning("Connection already established [" + connectionId + "]");
                return true;
            }
            if (handle == null) {
                logger.error("Driver handle not initialized [" + connectionId + "]");
                return false;
            }

            logger.info("Connecting to database server [" + connectionId + "]");
            try {
                handle.open();
            } catch (SQLException e) {
                handle.recordError(e);
                logger.error("Failed to connect to database server [" + connectionId + "]: " + handle.lastError());
                return false;
            }
            connected = true;
            touchLocked();

            try {
                handle.detectEscaper();
            } catch (SQLException e) {
                logger.warning("Failed to detect string literal mode [" + connectionId + "], using standard escaping: " + e.getMessage());
            }
            logger.info("Connected to database server [" + connectionId + "]");
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            DriverHandle h = this.handle;
            this.handle = null;
            this.connected = false;
            if (h == null) {
                return;
            }
            try {
                h.release();
            } catch (SQLException e) {
                logger.warning("Error while closing connection [" + connectionId + "]: " + e.getMessage());
            }
            logger.info("Connection closed [" + connectionId + "]");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isValid() {
        lock.lock();
        try {
            return probeLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ResultCursor executeQuery(String sql) {
        return executeInternal(sql, true);
    }

    @Override
    public long executeUpdate(String sql) {
        try (ResultCursor cursor = executeInternal(sql, false)) {
            return cursor.getAffectedRows();
        }
    }

    private ResultCursor executeInternal(String sql, boolean query) {
        Objects.requireNonNull(sql, "sql");
        String kind = query ? "query" : "update";

        lock.lock();
        try {
            if (!probeLocked()) {
                logger.error(NOT_CONNECTED + " [" + connectionId + "]");
                throw new ConnectionStateException(NOT_CONNECTED + " [" + connectionId + "]");
            }
            logger.debug("Execute " + kind + " [" + connectionId + "], sql: " + sql);
            touchLocked();

            Connection session = handle.session();
            try (Statement statement = session.createStatement()) {
                boolean hasResultSet = submitLocked(statement, sql, kind);

                if (query && hasResultSet) {
                    return JdbcResultCursor.ofRows(storeLocked(statement), connectionId, logger);
                }
                if (hasResultSet) {
                    logger.debug("Update statement returned a result set, discarded [" + connectionId + "]");
                }
                return JdbcResultCursor.ofAffectedRows(affectedRows(statement), connectionId, logger);
            } catch (SQLException e) {
                handle.recordError(e);
                logger.error("Statement failed [" + connectionId + "]: " + handle.lastError() + ", SQL: " + sql);
                throw new StatementExecutionException("SQL execution failed: " + handle.lastError(), sql, e.getErrorCode(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean submitLocked(Statement statement, String sql, String kind) {
        try {
            boolean hasResultSet = statement.execute(sql);
            handle.clearError();
            return hasResultSet;
        } catch (SQLException e) {
            handle.recordError(e);
            logger.error("Failed to execute " + kind + " [" + connectionId + "]: " + handle.lastError() + ", SQL: " + sql);
            throw new StatementExecutionException("SQL execution failed: " + handle.lastError(), sql, e.getErrorCode(), e);
        }
    }

    private StoredResult storeLocked(Statement statement) {
        try (ResultSet rs = statement.getResultSet()) {
            return StoredResult.store(rs);
        } catch (SQLException e) {
            handle.recordError(e);
            logger.error("Failed to store query result [" + connectionId + "]: " + handle.lastError());
            throw new ResultMaterializationException("Failed to store query result [" + connectionId + "]: " + handle.lastError(), e);
        }
    }

    private static long affectedRows(Statement statement) throws SQLException {
        long count = statement.getLargeUpdateCount();
        return Math.max(count, 0L);
    }

    @Override
    public boolean beginTransaction() {
        return transactionLocked("begin", c -> c.setAutoCommit(false));
    }

    @Override
    public boolean commit() {
        return transactionLocked("commit", c -> {
            if (noOpenTransaction(c, "commit")) {
                return;
            }
            c.commit();
            c.setAutoCommit(true);
        });
    }

    @Override
    public boolean rollback() {
        return transactionLocked("rollback", c -> {
            if (noOpenTransaction(c, "rollback")) {
                return;
            }
            c.rollback();
            c.setAutoCommit(true);
        });
    }

    // auto-commit 상태의 COMMIT/ROLLBACK은 서버에서 아무 일도 하지 않는다.
    // 일부 드라이버(Connector/J)는 이를 클라이언트에서 거부하므로 드라이버를 거치지 않는다.
    private boolean noOpenTransaction(Connection session, String action) throws SQLException {
        if (!session.getAutoCommit()) {
            return false;
        }
        logger.debug("No open transaction, " + action + " is a no-op [" + connectionId + "]");
        return true;
    }

    private boolean transactionLocked(String action, SessionAction body) {
        lock.lock();
        try {
            if (handle == null || !connected) {
                logger.error(NOT_CONNECTED + ", cannot " + action + " transaction [" + connectionId + "]");
                return false;
            }
            logger.debug(action + " transaction [" + connectionId + "]");
            try {
                body.apply(handle.session());
            } catch (SQLException e) {
                handle.recordError(e);
                logger.error("Failed to " + action + " transaction [" + connectionId + "]: " + handle.lastError());
                return false;
            }
            handle.clearError();
            touchLocked();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getLastError() {
        lock.lock();
        try {
            if (!probeLocked()) {
                return NOT_CONNECTED;
            }
            return handle.lastError();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getLastErrorCode() {
        lock.lock();
        try {
            if (!probeLocked()) {
                return 0;
            }
            return handle.lastErrorCode();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String escapeString(String value) {
        Objects.requireNonNull(value, "value");
        SqlEscaper escaper;
        lock.lock();
        try {
            if (!probeLocked()) {
                logger.error(NOT_CONNECTED + ", cannot escape string [" + connectionId + "]");
                throw new ConnectionStateException(NOT_CONNECTED + ", cannot escape string [" + connectionId + "]");
            }
            escaper = handle.escaper();
        } finally {
            lock.unlock();
        }
        return escaper.escape(value);
    }

    @Override
    public long getCreationTime() {
        return creationTime;
    }

    @Override
    public long getLastActiveTime() {
        lock.lock();
        try {
            return lastActiveTime;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public ConnectionState state() {
        lock.lock();
        try {
            if (handle == null) {
                return ConnectionState.CLOSED;
            }
            return connected ? ConnectionState.CONNECTED : ConnectionState.INITIALIZED;
        } finally {
            lock.unlock();
        }
    }

    private boolean probeLocked() {
        if (handle == null) {
            logger.warning("Driver handle not initialized [" + connectionId + "]");
            return false;
        }
        if (!connected) {
            logger.warning("Not connected to database server [" + connectionId + "]");
            return false;
        }
        if (handle.ping(VALIDATION_TIMEOUT_SECONDS)) {
            touchLocked();
            return true;
        }
        logger.error("Connection validation failed [" + connectionId + "]: " + handle.lastError());
        return false;
    }

    // lock을 이미 잡은 상태에서만 호출
    private void touchLocked() {
        lastActiveTime = System.currentTimeMillis();
    }

    @FunctionalInterface
    private interface SessionAction {
        void apply(Connection session) throws SQLException;
    }

    @Override
    public String toString() {
        return "JdbcDbConnection{" +
                "id='" + connectionId + '\'' +
                ", target='" + config.connectionString() + '\'' +
                ", state=" + state() +
                '}';
    }
}
