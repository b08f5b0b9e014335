package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.database.ConnectionInitializationException;
import kr.crownrpg.connector.api.logging.ConnectorLogger;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * 커넥션 하나가 독점하는 드라이버 핸들.
 *
 * - 할당: JDBC URL에 맞는 {@link Driver}를 찾고 접속 속성을 준비한다 (네트워크 I/O 없음)
 * - open: 실제 세션을 연다
 * - release: 세션을 닫고 핸들을 폐기한다
 *
 * 마지막으로 실패한 드라이버 호출의 메시지/코드를 기억한다.
 * 스레드 안전하지 않으며 소유자인 {@link JdbcDbConnection}의 락 안에서만 사용한다.
 */
final class DriverHandle {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration READ_TIMEOUT = Duration.ofSeconds(30);
    static final Duration WRITE_TIMEOUT = Duration.ofSeconds(30);
    static final String CHARACTER_ENCODING = "UTF-8";

    private final String url;
    private final Driver driver;
    private final Properties properties;

    private Connection session;
    private SqlEscaper escaper = SqlEscaper.STANDARD;
    private String lastError = "";
    private int lastErrorCode;

    private DriverHandle(String url, Driver driver, Properties properties) {
        this.url = url;
        this.driver = driver;
        this.properties = properties;
    }

    /**
     * Resolves the driver for {@code url} and prepares the session properties.
     * Timeouts and charset are applied only where the driver advertises them.
     *
     * @throws ConnectionInitializationException if no registered driver accepts the URL
     */
    static DriverHandle allocate(String url,
                                 String user,
                                 String password,
                                 Map<String, String> extraProperties,
                                 String connectionId,
                                 ConnectorLogger logger) {
        Driver driver;
        try {
            driver = DriverManager.getDriver(url);
        } catch (SQLException e) {
            String message = "Failed to initialize driver handle [" + connectionId + "]: " + e.getMessage();
            logger.fatal(message);
            throw new ConnectionInitializationException(message, e);
        }

        Properties props = new Properties();
        if (user != null && !user.isEmpty()) {
            props.setProperty("user", user);
        }
        if (password != null && !password.isEmpty()) {
            props.setProperty("password", password);
        }

        Set<String> supported = supportedProperties(driver, url, props, connectionId, logger);
        // Connector/J는 읽기/쓰기 타임아웃을 socketTimeout 하나로 다룬다
        long socketTimeoutMs = Math.max(READ_TIMEOUT.toMillis(), WRITE_TIMEOUT.toMillis());
        applyOption(props, supported, "connectTimeout", String.valueOf(CONNECT_TIMEOUT.toMillis()),
                "connection timeout", connectionId, logger);
        applyOption(props, supported, "socketTimeout", String.valueOf(socketTimeoutMs),
                "read/write timeout", connectionId, logger);
        applyOption(props, supported, "characterEncoding", CHARACTER_ENCODING,
                "charset to utf8mb4", connectionId, logger);

        if (extraProperties != null) {
            extraProperties.forEach(props::setProperty);
        }
        return new DriverHandle(url, driver, props);
    }

    private static Set<String> supportedProperties(Driver driver, String url, Properties props, String connectionId, ConnectorLogger logger) {
        Set<String> names = new HashSet<>();
        try {
            DriverPropertyInfo[] infos = driver.getPropertyInfo(url, props);
            if (infos != null) {
                for (DriverPropertyInfo info : infos) {
                    names.add(info.name);
                }
            }
        } catch (SQLException e) {
            logger.warning("Failed to read driver properties [" + connectionId + "]: " + e.getMessage());
        }
        return names;
    }

    private static void applyOption(Properties props, Set<String> supported, String key, String value,
                                    String description, String connectionId, ConnectorLogger logger) {
        if (supported.contains(key)) {
            props.setProperty(key, value);
        } else {
            logger.warning("Failed to set " + description + " [" + connectionId + "]: driver does not support '" + key + "'");
        }
    }

    Connection session() {
        return session;
    }

    SqlEscaper escaper() {
        return escaper;
    }

    /**
     * Opens the network session.
     */
    void open() throws SQLException {
        Connection c = driver.connect(url, properties);
        if (c == null) {
            throw new SQLException("Driver " + driver.getClass().getName() + " rejected URL " + url);
        }
        session = c;
        clearError();
    }

    /**
     * Reads how the server parses string literals. Must be called after {@link #open()}.
     */
    void detectEscaper() throws SQLException {
        escaper = SqlEscaper.detect(session);
    }

    boolean ping(int timeoutSeconds) {
        if (session == null) {
            return false;
        }
        try {
            return session.isValid(timeoutSeconds);
        } catch (SQLException e) {
            recordError(e);
            return false;
        }
    }

    void recordError(SQLException e) {
        lastError = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
        lastErrorCode = e.getErrorCode();
    }

    void clearError() {
        lastError = "";
        lastErrorCode = 0;
    }

    String lastError() {
        return lastError;
    }

    int lastErrorCode() {
        return lastErrorCode;
    }

    /**
     * Closes the session if one is open.
     */
    void release() throws SQLException {
        Connection c = session;
        session = null;
        if (c != null) {
            c.close();
        }
    }
}
