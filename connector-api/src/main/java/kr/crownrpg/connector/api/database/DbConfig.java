package kr.crownrpg.connector.api.database;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of a single database instance.
 *
 * <p>{@code weight} is only meaningful to a pool that balances across several instances.
 * {@code jdbcUrl}, when set, replaces the MySQL URL otherwise built from host, port and database.
 */
public final class DbConfig {

    public static final int DEFAULT_PORT = 3306;
    public static final int DEFAULT_WEIGHT = 1;

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final int weight;
    private final Map<String, String> properties;
    private final String jdbcUrl;

    public DbConfig(String host, String username, String password, String database) {
        this(host, DEFAULT_PORT, database, username, password, DEFAULT_WEIGHT, null, null);
    }

    public DbConfig(String host, int port, String database, String username, String password, int weight, Map<String, String> properties, String jdbcUrl) {
        this.host = nullSafe(host);
        this.port = port;
        this.database = nullSafe(database);
        this.username = nullSafe(username);
        this.password = nullSafe(password);
        this.weight = weight;
        this.properties = toUnmodifiableMap(properties);
        this.jdbcUrl = jdbcUrl == null || jdbcUrl.isBlank() ? null : jdbcUrl.trim();
    }

    /**
     * Configuration that connects through an explicit JDBC URL.
     */
    public static DbConfig forJdbcUrl(String jdbcUrl, String username, String password) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        return new DbConfig("", DEFAULT_PORT, "", username, password, DEFAULT_WEIGHT, null, jdbcUrl);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String database() {
        return database;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public int weight() {
        return weight;
    }

    public Map<String, String> properties() {
        return properties;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * host, user, database가 비어 있지 않고 port가 양수여야 한다. 비밀번호는 비어 있어도 된다.
     * JDBC URL을 직접 지정한 경우 host/database 검사는 생략한다.
     */
    public boolean isValid() {
        if (jdbcUrl != null) {
            return true;
        }
        return !host.isBlank() && !username.isBlank() && !database.isBlank() && port > 0;
    }

    /**
     * {@code user@host:port/database}, safe for logs.
     */
    public String connectionString() {
        if (jdbcUrl != null) {
            return username + "@" + jdbcUrl;
        }
        return username + "@" + host + ":" + port + "/" + database;
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }

    private static Map<String, String> toUnmodifiableMap(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Map.copyOf(source);
    }

    @Override
    public String toString() {
        return "DbConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", username='" + username + '\'' +
                ", password='" + (password.isEmpty() ? "" : "****") + '\'' +
                ", weight=" + weight +
                ", properties=" + properties +
                (jdbcUrl == null ? "" : ", jdbcUrl='" + jdbcUrl + '\'') +
                '}';
    }

    // 같은 host/port/user/database면 같은 인스턴스로 본다. weight와 password는 비교하지 않는다.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DbConfig that)) return false;
        return port == that.port
                && Objects.equals(host, that.host)
                && Objects.equals(username, that.username)
                && Objects.equals(database, that.database)
                && Objects.equals(jdbcUrl, that.jdbcUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, username, database, jdbcUrl);
    }
}
