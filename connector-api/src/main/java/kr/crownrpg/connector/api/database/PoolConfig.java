package kr.crownrpg.connector.api.database;

import kr.crownrpg.connector.api.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * 커넥션 풀 설정.
 *
 * 풀 매니저가 소비하는 순수 데이터이며, 기본 DB 정보(단일 DB 모드) 또는
 * {@link DbConfig} 목록(다중 DB 모드)과 풀 크기, 타임아웃, 재연결 정책을 담는다.
 * 모든 시간 값은 밀리초.
 */
public final class PoolConfig {

    private final String host;
    private final String username;
    private final String password;
    private final String database;
    private final int port;
    private final List<DbConfig> instances;
    private final int minConnections;
    private final int maxConnections;
    private final int initConnections;
    private final long connectionTimeoutMs;
    private final long maxIdleTimeMs;
    private final long healthCheckPeriodMs;
    private final long reconnectIntervalMs;
    private final int reconnectAttempts;
    private final boolean logQueries;
    private final boolean enablePerformanceStat;

    private PoolConfig(Builder builder) {
        this.host = builder.host;
        this.username = builder.username;
        this.password = builder.password;
        this.database = builder.database;
        this.port = builder.port;
        this.instances = List.copyOf(builder.instances);
        this.minConnections = builder.minConnections;
        this.maxConnections = builder.maxConnections;
        this.initConnections = builder.initConnections;
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.maxIdleTimeMs = builder.maxIdleTimeMs;
        this.healthCheckPeriodMs = builder.healthCheckPeriodMs;
        this.reconnectIntervalMs = builder.reconnectIntervalMs;
        this.reconnectAttempts = builder.reconnectAttempts;
        this.logQueries = builder.logQueries;
        this.enablePerformanceStat = builder.enablePerformanceStat;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PoolConfig defaults() {
        return new Builder().build();
    }

    public static PoolConfig singleDatabase(String host, String username, String password, String database, int port) {
        return new Builder().database(host, username, password, database, port).build();
    }

    public String host() {
        return host;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public String database() {
        return database;
    }

    public int port() {
        return port;
    }

    public List<DbConfig> instances() {
        return instances;
    }

    public int minConnections() {
        return minConnections;
    }

    public int maxConnections() {
        return maxConnections;
    }

    public int initConnections() {
        return initConnections;
    }

    public long connectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public long maxIdleTimeMs() {
        return maxIdleTimeMs;
    }

    public long healthCheckPeriodMs() {
        return healthCheckPeriodMs;
    }

    public long reconnectIntervalMs() {
        return reconnectIntervalMs;
    }

    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    public boolean logQueries() {
        return logQueries;
    }

    public boolean enablePerformanceStat() {
        return enablePerformanceStat;
    }

    public boolean isMultiDatabase() {
        return !instances.isEmpty();
    }

    /**
     * 단일 DB 모드에서는 1.
     */
    public int databaseCount() {
        return instances.isEmpty() ? 1 : instances.size();
    }

    /**
     * Validates database info, pool sizing and timeouts. Reconnect settings are not checked.
     */
    public boolean isValid() {
        if (!instances.isEmpty()) {
            for (DbConfig instance : instances) {
                if (!instance.isValid()) {
                    return false;
                }
            }
        } else if (host.isBlank() || username.isBlank() || database.isBlank() || port <= 0) {
            return false;
        }
        if (minConnections <= 0 || maxConnections <= 0
                || minConnections > maxConnections || initConnections > maxConnections) {
            return false;
        }
        return connectionTimeoutMs > 0 && maxIdleTimeMs > 0 && healthCheckPeriodMs > 0;
    }

    public String summary() {
        return "PoolConfig:{connections:[" + minConnections + ", " + maxConnections + "]"
                + ", timeout:" + connectionTimeoutMs + "ms"
                + ", databases:" + databaseCount() + "}";
    }

    @Override
    public String toString() {
        return summary();
    }

    public static final class Builder {

        private String host = "";
        private String username = "";
        private String password = "";
        private String database = "";
        private int port = DbConfig.DEFAULT_PORT;
        private final List<DbConfig> instances = new ArrayList<>();
        private int minConnections = 5;
        private int maxConnections = 20;
        private int initConnections = 5;
        private long connectionTimeoutMs = 5000;
        private long maxIdleTimeMs = 600_000;
        private long healthCheckPeriodMs = 30_000;
        private long reconnectIntervalMs = 1000;
        private int reconnectAttempts = 3;
        private boolean logQueries = false;
        private boolean enablePerformanceStat = true;

        private Builder() {
        }

        public Builder database(String host, String username, String password, String database, int port) {
            this.host = nullSafe(host);
            this.username = nullSafe(username);
            this.password = nullSafe(password);
            this.database = nullSafe(database);
            this.port = port;
            return this;
        }

        /**
         * 유효하지 않은 인스턴스는 추가하지 않는다.
         */
        public Builder addDatabase(DbConfig config) {
            Preconditions.checkNotNull(config, "config");
            if (config.isValid()) {
                instances.add(config);
            }
            return this;
        }

        /**
         * {@code init == 0} means "start with {@code min}"; otherwise it is capped at {@code max}.
         */
        public Builder connectionLimits(int min, int max, int init) {
            Preconditions.checkPositive(max, "maxConnections");
            Preconditions.checkPositive(min, "minConnections");
            this.maxConnections = max;
            this.minConnections = min;
            this.initConnections = init <= 0 ? min : Math.min(init, max);
            return this;
        }

        public Builder timeouts(long connectionTimeoutMs, long maxIdleTimeMs, long healthCheckPeriodMs) {
            this.connectionTimeoutMs = Preconditions.checkPositive(connectionTimeoutMs, "connectionTimeoutMs");
            this.maxIdleTimeMs = Preconditions.checkPositive(maxIdleTimeMs, "maxIdleTimeMs");
            this.healthCheckPeriodMs = Preconditions.checkPositive(healthCheckPeriodMs, "healthCheckPeriodMs");
            return this;
        }

        public Builder reconnect(long intervalMs, int attempts) {
            this.reconnectIntervalMs = intervalMs;
            this.reconnectAttempts = attempts;
            return this;
        }

        public Builder logQueries(boolean logQueries) {
            this.logQueries = logQueries;
            return this;
        }

        public Builder enablePerformanceStat(boolean enablePerformanceStat) {
            this.enablePerformanceStat = enablePerformanceStat;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }

        private static String nullSafe(String value) {
            return value == null ? "" : value;
        }
    }
}
