package kr.crownrpg.connector.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import kr.crownrpg.connector.api.database.DbConfig;
import kr.crownrpg.connector.api.database.PoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * connector.yml 로더.
 *
 * <pre>
 * database:
 *   host: localhost
 *   port: 3306
 *   database: testdb
 *   username: admin
 *   password: secret
 *   jdbc-url: (선택) 지정 시 host/port/database 대신 사용
 *   properties: { useSSL: "false" }
 * pool:            # 선택
 *   min-connections: 5
 *   max-connections: 20
 *   init-connections: 5
 *   connection-timeout-ms: 5000
 *   max-idle-time-ms: 600000
 *   health-check-period-ms: 30000
 *   reconnect-interval-ms: 1000
 *   reconnect-attempts: 3
 *   log-queries: false
 *   enable-performance-stat: true
 *   instances: [ {host, port, database, username, password, weight}, ... ]
 * </pre>
 */
public record ConnectorYamlConfig(DbConfig database, PoolConfig pool) {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectorYamlConfig.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public ConnectorYamlConfig {
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(pool, "pool");
    }

    public static ConnectorYamlConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public static ConnectorYamlConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            return fromTree(YAML.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse connector config", e);
        }
    }

    public static ConnectorYamlConfig parse(String yaml) {
        Objects.requireNonNull(yaml, "yaml");
        try {
            return fromTree(YAML.readTree(yaml));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse connector config", e);
        }
    }

    static ConnectorYamlConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("connector config must be a mapping");
        }
        DbConfig database = readDatabase(root.get("database"), "database", true);
        PoolConfig pool = readPool(root.get("pool"), database);
        if (!pool.isValid()) {
            LOGGER.warn("풀 설정이 유효하지 않습니다: {}", pool.summary());
        }
        LOGGER.info("커넥터 설정을 불러왔습니다: {} / {}", database.connectionString(), pool.summary());
        return new ConnectorYamlConfig(database, pool);
    }

    private static DbConfig readDatabase(JsonNode section, String path, boolean requireUser) {
        if (section == null || !section.isObject()) {
            throw new IllegalArgumentException(path + " section is missing");
        }
        String jdbcUrl = text(section, "jdbc-url");
        String host = text(section, "host");
        int port = section.path("port").asInt(DbConfig.DEFAULT_PORT);
        String database = text(section, "database");
        String username = text(section, "username");
        String password = section.path("password").asText("");
        int weight = section.path("weight").asInt(DbConfig.DEFAULT_WEIGHT);
        Map<String, String> properties = readProperties(section.get("properties"));

        if (jdbcUrl.isBlank()) {
            if (host.isBlank()) {
                throw new IllegalArgumentException(path + ".host must not be blank");
            }
            if (database.isBlank()) {
                throw new IllegalArgumentException(path + ".database must not be blank");
            }
            if (port <= 0) {
                throw new IllegalArgumentException(path + ".port must be greater than 0");
            }
        }
        if (requireUser && username.isBlank()) {
            throw new IllegalArgumentException(path + ".username must not be blank");
        }
        return new DbConfig(host, port, database, username, password, weight, properties, jdbcUrl);
    }

    private static PoolConfig readPool(JsonNode section, DbConfig database) {
        PoolConfig.Builder builder = PoolConfig.builder()
                .database(database.host(), database.username(), database.password(), database.database(), database.port());
        if (section == null || section.isNull()) {
            return builder.build();
        }
        if (!section.isObject()) {
            throw new IllegalArgumentException("pool section must be a mapping");
        }
        PoolConfig defaults = PoolConfig.defaults();

        builder.connectionLimits(
                section.path("min-connections").asInt(defaults.minConnections()),
                section.path("max-connections").asInt(defaults.maxConnections()),
                section.path("init-connections").asInt(defaults.initConnections()));
        builder.timeouts(
                section.path("connection-timeout-ms").asLong(defaults.connectionTimeoutMs()),
                section.path("max-idle-time-ms").asLong(defaults.maxIdleTimeMs()),
                section.path("health-check-period-ms").asLong(defaults.healthCheckPeriodMs()));
        builder.reconnect(
                section.path("reconnect-interval-ms").asLong(defaults.reconnectIntervalMs()),
                section.path("reconnect-attempts").asInt(defaults.reconnectAttempts()));
        builder.logQueries(section.path("log-queries").asBoolean(defaults.logQueries()));
        builder.enablePerformanceStat(section.path("enable-performance-stat").asBoolean(defaults.enablePerformanceStat()));

        JsonNode instances = section.get("instances");
        if (instances != null && instances.isArray()) {
            for (int i = 0; i < instances.size(); i++) {
                DbConfig instance = readDatabase(instances.get(i), "pool.instances[" + i + "]", false);
                if (!instance.isValid()) {
                    LOGGER.warn("유효하지 않은 DB 인스턴스를 건너뜁니다: {}", instance);
                }
                builder.addDatabase(instance);
            }
        }
        return builder.build();
    }

    private static Map<String, String> readProperties(JsonNode section) {
        if (section == null || !section.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(entry.getKey(), entry.getValue().asText(""));
        }
        return Collections.unmodifiableMap(result);
    }

    private static String text(JsonNode section, String key) {
        JsonNode node = section.get(key);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("").trim();
    }
}
