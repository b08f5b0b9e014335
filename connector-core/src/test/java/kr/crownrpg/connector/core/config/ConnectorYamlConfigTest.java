package kr.crownrpg.connector.core.config;

import kr.crownrpg.connector.api.database.DbConfig;
import kr.crownrpg.connector.api.database.PoolConfig;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorYamlConfigTest {

    @Test
    void loadsDatabaseAndPoolSections() throws Exception {
        ConnectorYamlConfig config;
        try (InputStream in = getClass().getResourceAsStream("/connector.yml")) {
            config = ConnectorYamlConfig.load(in);
        }

        DbConfig db = config.database();
        assertThat(db.host()).isEqualTo("db.internal");
        assertThat(db.port()).isEqualTo(3307);
        assertThat(db.database()).isEqualTo("testdb");
        assertThat(db.username()).isEqualTo("admin");
        assertThat(db.password()).isEqualTo("123456");
        assertThat(db.properties()).containsEntry("useSSL", "false").containsEntry("serverTimezone", "UTC");
        assertThat(db.isValid()).isTrue();

        PoolConfig pool = config.pool();
        assertThat(pool.minConnections()).isEqualTo(4);
        assertThat(pool.maxConnections()).isEqualTo(16);
        assertThat(pool.initConnections()).isEqualTo(10);
        assertThat(pool.connectionTimeoutMs()).isEqualTo(3000);
        assertThat(pool.maxIdleTimeMs()).isEqualTo(300_000);
        assertThat(pool.reconnectIntervalMs()).isEqualTo(1000);
        assertThat(pool.reconnectAttempts()).isEqualTo(5);
        assertThat(pool.logQueries()).isTrue();
        assertThat(pool.enablePerformanceStat()).isTrue();
        assertThat(pool.databaseCount()).isEqualTo(2);
        assertThat(pool.instances()).extracting(DbConfig::weight).containsExactly(2, 3);
        assertThat(pool.isValid()).isTrue();
    }

    @Test
    void poolSectionIsOptional() {
        ConnectorYamlConfig config = ConnectorYamlConfig.parse("""
                database:
                  host: localhost
                  database: app
                  username: app
                """);

        assertThat(config.database().port()).isEqualTo(DbConfig.DEFAULT_PORT);
        assertThat(config.pool().summary()).isEqualTo("PoolConfig:{connections:[5, 20], timeout:5000ms, databases:1}");
        assertThat(config.pool().host()).isEqualTo("localhost");
    }

    @Test
    void jdbcUrlReplacesHostAndDatabase() {
        ConnectorYamlConfig config = ConnectorYamlConfig.parse("""
                database:
                  jdbc-url: "jdbc:h2:mem:app"
                  username: sa
                """);

        assertThat(config.database().jdbcUrl()).isEqualTo("jdbc:h2:mem:app");
    }

    @Test
    void rejectsMissingOrBlankFields() {
        assertThatThrownBy(() -> ConnectorYamlConfig.parse("pool: {}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("database section is missing");
        assertThatThrownBy(() -> ConnectorYamlConfig.parse("""
                database:
                  host: "  "
                  database: app
                  username: app
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("database.host");
        assertThatThrownBy(() -> ConnectorYamlConfig.parse("""
                database:
                  host: localhost
                  database: app
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("database.username");
    }
}
