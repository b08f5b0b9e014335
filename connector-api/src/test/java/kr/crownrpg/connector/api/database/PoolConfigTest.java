package kr.crownrpg.connector.api.database;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolConfigTest {

    @Test
    void defaultsAreSensibleButNeedADatabase() {
        PoolConfig defaults = PoolConfig.defaults();

        assertThat(defaults.port()).isEqualTo(3306);
        assertThat(defaults.minConnections()).isEqualTo(5);
        assertThat(defaults.maxConnections()).isEqualTo(20);
        assertThat(defaults.initConnections()).isEqualTo(5);
        assertThat(defaults.connectionTimeoutMs()).isEqualTo(5000);
        assertThat(defaults.maxIdleTimeMs()).isEqualTo(600_000);
        assertThat(defaults.healthCheckPeriodMs()).isEqualTo(30_000);
        assertThat(defaults.reconnectIntervalMs()).isEqualTo(1000);
        assertThat(defaults.reconnectAttempts()).isEqualTo(3);
        assertThat(defaults.logQueries()).isFalse();
        assertThat(defaults.enablePerformanceStat()).isTrue();
        assertThat(defaults.isValid()).isFalse();
    }

    @Test
    void singleDatabaseMode() {
        PoolConfig config = PoolConfig.builder()
                .database("localhost", "admin", "123456", "testdb", 3306)
                .connectionLimits(4, 16, 10)
                .timeouts(3000, 300_000, 30_000)
                .build();

        assertThat(config.isValid()).isTrue();
        assertThat(config.isMultiDatabase()).isFalse();
        assertThat(config.databaseCount()).isEqualTo(1);
        assertThat(config.summary()).isEqualTo("PoolConfig:{connections:[4, 16], timeout:3000ms, databases:1}");
    }

    @Test
    void initConnectionsFollowMinAndMax() {
        assertThat(PoolConfig.builder().connectionLimits(3, 8, 0).build().initConnections()).isEqualTo(3);
        assertThat(PoolConfig.builder().connectionLimits(3, 8, 50).build().initConnections()).isEqualTo(8);
        assertThat(PoolConfig.builder().connectionLimits(3, 8, 6).build().initConnections()).isEqualTo(6);
    }

    @Test
    void rejectsNonPositiveLimitsAndTimeouts() {
        assertThatThrownBy(() -> PoolConfig.builder().connectionLimits(0, 8, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfig.builder().connectionLimits(1, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfig.builder().timeouts(0, 1, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void minAboveMaxIsInvalid() {
        PoolConfig config = PoolConfig.builder()
                .database("localhost", "admin", "", "testdb", 3306)
                .connectionLimits(10, 4, 0)
                .build();

        assertThat(config.isValid()).isFalse();
    }

    @Test
    void multiDatabaseModeSkipsInvalidInstances() {
        PoolConfig config = PoolConfig.builder()
                .addDatabase(new DbConfig("db1.example.com", 3306, "db1", "user1", "pass", 2, null, null))
                .addDatabase(new DbConfig("db2.example.com", 3306, "db2", "user2", "pass", 3, null, null))
                .addDatabase(new DbConfig("", "nobody", "", "db3"))
                .build();

        assertThat(config.isMultiDatabase()).isTrue();
        assertThat(config.databaseCount()).isEqualTo(2);
        assertThat(config.isValid()).isTrue();
    }
}
