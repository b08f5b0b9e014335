package kr.crownrpg.connector.api.database;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DbConfigTest {

    @Test
    void defaultsPortAndWeight() {
        DbConfig config = new DbConfig("localhost", "admin", "123456", "testdb");

        assertThat(config.port()).isEqualTo(3306);
        assertThat(config.weight()).isEqualTo(1);
        assertThat(config.isValid()).isTrue();
        assertThat(config.connectionString()).isEqualTo("admin@localhost:3306/testdb");
    }

    @Test
    void passwordMayBeEmptyButHostUserAndDatabaseMayNot() {
        assertThat(new DbConfig("localhost", "admin", "", "testdb").isValid()).isTrue();
        assertThat(new DbConfig("", "admin", "pw", "testdb").isValid()).isFalse();
        assertThat(new DbConfig("localhost", null, "pw", "testdb").isValid()).isFalse();
        assertThat(new DbConfig("localhost", "admin", "pw", " ").isValid()).isFalse();
        assertThat(new DbConfig("localhost", 0, "testdb", "admin", "pw", 1, null, null).isValid()).isFalse();
    }

    @Test
    void equalityIgnoresWeightAndPassword() {
        DbConfig a = new DbConfig("db1", 3306, "app", "user", "one", 1, Map.of(), null);
        DbConfig b = new DbConfig("db1", 3306, "app", "user", "two", 5, Map.of("k", "v"), null);
        DbConfig c = new DbConfig("db1", 3306, "other", "user", "one", 1, Map.of(), null);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void toStringMasksPassword() {
        DbConfig config = new DbConfig("localhost", "admin", "hunter2", "testdb");

        assertThat(config.toString()).doesNotContain("hunter2").contains("****");
        assertThat(config.connectionString()).doesNotContain("hunter2");
    }

    @Test
    void jdbcUrlConfigIsValidWithoutHost() {
        DbConfig config = DbConfig.forJdbcUrl(" jdbc:h2:mem:x ", "sa", "");

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:h2:mem:x");
        assertThat(config.isValid()).isTrue();
        assertThat(config.connectionString()).isEqualTo("sa@jdbc:h2:mem:x");
    }
}
