package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.database.DbConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcUrlsTest {

    @Test
    void buildsMySqlUrlFromHostPortAndDatabase() {
        assertThat(JdbcUrls.resolve(new DbConfig("db.internal", "admin", "pw", "app")))
                .isEqualTo("jdbc:mysql://db.internal:3306/app");
        assertThat(JdbcUrls.mysql("localhost", 3307, "")).isEqualTo("jdbc:mysql://localhost:3307/");
    }

    @Test
    void explicitUrlWins() {
        assertThat(JdbcUrls.resolve(DbConfig.forJdbcUrl("jdbc:h2:mem:x", "sa", ""))).isEqualTo("jdbc:h2:mem:x");
    }

    @Test
    void hostIsRequired() {
        assertThatThrownBy(() -> JdbcUrls.mysql(" ", 3306, "app")).isInstanceOf(IllegalArgumentException.class);
    }
}
