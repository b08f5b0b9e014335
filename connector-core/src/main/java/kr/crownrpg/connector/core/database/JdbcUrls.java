package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.Preconditions;
import kr.crownrpg.connector.api.database.DbConfig;

import java.util.Objects;

public final class JdbcUrls {

    private JdbcUrls() {}

    /**
     * 명시적인 JDBC URL이 있으면 그대로, 없으면 MySQL Connector/J URL을 만든다.
     * 데이터베이스 이름이 비어 있으면 스키마 없이 서버에만 붙는다.
     */
    public static String resolve(DbConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.jdbcUrl() != null) {
            return config.jdbcUrl();
        }
        return mysql(config.host(), config.port(), config.database());
    }

    public static String mysql(String host, int port, String database) {
        Preconditions.checkNotBlank(host, "host");
        return "jdbc:mysql://" + host + ":" + port + "/" + (database == null ? "" : database);
    }
}
