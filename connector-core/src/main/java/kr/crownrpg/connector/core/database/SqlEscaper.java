package kr.crownrpg.connector.core.database;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Escapes text for use inside a single-quoted SQL literal, according to how the
 * connected server parses string literals.
 */
public enum SqlEscaper {

    /**
     * MySQL/MariaDB default: backslash is an escape character.
     */
    BACKSLASH {
        @Override
        public String escape(String value) {
            StringBuilder sb = new StringBuilder(value.length() + 16);
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '\0' -> sb.append("\\0");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\\' -> sb.append("\\\\");
                    case '\'' -> sb.append("\\'");
                    case '"' -> sb.append("\\\"");
                    case '\u001A' -> sb.append("\\Z");
                    default -> sb.append(c);
                }
            }
            return sb.toString();
        }
    },

    /**
     * ANSI literals (and MySQL with NO_BACKSLASH_ESCAPES): only the quote is doubled.
     */
    STANDARD {
        @Override
        public String escape(String value) {
            return value.replace("'", "''");
        }
    };

    public abstract String escape(String value);

    static SqlEscaper detect(Connection connection) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        String product = md.getDatabaseProductName();
        if (product == null) {
            return STANDARD;
        }
        String name = product.toLowerCase(Locale.ROOT);
        if (!name.contains("mysql") && !name.contains("mariadb")) {
            return STANDARD;
        }
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT @@SESSION.sql_mode")) {
            String mode = rs.next() ? rs.getString(1) : null;
            if (mode != null && mode.toUpperCase(Locale.ROOT).contains("NO_BACKSLASH_ESCAPES")) {
                return STANDARD;
            }
        }
        return BACKSLASH;
    }
}
