package kr.crownrpg.connector.core.database;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqlEscaperTest {

    @Test
    void backslashModeEscapesMySqlSpecials() {
        assertThat(SqlEscaper.BACKSLASH.escape("O'Reilly")).isEqualTo("O\\'Reilly");
        assertThat(SqlEscaper.BACKSLASH.escape("a\\b")).isEqualTo("a\\\\b");
        assertThat(SqlEscaper.BACKSLASH.escape("say \"hi\"")).isEqualTo("say \\\"hi\\\"");
        assertThat(SqlEscaper.BACKSLASH.escape("line1\nline2\r")).isEqualTo("line1\\nline2\\r");
        assertThat(SqlEscaper.BACKSLASH.escape("nul\0ctrl\u001A")).isEqualTo("nul\\0ctrl\\Z");
        assertThat(SqlEscaper.BACKSLASH.escape("plain")).isEqualTo("plain");
    }

    @Test
    void standardModeOnlyDoublesQuotes() {
        assertThat(SqlEscaper.STANDARD.escape("O'Reilly \\ it's")).isEqualTo("O''Reilly \\ it''s");
    }

    @Test
    void detectsBackslashModeOnMySql() throws Exception {
        Connection connection = mySql("STRICT_TRANS_TABLES,NO_ENGINE_SUBSTITUTION");

        assertThat(SqlEscaper.detect(connection)).isEqualTo(SqlEscaper.BACKSLASH);
    }

    @Test
    void honoursNoBackslashEscapes() throws Exception {
        Connection connection = mySql("ANSI_QUOTES,NO_BACKSLASH_ESCAPES");

        assertThat(SqlEscaper.detect(connection)).isEqualTo(SqlEscaper.STANDARD);
    }

    @Test
    void otherProductsUseStandardMode() throws Exception {
        Connection connection = mock(Connection.class);
        DatabaseMetaData md = mock(DatabaseMetaData.class);
        when(connection.getMetaData()).thenReturn(md);
        when(md.getDatabaseProductName()).thenReturn("H2");

        assertThat(SqlEscaper.detect(connection)).isEqualTo(SqlEscaper.STANDARD);
        verify(connection, never()).createStatement();
    }

    private static Connection mySql(String sqlMode) throws Exception {
        Connection connection = mock(Connection.class);
        DatabaseMetaData md = mock(DatabaseMetaData.class);
        Statement statement = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.getMetaData()).thenReturn(md);
        when(md.getDatabaseProductName()).thenReturn("MySQL");
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SELECT @@SESSION.sql_mode")).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn(sqlMode);
        return connection;
    }
}
