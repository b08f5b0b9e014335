package kr.crownrpg.connector.core.database;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC ResultSet을 메모리에 모두 읽어 둔 결과.
 *
 * 값은 드라이버가 돌려준 텍스트 그대로 보관하고 SQL NULL은 {@code null}로 둔다.
 * 행 위치는 되감을 수 있고, {@link #release()}는 한 번만 효과가 있다.
 */
final class StoredResult {

    private final List<String> labels;
    private List<String[]> rows;
    private int position;

    private StoredResult(List<String> labels, List<String[]> rows) {
        this.labels = labels;
        this.rows = rows;
    }

    static StoredResult store(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();

        List<String> labels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(md.getColumnLabel(i));
        }

        List<String[]> rows = new ArrayList<>();
        while (rs.next()) {
            String[] values = new String[count];
            for (int i = 0; i < count; i++) {
                values[i] = rs.getString(i + 1);
            }
            rows.add(values);
        }
        return new StoredResult(Collections.unmodifiableList(labels), rows);
    }

    static StoredResult of(List<String> labels, List<String[]> rows) {
        return new StoredResult(List.copyOf(labels), new ArrayList<>(rows));
    }

    List<String> labels() {
        return labels;
    }

    int fieldCount() {
        return labels.size();
    }

    long rowCount() {
        return rows == null ? 0 : rows.size();
    }

    /**
     * @return the next row, or {@code null} once exhausted or released
     */
    String[] fetch() {
        if (rows == null || position >= rows.size()) {
            return null;
        }
        return rows.get(position++);
    }

    void seek(int offset) {
        position = offset;
    }

    /**
     * @return {@code true} if this call released the rows
     */
    boolean release() {
        if (rows == null) {
            return false;
        }
        rows = null;
        position = 0;
        return true;
    }
}
