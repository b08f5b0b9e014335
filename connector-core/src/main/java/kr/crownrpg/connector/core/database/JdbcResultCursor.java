package kr.crownrpg.connector.core.database;

import kr.crownrpg.connector.api.database.CursorUsageException;
import kr.crownrpg.connector.api.database.CursorUsageException.Reason;
import kr.crownrpg.connector.api.database.FieldConversionException;
import kr.crownrpg.connector.api.database.ResultCursor;
import kr.crownrpg.connector.api.logging.ConnectorLogger;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * {@link ResultCursor} over a {@link StoredResult} or an affected-row count.
 */
public final class JdbcResultCursor implements ResultCursor {

    private final String owner;
    private final ConnectorLogger logger;

    private StoredResult result;
    private int fieldCount;
    private long rowCount;
    private long affectedRows;
    private List<String> fieldNames;

    private String[] currentRow;
    private int[] currentLengths;

    JdbcResultCursor(StoredResult result, long affectedRows, String owner, ConnectorLogger logger) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.result = result;
        this.affectedRows = affectedRows;
        if (result != null) {
            this.fieldCount = result.fieldCount();
            this.rowCount = result.rowCount();
            this.fieldNames = result.labels();
            logger.debug("Result cursor created [" + owner + "]: " + rowCount + " rows, " + fieldCount + " fields");
        } else {
            this.fieldNames = List.of();
            logger.debug("Result cursor created [" + owner + "] for non-result statement, affectedRows=" + affectedRows);
        }
    }

    static JdbcResultCursor ofRows(StoredResult result, String owner, ConnectorLogger logger) {
        return new JdbcResultCursor(Objects.requireNonNull(result, "result"), 0L, owner, logger);
    }

    static JdbcResultCursor ofAffectedRows(long affectedRows, String owner, ConnectorLogger logger) {
        return new JdbcResultCursor(null, affectedRows, owner, logger);
    }

    @Override
    public boolean next() {
        if (result == null) {
            return false;
        }
        String[] row = result.fetch();
        if (row == null) {
            currentRow = null;
            currentLengths = null;
            return false;
        }
        int[] lengths = new int[row.length];
        for (int i = 0; i < row.length; i++) {
            lengths[i] = row[i] == null ? 0 : row[i].getBytes(StandardCharsets.UTF_8).length;
        }
        currentRow = row;
        currentLengths = lengths;
        return true;
    }

    @Override
    public boolean reset() {
        if (result == null) {
            return false;
        }
        result.seek(0);
        currentRow = null;
        currentLengths = null;
        return true;
    }

    @Override
    public String getString(int index) {
        String value = value(index);
        return value == null ? "" : value;
    }

    @Override
    public int getInt(int index) {
        String value = value(index);
        if (value == null) {
            return 0;
        }
        try {
            return LeadingNumbers.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warning("Failed to convert '" + value + "' to int [" + owner + "]: " + e.getMessage());
            return 0;
        }
    }

    @Override
    public long getLong(int index) {
        String value = value(index);
        if (value == null) {
            return 0L;
        }
        try {
            return LeadingNumbers.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warning("Failed to convert '" + value + "' to long [" + owner + "]: " + e.getMessage());
            return 0L;
        }
    }

    @Override
    public double getDouble(int index) {
        String value = value(index);
        if (value == null) {
            return 0.0;
        }
        try {
            return LeadingNumbers.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warning("Failed to convert '" + value + "' to double [" + owner + "]: " + e.getMessage());
            return 0.0;
        }
    }

    @Override
    public boolean isNull(int index) {
        return value(index) == null;
    }

    @Override
    public int getLength(int index) {
        value(index);
        return currentLengths[index];
    }

    @Override
    public int getIntStrict(int index) {
        String value = value(index);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new FieldConversionException("Field " + index + " is not an int: '" + value + "'", value, e);
        }
    }

    @Override
    public long getLongStrict(int index) {
        String value = value(index);
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new FieldConversionException("Field " + index + " is not a long: '" + value + "'", value, e);
        }
    }

    @Override
    public double getDoubleStrict(int index) {
        String value = value(index);
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new FieldConversionException("Field " + index + " is not a double: '" + value + "'", value, e);
        }
    }

    @Override
    public String getString(String fieldName) {
        return getString(getFieldIndex(fieldName));
    }

    @Override
    public int getInt(String fieldName) {
        return getInt(getFieldIndex(fieldName));
    }

    @Override
    public long getLong(String fieldName) {
        return getLong(getFieldIndex(fieldName));
    }

    @Override
    public double getDouble(String fieldName) {
        return getDouble(getFieldIndex(fieldName));
    }

    @Override
    public boolean isNull(String fieldName) {
        return isNull(getFieldIndex(fieldName));
    }

    @Override
    public int getIntStrict(String fieldName) {
        return getIntStrict(getFieldIndex(fieldName));
    }

    @Override
    public long getLongStrict(String fieldName) {
        return getLongStrict(getFieldIndex(fieldName));
    }

    @Override
    public double getDoubleStrict(String fieldName) {
        return getDoubleStrict(getFieldIndex(fieldName));
    }

    @Override
    public int getFieldIndex(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        for (int i = 0; i < fieldNames.size(); i++) {
            if (fieldNames.get(i).equals(fieldName)) {
                return i;
            }
        }
        throw usage(Reason.FIELD_NOT_FOUND, "Field name not found: " + fieldName);
    }

    @Override
    public int getFieldCount() {
        return fieldCount;
    }

    @Override
    public long getRowCount() {
        return rowCount;
    }

    @Override
    public long getAffectedRows() {
        return affectedRows;
    }

    @Override
    public List<String> getFieldNames() {
        return fieldNames;
    }

    @Override
    public boolean isEmpty() {
        return result != null && rowCount == 0;
    }

    @Override
    public boolean hasResultSet() {
        return result != null;
    }

    @Override
    public ResultCursor transfer() {
        JdbcResultCursor target = new JdbcResultCursor(null, affectedRows, owner, logger);
        target.result = result;
        target.fieldCount = fieldCount;
        target.rowCount = rowCount;
        target.fieldNames = fieldNames;
        target.currentRow = currentRow;
        target.currentLengths = currentLengths;

        result = null;
        fieldCount = 0;
        rowCount = 0;
        affectedRows = 0;
        fieldNames = List.of();
        currentRow = null;
        currentLengths = null;
        return target;
    }

    @Override
    public void close() {
        StoredResult stored = this.result;
        this.result = null;
        currentRow = null;
        currentLengths = null;
        if (stored != null && stored.release()) {
            logger.debug("Result cursor closed [" + owner + "], result set released");
        }
    }

    private String value(int index) {
        if (result == null) {
            throw usage(Reason.NO_RESULT_SET, "Statement produced no result set");
        }
        if (index < 0 || index >= fieldCount) {
            throw usage(Reason.INDEX_OUT_OF_RANGE, "Field index out of range: " + index + ", fieldCount=" + fieldCount);
        }
        if (currentRow == null) {
            throw usage(Reason.NO_CURRENT_ROW, "No current row available, call next() first");
        }
        return currentRow[index];
    }

    private CursorUsageException usage(Reason reason, String message) {
        logger.error(message + " [" + owner + "]");
        return new CursorUsageException(reason, message);
    }
}
