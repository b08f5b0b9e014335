package kr.crownrpg.connector.api.database;

import java.util.List;

/**
 * Outcome of one executed statement: either a materialized result set or an affected-row count.
 *
 * <p>Field access requires a current row, i.e. a {@link #next()} that returned {@code true}
 * since construction or the last {@link #reset()}. SQL NULL reads as {@code ""}, {@code 0} or
 * {@code 0.0}; use {@link #isNull(int)} to tell it apart. Lookup by name returns the first
 * column with that label.
 *
 * <p>A cursor exclusively owns its result set. {@link #close()} releases it exactly once and
 * {@link #transfer()} hands it to a new cursor. Cursors are not thread-safe.
 */
public interface ResultCursor extends AutoCloseable {

    boolean next();

    boolean reset();

    String getString(int index);

    int getInt(int index);

    long getLong(int index);

    double getDouble(int index);

    boolean isNull(int index);

    /**
     * UTF-8 byte length of the field in the current row, 0 for NULL.
     */
    int getLength(int index);

    String getString(String fieldName);

    int getInt(String fieldName);

    long getLong(String fieldName);

    double getDouble(String fieldName);

    boolean isNull(String fieldName);

    /**
     * Like {@link #getInt(int)} but unparseable text raises {@link FieldConversionException}.
     */
    int getIntStrict(int index);

    long getLongStrict(int index);

    double getDoubleStrict(int index);

    int getIntStrict(String fieldName);

    long getLongStrict(String fieldName);

    double getDoubleStrict(String fieldName);

    int getFieldIndex(String fieldName);

    int getFieldCount();

    long getRowCount();

    long getAffectedRows();

    List<String> getFieldNames();

    /**
     * {@code true} only for a result set with zero rows.
     */
    boolean isEmpty();

    boolean hasResultSet();

    /**
     * Moves the result set into a new cursor. This cursor is left without a result set.
     */
    ResultCursor transfer();

    @Override
    void close();
}
