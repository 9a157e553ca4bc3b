package org.tsfeatures.trimnorm.utils.tsv;

import org.tsfeatures.trimnorm.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * This wrapper includes convenience methods to {@link #get(String) get} and {@link #set(String, String) set}
 * values on data-line string arrays, using the column names or indices, and to parse typed values
 * with formatting errors reported through the exception factory supplied at construction.
 * </p>
 */
public final class DataLine {

    /**
     * Textual representations of infinite values accepted in addition to the Java ones.
     */
    private static final String POSITIVE_INFINITY = "Inf";
    private static final String NEGATIVE_INFINITY = "-Inf";

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * Holds the next appending index used by {@link #append(String)}.
     */
    private int nextIndex = 0;

    /**
     * Holds the line number for this data-line; -1 if unknown.
     */
    private final long lineNumber;

    /**
     * Reference to the enclosing table's columns.
     */
    private final TableColumnCollection columns;

    /**
     * Reference to the format error exception factory.
     */
    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     *
     * @param lineNumber the line number of the data-line in the table; -1 if unknown.
     * @param values the value array.
     * @param columns the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     * @throws IllegalArgumentException if {@code values} or {@code columns} is {@code null}, or they do not
     *     have the same length.
     */
    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        this.lineNumber = lineNumber;
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new data-line instance with no value defined.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the values of this data-line, checking that all of them are defined.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    public DataLine set(final String name, final String value) {
        return set(columnIndex(name), value);
    }

    public DataLine set(final String name, final int value) {
        return set(name, Integer.toString(value));
    }

    public DataLine set(final String name, final double value) {
        return set(name, Double.toString(value));
    }

    public DataLine set(final int index, final String value) {
        Utils.validIndex(index, values.length);
        if (index == 0 && value != null) {
            if (value.startsWith(TableUtils.COMMENT_PREFIX)) {
                throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableUtils.COMMENT_PREFIX);
            }
        }
        values[index] = value;
        return this;
    }

    public String get(final int index) {
        Utils.validIndex(index, values.length);
        if (values[index] == null) {
            throw new IllegalStateException("requested column value at " + index + " has not been initialized yet");
        }
        return values[index];
    }

    public int getInt(final int index) {
        try {
            return Integer.parseInt(get(index).trim());
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    /**
     * Returns the double value in a column by its index.
     * <p>
     * Besides the formats accepted by {@link Double#parseDouble}, {@value #POSITIVE_INFINITY} and
     * {@value #NEGATIVE_INFINITY} are accepted for the infinities.
     * </p>
     */
    public double getDouble(final int index) {
        final String value = get(index).trim();
        if (value.equalsIgnoreCase(POSITIVE_INFINITY)) {
            return Double.POSITIVE_INFINITY;
        } else if (value.equalsIgnoreCase(NEGATIVE_INFINITY)) {
            return Double.NEGATIVE_INFINITY;
        }
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected double value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public boolean getBoolean(final int index) {
        final String value = get(index);
        final String trueString = Boolean.toString(true);
        final String falseString = Boolean.toString(false);
        if (!value.equals(trueString) && !value.equals(falseString)) {
            throw formatErrorFactory.apply(String.format("Boolean value must be '%s' or '%s' (case sensitive) for column %s but found %s",
                    trueString, falseString, columns.nameAt(index), value));
        }
        return Boolean.parseBoolean(value);
    }

    public String get(final String columnName) {
        final int index = columnIndex(columnName);
        if (values[index] == null) {
            throw new IllegalStateException(String.format("the value for column '%s' is undefined", columnName));
        } else {
            return values[index];
        }
    }

    /**
     * Returns the string value in a column by its name, or a default if there is no such column.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            return defaultValue;
        } else {
            return values[index];
        }
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }

    public int getInt(final String columnName) {
        return getInt(columnIndex(columnName));
    }

    public double getDouble(final String columnName) {
        return getDouble(columnIndex(columnName));
    }

    public boolean getBoolean(final String columnName) {
        return getBoolean(columnIndex(columnName));
    }

    public String get(final Enum<?> column) {
        return get(Utils.nonNull(column).toString());
    }

    public int getInt(final Enum<?> column) {
        return getInt(Utils.nonNull(column).toString());
    }

    public DataLine set(final Enum<?> column, final String value) {
        return set(Utils.nonNull(column).toString(), value);
    }

    public DataLine set(final Enum<?> column, final int value) {
        return set(Utils.nonNull(column).toString(), value);
    }

    /**
     * Sets the next value in the data-line that correspond to a column.
     *
     * @throws IllegalStateException if the data-line is already full.
     */
    public DataLine append(final String value) {
        if (nextIndex == values.length) {
            throw new IllegalStateException("gone beyond of the end of the data-line");
        }
        values[nextIndex++] = value;
        return this;
    }

    public DataLine append(final double value) {
        return append(Double.toString(value));
    }

    public DataLine append(final double... values) {
        for (final double d : Utils.nonNull(values, "the values cannot be null")) {
            append(d);
        }
        return this;
    }

    public DataLine append(final int... values) {
        for (final int i : Utils.nonNull(values, "the values cannot be null")) {
            append(Integer.toString(i));
        }
        return this;
    }

    /**
     * Returns a copy of the values in the data-line, in column order.
     */
    public String[] toArray() {
        return values.clone();
    }
}
