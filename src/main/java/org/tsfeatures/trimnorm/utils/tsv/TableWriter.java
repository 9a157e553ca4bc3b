package org.tsfeatures.trimnorm.utils.tsv;

import com.opencsv.CSVWriter;
import org.tsfeatures.trimnorm.utils.Utils;

import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Class to write tab separated value files.
 * <p>
 * The column name header line is written before the first record, or when the writer is closed if no
 * record was written at all. Comment lines start with {@link TableUtils#COMMENT_PREFIX}.
 * </p>
 * <p>
 * Sub-classes decide how records map onto data-lines by implementing {@link #composeLine}.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    /**
     * Holds the number of lines written so far, including comments and the header.
     */
    private long lineNumber;

    /**
     * CSV writer used to compose the output.
     */
    private final CSVWriter writer;

    /**
     * Table column names.
     */
    private final TableColumnCollection columns;

    /**
     * Whether the header column name line has been written or not.
     */
    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the file and column names.
     *
     * @param file         the destination file.
     * @param tableColumns the table column names.
     * @throws IllegalArgumentException if either {@code file} or {@code tableColumns} are {@code null}.
     * @throws IOException              if one was raised when opening the destination file for writing.
     */
    public TableWriter(final File file, final TableColumnCollection tableColumns) throws IOException {
        this(new OutputStreamWriter(new FileOutputStream(Utils.nonNull(file, "The file cannot be null.")), StandardCharsets.UTF_8), tableColumns);
    }

    /**
     * Creates a new table writer given an destination writer and column names.
     *
     * @param writer  the destination writer.
     * @param columns the table column names.
     * @throws IllegalArgumentException if either {@code writer} or {@code columns} are {@code null}.
     */
    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    /**
     * Writes a comment into the output.
     *
     * @param comment the comment to write out.
     */
    public final void writeComment(final String comment) {
        Utils.nonNull(comment, "The comment cannot be null.");
        writer.writeNext(new String[]{TableUtils.COMMENT_PREFIX + comment}, false);
        lineNumber++;
    }

    /**
     * Writes a new record.
     *
     * @param record the record to be written.
     * @throws IllegalArgumentException if {@code record} is {@code null}.
     */
    public void writeRecord(final R record) {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(lineNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        lineNumber++;
    }

    /**
     * Writes a sequence of records.
     *
     * @param records the records to be written.
     * @throws IllegalArgumentException if {@code records} is {@code null} or contains a {@code null}.
     */
    public final void writeAllRecords(final Iterable<R> records) {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Writes the header if it has not been written already.
     */
    public void writeHeaderIfApplies() {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
            lineNumber++;
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write into the output to represent a given record.
     *
     * @param record   the record to write.
     * @param dataLine the destination data-line object.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
