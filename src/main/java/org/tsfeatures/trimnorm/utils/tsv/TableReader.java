package org.tsfeatures.trimnorm.utils.tsv;

import com.opencsv.CSVReader;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.Utils;

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the contents of a tab separated value formatted text input into
 * records of an arbitrary type {@link R}.
 * <h3>Format description</h3>
 * <p>
 * Tab separated values may contain any number of <i>comment lines</i> (started with {@link TableUtils#COMMENT_PREFIX}),
 * a column name containing line (aka. the <i>header line</i>) and any number of <i>data lines</i> one per record.
 * </p>
 * <p>
 * The header line is the first non-comment line, whereas any other non-comment line after that is
 * considered a data line. The header line values, the column names, must all be different, and
 * all data lines have to have as many values as the header line.
 * </p>
 * <p>Values can be quoted using {@link TableUtils#QUOTE_CHARACTER}; within quotes, special characters must be
 * escaped using the {@link TableUtils#ESCAPE_CHARACTER}.</p>
 * <h3>Implementing your own reader</h3>
 * <p>
 * Implementations control how instances of {@link R} are instantiated by extending
 * {@link #createRecord(DataLine) createRecord}. They can also override {@link #processColumns} in order to
 * verify that the sequence of column names is expected, throwing the exception composed by
 * {@link #formatException(String)} if not.
 * </p>
 *
 * @param <R> the record type for the reader.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the input source.
     * <p>It can be {@code null} indicating that no name was provided at construction</p>.
     */
    private final String source;

    /**
     * Input text reader.
     * <p>
     * Keeps track of the last line number read for error reporting purposes.
     * </p>
     */
    private final LineNumberReader reader;

    /**
     * Holds a reference to the column names.
     */
    private TableColumnCollection columns;

    /**
     * Holds a reference to the csvReader object use to read and parse the input
     * into {@link String} arrays.
     */
    private final CSVReader csvReader;

    /**
     * Indicates whether the reader has tried to fetch the next record.
     */
    private boolean nextRecordFetched = false;

    /**
     * Holds a reference to the next record.
     * <p>
     * This is {@code null} when we reached the end of the source.
     * </p>
     */
    private R nextRecord;

    /**
     * Creates a new table reader given the input file.
     * <p>
     * This operation will read the first lines of the input file until the
     * column name header line is found.
     * </p>
     *
     * @param file the input file.
     * @throws IllegalArgumentException if {@code file} is {@code null}.
     * @throws IOException              if any is raised when accessing the file.
     */
    public TableReader(final File file) throws IOException {
        this(Utils.nonNull(file, "the input file cannot be null").getPath(),
                new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
    }

    /**
     * Creates a new table reader given an input {@link Reader}.
     *
     * @param sourceName   name of the source to use in error messages. It can be {@code null}, indicating that is anonymous.
     * @param sourceReader reader to the text to process.
     * @throws IllegalArgumentException if {@code sourceReader} is {@code null}.
     * @throws IOException              if is raised when reading from the source.
     */
    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");

        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
        this.nextRecordFetched = false;
    }

    /**
     * Process the first lines of the input source until the header line.
     *
     * @throws IOException            if an {@link IOException} occurred when reading from the source.
     * @throws UserException.BadInput if there is formatting error in the input.
     */
    private void findAndProcessHeaderLine() throws IOException {
        final String[] line = skipCommentLines();
        TableColumnCollection.checkNames(line, this::formatException);
        columns = new TableColumnCollection(line);
        processColumns(columns);
    }

    /**
     * Checks whether a line is a comment line or not.
     *
     * @param line input line already split into line-values.
     * @return {@code true} if {@code line} seems to be a comment line.
     */
    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    /**
     * Composes the exception to be thrown due to a formatting error.
     * <p>
     * The input {@code message} can be omitted by providing a {@code null} value.
     * </p>
     *
     * @param message custom error message.
     * @return never {@code null}.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d", reader.getLineNumber()) + explanation);
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d", source, reader.getLineNumber()) + explanation);
        }
    }

    /**
     * Process the header line's column names.
     * <p>
     * Implementations must use {@link #formatException(String)} to create the exception to throw in case
     * there is any formatting issue.
     * </p>
     *
     * @param tableColumns columns found in the input. It is guarantee not to be
     *                     a {@code null} and not to contain any {@code null} values.
     * @throws UserException.BadInput if there is a formatting issue.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    /**
     * Returns the column collection for this reader.
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Returns the next record form the source.
     *
     * @return {@code null} if there is no more record in the input.
     * @throws IOException if a {@link IOException} was thrown when reading from the input.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    /**
     * Fetch the next record from the source.
     *
     * @return {@code null} if there is no more record in the input.
     * @throws IOException if a {@link IOException} was thrown when reading from the input.
     */
    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line)) {
                if (line.length != columns.columnCount()) {
                    throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
                } else {
                    final R result = createRecord(new DataLine(reader.getLineNumber(), line, columns, this::formatException));
                    if (result != null) {
                        return result;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Skip comment lines from the output.
     *
     * @return the next non-comment line content.
     * @throws IOException if it was raised when reading for the source.
     * @throws UserException.BadInput if the source ends before a header line is found.
     */
    private String[] skipCommentLines() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line)) {
                return line;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    /**
     * Transforms a data-line column values into a record.
     * <p>
     * Implementation should use {@link #formatException(String)} to indicate a formatting error
     * that makes impossible to create a instance of {@link R} given the input line values {@code dataLine}.
     * </p>
     *
     * @param dataLine values corresponding to the column names that was passed earlier to {@link #processColumns(TableColumnCollection)}}.
     * @return {@code null} to skip the line, the record otherwise.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    /**
     * Returns an iterator on the remaining records in
     * the input.
     *
     * @return never {@code null}.
     */
    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                fetchIfNeeded();
                return nextRecord != null;
            }

            @Override
            public R next() {
                fetchIfNeeded();
                if (nextRecord == null) {
                    throw new NoSuchElementException("there is no more record in the input");
                } else {
                    nextRecordFetched = false;
                    return nextRecord;
                }
            }

            private void fetchIfNeeded() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    /**
     * Returns an stream on the reaming records in the source.
     * <p>
     * Any {@link IOException} raised when using the stream will be propagated up wrapped in a {@link UncheckedIOException}.
     * </p>
     *
     * @return never {@code null}.
     */
    public Stream<R> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Read the remaining records into a list.
     * <p>
     *     Notice that this operation does not close the reader.
     * </p>
     *
     * @return never {@code null}, but potentially empty.
     */
    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }
}
