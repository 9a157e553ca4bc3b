package org.tsfeatures.trimnorm.utils.tsv;

import org.tsfeatures.trimnorm.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Common constants and factory methods for table readers and writers.
 */
public final class TableUtils {

    /**
     * Column separator {@value #COLUMN_SEPARATOR_STRING}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Column separator as an string.
     */
    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Comment line prefix string {@value}.
     * <p>
     * Lines that start with this prefix (spaces are not ignored), will be considered comment
     * lines (neither a header line nor data line).
     * </p>
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character.
     * <p>
     * Character used to quote table values that contain special characters.
     * </p>
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character.
     * <p>
     * Within quotes, the user must prepend this character when including quotes
     * or the escape character itself as part of the string.
     * </p>
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Creates a new table reader given an record extractor factory based from the columns found in the input.
     * <p>
     * The record extractor factory takes the input {@link TableColumnCollection} and an exception factory
     * that must be used to compose the exception thrown when there is a formatting error. It returns the
     * function that maps each {@link DataLine} into a record; that function must never return {@code null}.
     * </p>
     *
     * @param file                   the input file
     * @param recordExtractorFactory the record extractor function factory.
     * @param <R>                    the end record type.
     * @return never {@code null}.
     * @throws IOException              if any took place while instantiating the reader.
     * @throws IllegalArgumentException if {@code file} is {@code null}.
     */
    public static <R> TableReader<R> reader(final File file,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory,"the record extractor factory cannot be null");
        return new TableReader<R>(file) {
            private Function<DataLine,R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns,this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table writer given the destination file, columns and the data-line composer.
     * @param file the destination file.
     * @param columns the output columns.
     * @param dataLineComposer the data-line composer given the record object.
     * @param <R> the record type.
     * @return never {@code null}.
     * @throws IllegalArgumentException if any, {@code file}, {@code columns} or {@code dataLineComposer}, is {@code null}.
     * @throws IOException if any was thrown when instantiating the writer.
     */
    public static <R> TableWriter<R> writer(final File file, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        return new DataLineComposerBasedTableWriter<>(file, columns, dataLineComposer);
    }

    /**
     * Checks if all mandatory columns are present in a {@link TableColumnCollection}.
     * @param columns                   the TableColumnCollection of columns to check
     * @param mandatoryColumns          the TableColumnCollection of mandatory columns
     * @param formatExceptionFactory    the format exception function factory
     * @throws RuntimeException         built by {@code formatExceptionFactory} if any mandatory columns are missing
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatoryColumns,
                                             final Function<String, RuntimeException> formatExceptionFactory) {
        if (!columns.containsAll(mandatoryColumns.names())) {
            final List<String> missingColumns = mandatoryColumns.names().stream()
                    .filter(name -> !columns.contains(name))
                    .collect(Collectors.toList());
            throw formatExceptionFactory.apply("Bad header in file.  Not all mandatory columns are present.  Missing: " + String.join(", ", missingColumns));
        }
    }

    private static final class DataLineComposerBasedTableWriter<R> extends TableWriter<R> {
        private final BiConsumer<R, DataLine> dataLineComposer;

        private DataLineComposerBasedTableWriter(final File file, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
            super(file, columns);
            this.dataLineComposer = Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        }

        @Override
        protected void composeLine(final R record, final DataLine dataLine) {
            dataLineComposer.accept(record, dataLine);
        }
    }

    /**
     * Declared to make instantiation impossible.
     */
    private TableUtils() {
        throw new UnsupportedOperationException();
    }
}
