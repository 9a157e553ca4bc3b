package org.tsfeatures.trimnorm.utils.tsv;

import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Represents a list of table columns.
 * <p>
 * This class is immutable.
 * </p>
 * <p>
 * Column names are unique, cannot be {@code null} and the first one cannot start with
 * {@link TableUtils#COMMENT_PREFIX}.
 * </p>
 */
public final class TableColumnCollection {

    /**
     * Holds the list of column names in order.
     */
    private final List<String> names;

    /**
     * Map column name to index in {@link #names}.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column collection from a sequence of column names.
     *
     * @param names the column names in order; not {@code null}.
     * @throws IllegalArgumentException if {@code names} is {@code null}, contains a {@code null} or repeated names.
     */
    public TableColumnCollection(final Iterable<String> names) {
        this(StreamSupport.stream(Utils.nonNull(names, "the names cannot be null").spliterator(), false).toArray(String[]::new));
    }

    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Creates a new table-column collection from the constants of an enum, using their {@code toString()}
     * values as names.
     */
    public TableColumnCollection(final Class<? extends Enum<?>> enumClass) {
        Utils.nonNull(enumClass);
        // Despite the generic annotation, due to erasure this might not be a enum class
        // in run-time.
        if (!enumClass.isEnum()) {
            throw new IllegalArgumentException("the input class must be an enum class");
        }
        names = Collections.unmodifiableList(
                Stream.of(enumClass.getEnumConstants())
                .map(Object::toString)
                .collect(Collectors.toList()));
        checkNames(names.toArray(new String[names.size()]), IllegalArgumentException::new);
        indexByName = IntStream.range(0, names.size()).boxed()
                .collect(Collectors.toMap(names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, an unmodifiable list.
     */
    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name.
     *
     * @return -1 if there is no such a column.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final Iterable<String> names) {
        for (final String name : Utils.nonNull(names, "names cannot be null")) {
            if (!contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether columns contain all the names in an array and no other.
     */
    public boolean containsExactly(final String... names) {
        return containsAll(Arrays.asList(Utils.nonNull(names, "names cannot be null"))) && columnCount() == names.length;
    }

    /**
     * Checks whether the columns, in order, match the names in an array exactly.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "names cannot be null");
        return Arrays.asList(names).equals(this.names);
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a list of column names is valid.
     * <p>
     * A list of column names is valid if it is not empty, contains no {@code null}, has no repeats, and the first
     * name does not start with {@link TableUtils#COMMENT_PREFIX}.
     * </p>
     *
     * @param columnNames      the column names to validate.
     * @param exceptionFactory the exception factory used to compose the exception thrown on a violation.
     * @return the same array as {@code columnNames}.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i],"no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw Utils.nonNull(exceptionFactory.apply("the first column name cannot start with the comment prefix"), "exception factory produces null exceptions");
        }
        return columnNames;
    }
}
