package org.tsfeatures.trimnorm.utils.tsv;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

public final class TableUtilsUnitTest extends BaseTest {

    private enum Column {
        NAME,
        VALUE,
        FLAG
    }

    private static final TableColumnCollection COLUMNS = new TableColumnCollection(Column.class);

    private static File writeLines(final String... lines) throws IOException {
        final File file = new File(createTempDir("tables"), "table.tsv");
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    private static List<Pair<String, Double>> readNameValuePairs(final File file) throws IOException {
        try (final TableReader<Pair<String, Double>> reader = TableUtils.reader(file, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, new TableColumnCollection("NAME", "VALUE"), formatExceptionFactory);
            return dataLine -> new ImmutablePair<>(dataLine.get(Column.NAME), dataLine.getDouble(Column.VALUE.name()));
        })) {
            return reader.toList();
        }
    }

    @Test
    public void testWriteThenRead() throws IOException {
        final File file = new File(createTempDir("tables"), "written.tsv");
        final List<Pair<String, Double>> records = Arrays.asList(
                new ImmutablePair<>("alpha", 1.5),
                new ImmutablePair<>("beta", Double.NaN),
                new ImmutablePair<>("gamma", Double.NEGATIVE_INFINITY));
        try (final TableWriter<Pair<String, Double>> writer = TableUtils.writer(file, COLUMNS, (record, dataLine) -> dataLine
                .set(Column.NAME, record.getKey())
                .set(Column.VALUE.name(), record.getValue())
                .set(Column.FLAG, Boolean.toString(record.getValue() > 0)))) {
            writer.writeComment("written by a test");
            writer.writeAllRecords(records);
        }

        final List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals(lines.get(0), "#written by a test");
        Assert.assertEquals(lines.get(1), "NAME\tVALUE\tFLAG");
        Assert.assertEquals(lines.get(2), "alpha\t1.5\ttrue");

        final List<Pair<String, Double>> read = readNameValuePairs(file);
        Assert.assertEquals(read.size(), 3);
        Assert.assertEquals(read.get(0), records.get(0));
        Assert.assertTrue(Double.isNaN(read.get(1).getValue()));
        Assert.assertEquals(read.get(2).getValue(), Double.NEGATIVE_INFINITY, 0.);
    }

    @Test
    public void testInfinityAbbreviations() throws IOException {
        final List<Pair<String, Double>> read = readNameValuePairs(writeLines("NAME\tVALUE", "a\tInf", "b\t-inf", "c\t 2.0 "));
        Assert.assertEquals(read.get(0).getValue(), Double.POSITIVE_INFINITY, 0.);
        Assert.assertEquals(read.get(1).getValue(), Double.NEGATIVE_INFINITY, 0.);
        Assert.assertEquals(read.get(2).getValue(), 2.0, 0.);
    }

    @Test
    public void testBooleanValues() throws IOException {
        final File file = writeLines("NAME\tVALUE\tFLAG", "a\t1\ttrue", "b\t2\tfalse", "c\t3\tTRUE");
        try (final TableReader<Boolean> reader = TableUtils.reader(file, (columns, formatExceptionFactory) ->
                dataLine -> dataLine.getBoolean(Column.FLAG.name()))) {
            Assert.assertTrue(reader.readRecord());
            Assert.assertFalse(reader.readRecord());
            Assert.assertThrows(UserException.BadInput.class, reader::readRecord);
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMalformedDouble() throws IOException {
        readNameValuePairs(writeLines("NAME\tVALUE", "a\tone"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingMandatoryColumn() throws IOException {
        readNameValuePairs(writeLines("NAME\tFLAG", "a\ttrue"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWrongNumberOfValues() throws IOException {
        readNameValuePairs(writeLines("NAME\tVALUE", "a\t1\t2"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingHeader() throws IOException {
        readNameValuePairs(writeLines("# only a comment"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRepeatedColumnNames() {
        new TableColumnCollection("NAME", "VALUE", "NAME");
    }

    @Test
    public void testColumnMatching() {
        final TableColumnCollection columns = new TableColumnCollection("NAME", "f_0", "f_1");
        Assert.assertTrue(columns.matchesExactly("NAME", "f_0", "f_1"));
        Assert.assertFalse(columns.matchesExactly("NAME", "f_1", "f_0"));
        Assert.assertTrue(columns.containsExactly("NAME", "f_1", "f_0"));
        Assert.assertEquals(columns.indexOf("f_1"), 2);
        Assert.assertEquals(columns.indexOf("f_2"), -1);
    }
}
