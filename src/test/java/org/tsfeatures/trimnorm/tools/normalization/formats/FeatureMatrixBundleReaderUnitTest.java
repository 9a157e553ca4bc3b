package org.tsfeatures.trimnorm.tools.normalization.formats;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;
import org.tsfeatures.trimnorm.tools.normalization.Feature;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.MasterOperation;
import org.tsfeatures.trimnorm.tools.normalization.Observation;
import org.tsfeatures.trimnorm.tools.normalization.Provenance;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

public final class FeatureMatrixBundleReaderUnitTest extends BaseTest {

    private static void writeLines(final File directory, final String fileName, final String... lines) {
        try {
            Files.write(new File(directory, fileName).toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * A 3 x 2 bundle as written by the feature-extraction stage, without calculation times or provenance.
     */
    private static File writeMinimalBundle() {
        final File directory = createTempDir("minimalBundle");
        writeLines(directory, FeatureMatrixBundleFormat.OBSERVATIONS_FILE_NAME,
                "# observations",
                "ID\tNAME\tKEYWORDS\tGROUP",
                "11\tsine\tperiodic,clean\tA",
                "12\tnoise\tstochastic\t",
                "13\tlogistic\tchaotic\tB");
        writeLines(directory, FeatureMatrixBundleFormat.FEATURES_FILE_NAME,
                "ID\tNAME\tKEYWORDS\tCODE_STRING\tMASTER_ID",
                "1\tac1\tautocorrelation\tCO_AutoCorr_1\t7",
                "2\tmean\tdistribution\tDN_Mean\t8");
        writeLines(directory, FeatureMatrixBundleFormat.MASTER_OPERATIONS_FILE_NAME,
                "ID\tLABEL\tCODE",
                "7\tCO_AutoCorr\tCO_AutoCorr(y,1:5)",
                "8\tDN_Mean\tDN_Mean(y)");
        writeLines(directory, FeatureMatrixBundleFormat.DATA_FILE_NAME,
                "NAME\tac1\tmean",
                "sine\t0.5\tInf",
                "noise\tNaN\t-Inf",
                "logistic\t-0.25\t1e-3");
        writeLines(directory, FeatureMatrixBundleFormat.QUALITY_FILE_NAME,
                "NAME\tac1\tmean",
                "sine\t0\t1",
                "noise\t0\t0",
                "logistic\t3\t0");
        return directory;
    }

    @Test
    public void testReadMinimalBundle() {
        final FeatureMatrixCollection collection = FeatureMatrixBundleReader.read(writeMinimalBundle());
        Assert.assertEquals(collection.getObservations(), Arrays.asList(
                new Observation(11, "sine", "periodic,clean", "A"),
                new Observation(12, "noise", "stochastic"),
                new Observation(13, "logistic", "chaotic", "B")));
        Assert.assertEquals(collection.getFeatures(), Arrays.asList(
                new Feature(1, "ac1", "autocorrelation", "CO_AutoCorr_1", 7),
                new Feature(2, "mean", "distribution", "DN_Mean", 8)));
        Assert.assertEquals(collection.getMasterOperations(), Arrays.asList(
                new MasterOperation(7, "CO_AutoCorr", "CO_AutoCorr(y,1:5)"),
                new MasterOperation(8, "DN_Mean", "DN_Mean(y)")));
        assertEqualsDoubleArray(collection.getData().getRow(0), new double[] {0.5, Double.POSITIVE_INFINITY}, 0.);
        assertEqualsDoubleArray(collection.getData().getRow(1), new double[] {Double.NaN, Double.NEGATIVE_INFINITY}, 0.);
        assertEqualsDoubleArray(collection.getData().getRow(2), new double[] {-0.25, 0.001}, 0.);
        Assert.assertEquals(collection.getQualityCodes(), new int[][] {{0, 1}, {0, 0}, {3, 0}});
        Assert.assertFalse(collection.hasCalculationTimes());
        Assert.assertEquals(collection.getProvenance(), Provenance.LEGACY);
        Assert.assertFalse(collection.getObservations().get(1).hasGroup());
    }

    @Test
    public void testReadOptionalTables() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.CALCULATION_TIMES_FILE_NAME,
                "NAME\tac1\tmean",
                "sine\t0.01\t0.02",
                "noise\t0.03\tNaN",
                "logistic\t0.05\t0.06");
        writeLines(directory, FeatureMatrixBundleFormat.PROVENANCE_FILE_NAME,
                "KEY\tVALUE",
                "FROM_DATABASE\tfalse",
                "VERSION_CONTROL\tv2.0-1-g1234567");
        final FeatureMatrixCollection collection = FeatureMatrixBundleReader.read(directory);
        Assert.assertTrue(collection.hasCalculationTimes());
        assertEqualsDoubleArray(collection.getCalculationTimes().getRow(1), new double[] {0.03, Double.NaN}, 0.);
        Assert.assertEquals(collection.getProvenance(), new Provenance(false, "v2.0-1-g1234567"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testColumnsOutOfFeatureOrder() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.DATA_FILE_NAME,
                "NAME\tmean\tac1",
                "sine\t0.5\t1",
                "noise\t1\t2",
                "logistic\t2\t3");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testRowsOutOfObservationOrder() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.QUALITY_FILE_NAME,
                "NAME\tac1\tmean",
                "noise\t0\t0",
                "sine\t0\t1",
                "logistic\t3\t0");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMalformedValue() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.QUALITY_FILE_NAME,
                "NAME\tac1\tmean",
                "sine\t0\tbad",
                "noise\t0\t0",
                "logistic\t3\t0");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingMandatoryColumn() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.FEATURES_FILE_NAME,
                "ID\tNAME\tKEYWORDS\tMASTER_ID",
                "1\tac1\tautocorrelation\t7",
                "2\tmean\tdistribution\t8");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testEmptyObservationTable() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.OBSERVATIONS_FILE_NAME, "ID\tNAME\tKEYWORDS");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingDataTable() {
        final File directory = writeMinimalBundle();
        Assert.assertTrue(new File(directory, FeatureMatrixBundleFormat.DATA_FILE_NAME).delete());
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingBundle() {
        FeatureMatrixBundleReader.read(getSafeNonExistentFile("noSuchBundle"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMalformedProvenance() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.PROVENANCE_FILE_NAME,
                "KEY\tVALUE",
                "FROM_DATABASE\tmaybe");
        FeatureMatrixBundleReader.read(directory);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testDuplicateKey() {
        final File directory = writeMinimalBundle();
        writeLines(directory, FeatureMatrixBundleFormat.PROVENANCE_FILE_NAME,
                "KEY\tVALUE",
                "FROM_DATABASE\ttrue",
                "FROM_DATABASE\tfalse");
        FeatureMatrixBundleReader.readProvenance(new File(directory, FeatureMatrixBundleFormat.PROVENANCE_FILE_NAME));
    }

    @Test
    public void testObservationsWithoutGroupColumn() {
        final File directory = createTempDir("observations");
        writeLines(directory, FeatureMatrixBundleFormat.OBSERVATIONS_FILE_NAME,
                "ID\tNAME\tKEYWORDS",
                "1\tonly\t");
        Assert.assertEquals(FeatureMatrixBundleReader.readObservations(new File(directory, FeatureMatrixBundleFormat.OBSERVATIONS_FILE_NAME)),
                Collections.singletonList(new Observation(1, "only", "")));
    }
}
