package org.tsfeatures.trimnorm.tools;

import org.apache.commons.math3.stat.StatUtils;
import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.CommandLineProgramTest;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.ArgumentsBuilder;
import org.tsfeatures.trimnorm.testutils.FeatureMatrixTestUtils;
import org.tsfeatures.trimnorm.tools.normalization.Feature;
import org.tsfeatures.trimnorm.tools.normalization.FeatureMatrixCollection;
import org.tsfeatures.trimnorm.tools.normalization.NormalizationArgumentCollection;
import org.tsfeatures.trimnorm.tools.normalization.NormalizationInfo;
import org.tsfeatures.trimnorm.tools.normalization.Observation;
import org.tsfeatures.trimnorm.tools.normalization.ThresholdPair;
import org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleFormat;
import org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleReader;
import org.tsfeatures.trimnorm.tools.normalization.formats.FeatureMatrixBundleWriter;

import java.io.File;
import java.util.Arrays;
import java.util.stream.Collectors;

public final class TrimAndNormalizeFeaturesIntegrationTest extends CommandLineProgramTest {

    /**
     * Writes a 10 x 6 bundle in which ts_4 misses all but one value, f_2 is constant and f_5 carries a flagged entry.
     */
    private static File writeInputBundle(final File parent) {
        final double[][] data = FeatureMatrixTestUtils.distinctValues(10, 6);
        for (final double[] row : data) {
            row[2] = 3.0;
        }
        Arrays.fill(data[4], Double.NaN);
        data[4][0] = 1.0;
        final int[][] qualityCodes = new int[10][6];
        qualityCodes[7][5] = 1;
        final File bundle = new File(parent, "features");
        FeatureMatrixBundleWriter.writeCollection(FeatureMatrixTestUtils.collectionWithCalculationTimes(data, qualityCodes), bundle);
        return bundle;
    }

    @Test
    public void testDefaultRun() {
        final File input = writeInputBundle(createTempDir("defaultRun"));
        final File output = new File(input.getParentFile(), "normalized");
        runCommandLine(new ArgumentsBuilder().addInput(input).addOutput(output));

        final FeatureMatrixCollection result = FeatureMatrixBundleReader.read(output);
        Assert.assertEquals(result.getObservations().stream().map(Observation::getName).collect(Collectors.toList()),
                Arrays.asList("ts_0", "ts_1", "ts_2", "ts_3", "ts_5", "ts_6", "ts_7", "ts_8", "ts_9"));
        Assert.assertEquals(result.getFeatures().stream().map(Feature::getName).collect(Collectors.toList()),
                Arrays.asList("f_0", "f_1", "f_3", "f_4"));
        for (int j = 0; j < result.numFeatures(); j++) {
            final double[] column = result.getData().getColumn(j);
            Assert.assertEquals(StatUtils.min(column), 0., 1E-9);
            Assert.assertEquals(StatUtils.max(column), 1., 1E-9);
        }
        Assert.assertFalse(result.hasCalculationTimes());
        Assert.assertEquals(result.getMasterOperations(), FeatureMatrixTestUtils.MASTER_OPERATIONS);

        final NormalizationInfo info = FeatureMatrixBundleReader.readNormalizationInfo(output);
        Assert.assertEquals(info.getNormalizationFunction(), NormalizationArgumentCollection.DEFAULT_NORMALIZATION_FUNCTION);
        Assert.assertEquals(info.getThresholds(), new ThresholdPair(0.70, 1.0));
        Assert.assertTrue(new File(output, FeatureMatrixBundleFormat.OBSERVATION_CLUSTERING_FILE_NAME).isFile());
        Assert.assertTrue(new File(output, FeatureMatrixBundleFormat.FEATURE_CLUSTERING_FILE_NAME).isFile());
    }

    @Test
    public void testDefaultOutputLocation() {
        final File input = writeInputBundle(createTempDir("defaultOutput"));
        runCommandLine(new ArgumentsBuilder()
                .addInput(input)
                .add(NormalizationArgumentCollection.NORMALIZATION_FUNCTION_LONG_NAME, "none"));
        final File expectedOutput = new File(input.getParentFile(), "features" + TrimAndNormalizeFeatures.DEFAULT_OUTPUT_SUFFIX);
        Assert.assertTrue(expectedOutput.isDirectory());
        Assert.assertEquals(FeatureMatrixBundleReader.readNormalizationInfo(expectedOutput).getNormalizationFunction(), "none");
    }

    @Test
    public void testCustomSettings() {
        final File input = writeInputBundle(createTempDir("customSettings"));
        final File output = new File(input.getParentFile(), "custom");
        runCommandLine(new ArgumentsBuilder()
                .addInput(input)
                .addOutput(output)
                .add(NormalizationArgumentCollection.NORMALIZATION_FUNCTION_LONG_NAME, "zscore")
                .add(NormalizationArgumentCollection.OBSERVATION_GOOD_VALUE_THRESHOLD_LONG_NAME, 0.0)
                .add(NormalizationArgumentCollection.FEATURE_GOOD_VALUE_THRESHOLD_LONG_NAME, 0.5)
                .add(NormalizationArgumentCollection.KEEP_CALCULATION_TIMES_LONG_NAME, true));

        final FeatureMatrixCollection result = FeatureMatrixBundleReader.read(output);
        // nothing is removed on the observation axis and f_5 keeps enough good values
        Assert.assertEquals(result.numObservations(), 10);
        Assert.assertEquals(result.getFeatures().stream().map(Feature::getName).collect(Collectors.toList()),
                Arrays.asList("f_0", "f_1", "f_3", "f_4", "f_5"));
        Assert.assertTrue(result.hasCalculationTimes());
        Assert.assertEquals(result.getCalculationTimes().getEntry(9, 4), 9005., 0.);
        Assert.assertEquals(FeatureMatrixBundleReader.readNormalizationInfo(output).getThresholds(), new ThresholdPair(0.0, 0.5));
    }

    @Test
    public void testFailedRunWritesNothing() {
        final File parent = createTempDir("failedRun");
        final double[][] data = new double[3][2];
        for (final double[] row : data) {
            Arrays.fill(row, Double.NaN);
        }
        final File input = new File(parent, "missing");
        FeatureMatrixBundleWriter.writeCollection(FeatureMatrixTestUtils.collection(data), input);
        final File output = new File(parent, "output");
        Assert.assertThrows(UserException.ThresholdTooStrict.class,
                () -> runCommandLine(new ArgumentsBuilder().addInput(input).addOutput(output)));
        Assert.assertFalse(output.exists());
    }

    @Test(expectedExceptions = UserException.UnknownNormalizationFunction.class)
    public void testUnknownNormalizationFunction() {
        final File input = writeInputBundle(createTempDir("unknownFunction"));
        runCommandLine(new ArgumentsBuilder()
                .addInput(input)
                .addOutput(new File(input.getParentFile(), "output"))
                .add(NormalizationArgumentCollection.NORMALIZATION_FUNCTION_LONG_NAME, "softmax"));
    }

    @Test(expectedExceptions = UserException.InvalidThreshold.class)
    public void testThresholdOutOfRange() {
        final File input = writeInputBundle(createTempDir("thresholdOutOfRange"));
        runCommandLine(new ArgumentsBuilder()
                .addInput(input)
                .add(NormalizationArgumentCollection.FEATURE_GOOD_VALUE_THRESHOLD_LONG_NAME, 1.5));
    }

    @Test(expectedExceptions = UserException.InvalidThreshold.class)
    public void testObservationThresholdOutOfRange() {
        final File input = writeInputBundle(createTempDir("observationThresholdOutOfRange"));
        runCommandLine(new ArgumentsBuilder()
                .addInput(input)
                .add(NormalizationArgumentCollection.OBSERVATION_GOOD_VALUE_THRESHOLD_LONG_NAME, 2.0));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInput() {
        runCommandLine(new ArgumentsBuilder().addInput(getSafeNonExistentFile("noBundle")));
    }
}
