package org.tsfeatures.trimnorm.tools.normalization;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;

import java.util.Locale;

public final class NormalizationArgumentCollectionUnitTest extends BaseTest {

    @Test
    public void testDefaults() {
        final NormalizationArgumentCollection arguments = new NormalizationArgumentCollection();
        Assert.assertEquals(arguments.getNormalizationFunction(), "mixedSigmoid");
        Assert.assertEquals(arguments.getObservationGoodValueThreshold(), 0.70, 0.);
        Assert.assertEquals(arguments.getFeatureGoodValueThreshold(), 1.0, 0.);
        Assert.assertEquals(arguments.getThresholds(), new ThresholdPair(0.70, 1.0));
        Assert.assertFalse(arguments.isClassVarianceFilter());
        Assert.assertFalse(arguments.isKeepCalculationTimes());
        arguments.validate();
    }

    @Test
    public void testReproducibilityCommand() {
        final Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            final String command = new NormalizationArgumentCollection()
                    .setNormalizationFunction("zscore")
                    .setObservationGoodValueThreshold(0.25)
                    .setClassVarianceFilter(true)
                    .getReproducibilityCommand();
            Assert.assertEquals(command,
                    "TrimAndNormalizeFeatures --normalization-function zscore " +
                            "--observation-good-value-threshold 0.250000 --feature-good-value-threshold 1.000000 " +
                            "--class-variance-filter true --keep-calculation-times false");
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test(expectedExceptions = UserException.InvalidThreshold.class)
    public void testFeatureThresholdOutOfRange() {
        new NormalizationArgumentCollection().setFeatureGoodValueThreshold(-0.5).validate();
    }

    @Test(expectedExceptions = UserException.InvalidThreshold.class)
    public void testNaNThreshold() {
        new NormalizationArgumentCollection().setObservationGoodValueThreshold(Double.NaN).validate();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyFunctionName() {
        new NormalizationArgumentCollection().setNormalizationFunction("").validate();
    }

    @Test
    public void testThresholdPairByAxis() {
        final ThresholdPair thresholds = new ThresholdPair(0.25, 0.75);
        Assert.assertEquals(thresholds.forAxis(Axis.OBSERVATIONS), 0.25, 0.);
        Assert.assertEquals(thresholds.forAxis(Axis.FEATURES), 0.75, 0.);
    }
}
