package org.tsfeatures.trimnorm.tools.normalization;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;
import org.tsfeatures.trimnorm.testutils.FeatureMatrixTestUtils;

import java.util.Arrays;
import java.util.stream.Collectors;

public final class PostNormalizationStabilizerUnitTest extends BaseTest {

    private static final double NaN = Double.NaN;

    @Test
    public void testAllMissingColumnIsRemoved() {
        final double[][] data = {{NaN, 1, 2}, {NaN, 2, 5}, {NaN, 3, NaN}};
        final FeatureMatrixCollection result = PostNormalizationStabilizer.removeAllMissingFeatures(
                FeatureMatrixTestUtils.collection(data), "maxmin");
        Assert.assertEquals(result.getFeatures().stream().map(Feature::getName).collect(Collectors.toList()),
                Arrays.asList("f_1", "f_2"));
        assertEqualsDoubleArray(result.getData().getColumn(1), new double[] {2, 5, NaN}, 0.);
    }

    @Test(expectedExceptions = UserException.AllColumnsBadAfterNormalization.class)
    public void testEveryColumnMissing() {
        final double[][] data = {{NaN, NaN}, {NaN, NaN}};
        PostNormalizationStabilizer.removeAllMissingFeatures(FeatureMatrixTestUtils.collection(data), "maxmin");
    }

    @Test
    public void testNearConstantColumnIsRemoved() {
        final double[][] data = {{0, 0.5}, {1, 0.5}, {0.25, 0.5}};
        final FeatureMatrixCollection result = PostNormalizationStabilizer.removeNearConstantFeatures(FeatureMatrixTestUtils.collection(data));
        Assert.assertEquals(result.numFeatures(), 1);
        Assert.assertEquals(result.getFeatures().get(0).getName(), "f_0");
    }

    @Test(expectedExceptions = UserException.AllFeaturesDegenerate.class)
    public void testEveryColumnNearConstant() {
        final double[][] data = {{0.5, 0.5}, {0.5, 0.5}};
        PostNormalizationStabilizer.removeNearConstantFeatures(FeatureMatrixTestUtils.collection(data));
    }

    @Test
    public void testStabilizeRunsBothSweeps() {
        final double[][] data = {
                {NaN, 0.5, 0.0, 0.1},
                {NaN, 0.5, 1.0, NaN},
                {NaN, 0.5, 0.3, 0.9}
        };
        final FeatureMatrixCollection result = PostNormalizationStabilizer.stabilize(FeatureMatrixTestUtils.collection(data), "scaledSigmoid");
        Assert.assertEquals(result.getFeatures().stream().map(Feature::getName).collect(Collectors.toList()),
                Arrays.asList("f_2", "f_3"));
        Assert.assertEquals(result.numObservations(), 3);
    }

    @Test
    public void testStableMatrixIsUnchanged() {
        final FeatureMatrixCollection collection = FeatureMatrixTestUtils.collection(FeatureMatrixTestUtils.distinctValues(3, 3));
        Assert.assertSame(PostNormalizationStabilizer.stabilize(collection, "zscore"), collection);
    }
}
