package org.tsfeatures.trimnorm.tools.normalization;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.TrimNormException;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;
import org.tsfeatures.trimnorm.testutils.FeatureMatrixTestUtils;
import org.tsfeatures.trimnorm.tools.normalization.transforms.TransformRegistry;

public final class NormalizationDispatcherUnitTest extends BaseTest {

    private static TransformRegistry testRegistry() {
        return TransformRegistry.createDefault()
                .register("double", data -> data.scalarMultiply(2.))
                .register("dropLastColumn", data -> data.getSubMatrix(0, data.getRowDimension() - 1, 0, data.getColumnDimension() - 2))
                .register("nothingReturned", data -> null);
    }

    @DataProvider(name = "identityNames")
    public Object[][] identityNames() {
        return new Object[][] {{"none"}, {"nothing"}};
    }

    @Test(dataProvider = "identityNames")
    public void testIdentityLeavesDataUnchanged(final String name) {
        final FeatureMatrixCollection collection = FeatureMatrixTestUtils.collection(FeatureMatrixTestUtils.distinctValues(3, 3));
        final FeatureMatrixCollection result = new NormalizationDispatcher(testRegistry()).apply(collection, name);
        Assert.assertEquals(result.getData(), collection.getData());
        Assert.assertTrue(NormalizationDispatcher.isIdentity(name));
    }

    @Test
    public void testRegisteredTransformIsApplied() {
        final double[][] data = FeatureMatrixTestUtils.distinctValues(3, 2);
        final FeatureMatrixCollection collection = FeatureMatrixTestUtils.collectionWithCalculationTimes(data, new int[][] {{0, 1}, {0, 0}, {2, 0}});
        final FeatureMatrixCollection result = new NormalizationDispatcher(testRegistry()).apply(collection, "double");
        for (int i = 0; i < data.length; i++) {
            assertEqualsDoubleArray(result.getData().getRow(i), new double[] {2 * data[i][0], 2 * data[i][1]}, 0.);
        }
        Assert.assertEquals(result.getQualityCodes(), collection.getQualityCodes());
        Assert.assertEquals(result.getCalculationTimes(), collection.getCalculationTimes());
        Assert.assertEquals(result.getObservations(), collection.getObservations());
    }

    @Test
    public void testNewMissingValuesAreKept() {
        final double[][] data = {{1, 5}, {2, 5}, {3, 5}};
        final FeatureMatrixCollection result = new NormalizationDispatcher(testRegistry())
                .apply(FeatureMatrixTestUtils.collection(data), "maxmin");
        assertEqualsDoubleArray(result.getData().getColumn(0), new double[] {0, 0.5, 1}, 1E-12);
        assertEqualsDoubleArray(result.getData().getColumn(1), new double[] {Double.NaN, Double.NaN, Double.NaN}, 0.);
    }

    @Test(expectedExceptions = UserException.UnknownNormalizationFunction.class)
    public void testUnknownFunction() {
        new NormalizationDispatcher(testRegistry())
                .apply(FeatureMatrixTestUtils.collection(FeatureMatrixTestUtils.distinctValues(3, 3)), "notAFunction");
    }

    @Test(expectedExceptions = TrimNormException.TransformShapeMismatch.class)
    public void testShapeChangingTransform() {
        new NormalizationDispatcher(testRegistry())
                .apply(FeatureMatrixTestUtils.collection(FeatureMatrixTestUtils.distinctValues(3, 3)), "dropLastColumn");
    }

    @Test(expectedExceptions = TrimNormException.class)
    public void testTransformReturningNothing() {
        new NormalizationDispatcher(testRegistry())
                .apply(FeatureMatrixTestUtils.collection(FeatureMatrixTestUtils.distinctValues(3, 3)), "nothingReturned");
    }
}
