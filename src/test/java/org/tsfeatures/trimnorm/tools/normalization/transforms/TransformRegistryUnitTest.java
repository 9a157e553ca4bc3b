package org.tsfeatures.trimnorm.tools.normalization.transforms;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;

import java.util.ArrayList;
import java.util.Arrays;

public final class TransformRegistryUnitTest extends BaseTest {

    @Test
    public void testDefaultRegistryKnowsStandardTransforms() {
        final TransformRegistry registry = TransformRegistry.createDefault();
        Assert.assertEquals(new ArrayList<>(registry.names()), Arrays.asList(
                "maxmin", "zscore", "sigmoid", "scaledSigmoid", "robustSigmoid", "scaledRobustSigmoid", "mixedSigmoid"));
        Assert.assertSame(registry.get("zscore"), StandardTransform.Z_SCORE);
        Assert.assertFalse(registry.contains("ZScore"));
    }

    @Test
    public void testCustomTransform() {
        final TransformRegistry registry = new TransformRegistry().register("negate", data -> data.scalarMultiply(-1.));
        Assert.assertTrue(registry.contains("negate"));
        final RealMatrix result = registry.apply(new Array2DRowRealMatrix(new double[][] {{1, -2}}), "negate");
        assertEqualsDoubleArray(result.getRow(0), new double[] {-1, 2}, 0.);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateName() {
        TransformRegistry.createDefault().register("maxmin", data -> data);
    }

    @Test(expectedExceptions = UserException.UnknownNormalizationFunction.class)
    public void testUnknownName() {
        TransformRegistry.createDefault().get("softmax");
    }

    @Test
    public void testUnknownNameListsKnownNames() {
        try {
            TransformRegistry.createDefault().apply(new Array2DRowRealMatrix(new double[][] {{1}}), "softmax");
            Assert.fail("expected an unknown normalization function");
        } catch (final UserException.UnknownNormalizationFunction e) {
            assertContains(e.getMessage(), "softmax");
            assertContains(e.getMessage(), "mixedSigmoid");
        }
    }
}
